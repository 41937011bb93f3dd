package co.fanki.citationtree.fragment.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Parses the visible cluster list sent by clients.
 *
 * <p>A malformed list is a data problem, not a request failure: it is logged
 * and the cluster filter is dropped.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ViewportFilterParser {

    private static final Logger LOG = LoggerFactory.getLogger(
            ViewportFilterParser.class);

    private ViewportFilterParser() {
    }

    /**
     * Parses a comma separated list of cluster ids.
     *
     * @param raw the list, e.g. {@code "1,4,7"}; may be null
     * @return the ids, or null when the list is absent, blank or malformed
     */
    public static Set<Integer> parseClusters(final String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        final Set<Integer> clusters = new LinkedHashSet<>();
        for (final String token : raw.split(",")) {
            final String trimmed = token.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            try {
                clusters.add(Integer.parseInt(trimmed));
            } catch (final NumberFormatException e) {
                LOG.warn("Ignoring malformed cluster filter '{}': {} is not"
                        + " a cluster id", raw, trimmed);
                return null;
            }
        }
        return clusters.isEmpty() ? null : clusters;
    }

}
