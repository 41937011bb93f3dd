package co.fanki.citationtree.decomposition.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.BitSet;

/**
 * Breaks cycles using publication years.
 *
 * <p>A paper can only cite older work, so an edge whose source was not
 * published strictly after its target is removed. Edges touching a paper
 * without a year are kept. The strategy declines graphs where too few
 * papers carry a year.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class ChronologicalStrategy implements FeedbackArcSetStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(
            ChronologicalStrategy.class);

    private final double minCoverage;

    /**
     * Creates a new ChronologicalStrategy.
     *
     * @param theMinCoverage the minimum share of vertices with a year, in
     *        [0, 1]
     */
    public ChronologicalStrategy(
            @Value("${decomposition.chronological.min-coverage:0.9}")
            final double theMinCoverage) {
        if (theMinCoverage < 0 || theMinCoverage > 1) {
            throw new IllegalArgumentException(
                    "Minimum coverage must be between 0 and 1");
        }
        this.minCoverage = theMinCoverage;
    }

    /** {@inheritDoc} */
    @Override
    public FeedbackArcSetStrategyType type() {
        return FeedbackArcSetStrategyType.CHRONOLOGICAL;
    }

    /** {@inheritDoc} */
    @Override
    public boolean isApplicable(final Digraph graph) {
        final double coverage = coverage(graph);
        LOG.info("Publication year coverage: {}% of {} vertices",
                String.format("%.1f", coverage * 100), graph.vertexCount());
        if (coverage < minCoverage) {
            LOG.warn("Year coverage below {}%, chronological strategy"
                    + " declined", String.format("%.1f", minCoverage * 100));
            return false;
        }
        return true;
    }

    /** {@inheritDoc} */
    @Override
    public BitSet findFeedbackEdges(final Digraph graph) {
        final BitSet backward = new BitSet(graph.edgeCount());
        for (int e = 0; e < graph.edgeCount(); e++) {
            final int sourceYear = graph.year(graph.source(e));
            final int targetYear = graph.year(graph.target(e));
            if (sourceYear != Digraph.NO_YEAR && targetYear != Digraph.NO_YEAR
                    && sourceYear <= targetYear) {
                backward.set(e);
            }
        }
        return backward;
    }

    /**
     * Share of vertices carrying a publication year.
     *
     * @param graph the graph
     * @return a value in [0, 1], 0 for an empty graph
     */
    public static double coverage(final Digraph graph) {
        if (graph.vertexCount() == 0) {
            return 0;
        }
        int withYear = 0;
        for (int v = 0; v < graph.vertexCount(); v++) {
            if (graph.year(v) != Digraph.NO_YEAR) {
                withYear++;
            }
        }
        return (double) withYear / graph.vertexCount();
    }

}
