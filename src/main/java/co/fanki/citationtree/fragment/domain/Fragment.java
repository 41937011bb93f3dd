package co.fanki.citationtree.fragment.domain;

import co.fanki.citationtree.graph.domain.CitationEdge;
import co.fanki.citationtree.graph.domain.CitationNode;
import co.fanki.citationtree.graph.domain.ExtraEdge;

import java.util.List;

/**
 * Nodes and edges returned for one viewport page.
 *
 * @param nodes the nodes of the page, degree descending then id
 * @param treeEdges tree edges with both ends in {@code nodes}
 * @param brokenEdges tree edges with one end outside {@code nodes}
 * @param extraEdges extra edges inside {@code nodes}, when requested
 * @param hasMore true when later pages hold more matches
 * @param stats paging figures
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Fragment(
        List<CitationNode> nodes,
        List<CitationEdge> treeEdges,
        List<BrokenEdge> brokenEdges,
        List<ExtraEdge> extraEdges,
        boolean hasMore,
        Stats stats) {

    /** Copies the lists. */
    public Fragment {
        nodes = List.copyOf(nodes);
        treeEdges = List.copyOf(treeEdges);
        brokenEdges = List.copyOf(brokenEdges);
        extraEdges = List.copyOf(extraEdges);
    }

    /**
     * A fragment without nodes.
     *
     * @param totalMatches matches of the whole query
     * @param offset the requested offset
     * @param limit the requested limit
     * @return the empty fragment, {@code hasMore} false
     */
    public static Fragment empty(final int totalMatches, final int offset,
            final int limit) {
        return new Fragment(List.of(), List.of(), List.of(), List.of(), false,
                new Stats(totalMatches, 0, offset, limit));
    }

    /**
     * Paging figures of a fragment.
     *
     * @param totalMatches nodes matching the query over all pages
     * @param returned nodes in this page
     * @param offset the page offset
     * @param limit the page size
     */
    public record Stats(int totalMatches, int returned, int offset,
            int limit) {
    }

}
