package co.fanki.citationtree.decomposition.domain;

import co.fanki.citationtree.graph.domain.CitationEdge;
import co.fanki.citationtree.graph.domain.ExtraEdge;

import java.util.List;

/**
 * The verified split of all citations into tree and extra edges.
 *
 * @param treeEdges the edges kept, acyclic as a whole
 * @param extraEdges the removed edges with their enrichment priority
 * @param treeGraph the tree edges over every node of the citation graph
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record EdgePartition(
        List<CitationEdge> treeEdges,
        List<ExtraEdge> extraEdges,
        Digraph treeGraph) {

    /**
     * Creates an EdgePartition.
     */
    public EdgePartition {
        treeEdges = List.copyOf(treeEdges);
        extraEdges = List.copyOf(extraEdges);
    }

}
