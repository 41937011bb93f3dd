package co.fanki.citationtree.decomposition.domain;

import co.fanki.citationtree.graph.domain.CitationEdge;
import co.fanki.citationtree.graph.domain.CitationGraph;
import co.fanki.citationtree.graph.domain.ExtraEdge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Set;

/**
 * Splits the citations into tree and extra edges and verifies the split.
 *
 * <p>Checks performed before the partition is handed out:</p>
 * <ul>
 *   <li>tree and extra edges together are exactly the citation set, with no
 *   edge in both;</li>
 *   <li>both ends of every extra edge lie in one of the broken
 *   components;</li>
 *   <li>the tree edges of the whole graph admit a topological order.</li>
 * </ul>
 * <p>Any failure raises {@link DecompositionInvariantException}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class TreeExtraPartitioner {

    private static final Logger LOG = LoggerFactory.getLogger(
            TreeExtraPartitioner.class);

    private TreeExtraPartitioner() {
    }

    /**
     * Partitions the graph.
     *
     * @param graph the citation graph
     * @param digraph the digraph of the citation graph, labels equal to
     *        indexes
     * @param feedback the edges to remove
     * @param components the components of {@code digraph}
     * @param brokenComponents ids of the components the feedback set was
     *        computed for
     * @return the verified partition
     */
    public static EdgePartition partition(final CitationGraph graph,
            final Digraph digraph, final FeedbackArcSet feedback,
            final ComponentReport components,
            final Set<Integer> brokenComponents) {

        final BitSet removed = new BitSet(graph.edgeCount());
        final List<CitationEdge> treeEdges = new ArrayList<>(
                graph.edgeCount() - feedback.size());
        final List<ExtraEdge> extraEdges = new ArrayList<>(feedback.size());

        for (int e = 0; e < graph.edgeCount(); e++) {
            final CitationEdge edge = graph.edges().get(e);
            final FeedbackArcSetStrategyType removedBy = feedback.removedBy(e);
            if (removedBy == null) {
                treeEdges.add(edge);
                continue;
            }
            final int source = graph.source(e);
            final int target = graph.target(e);
            final int component = components.componentOf(source);
            if (component != components.componentOf(target)
                    || !brokenComponents.contains(component)) {
                throw new DecompositionInvariantException("Extra edge " + edge
                        + " does not lie inside a broken component");
            }
            removed.set(e);
            extraEdges.add(new ExtraEdge(edge.src(), edge.dst(),
                    ExtraEdge.priorityOf(graph.node(source).degree(),
                            graph.node(target).degree()),
                    removedBy.name()));
        }

        if (treeEdges.size() + extraEdges.size() != graph.edgeCount()
                || extraEdges.size() != feedback.size()) {
            throw new DecompositionInvariantException("Partition of "
                    + graph.edgeCount() + " edges produced " + treeEdges.size()
                    + " tree and " + extraEdges.size() + " extra edges");
        }

        final Digraph treeGraph = digraph.withoutEdges(removed);
        if (!AcyclicityCheck.isAcyclic(treeGraph)) {
            throw new DecompositionInvariantException(
                    "Tree edges of the whole graph contain a cycle");
        }

        LOG.info("Partitioned {} edges into {} tree and {} extra edges",
                graph.edgeCount(), treeEdges.size(), extraEdges.size());
        return new EdgePartition(treeEdges, extraEdges, treeGraph);
    }

}
