package co.fanki.citationtree.decomposition.domain;

import java.util.BitSet;

/**
 * A heuristic that picks edges whose removal breaks the cycles of a graph.
 *
 * <p>Implementations are best effort: the returned set is expected to leave
 * the graph acyclic, but {@link FeedbackArcSetSolver} verifies it and retries
 * on the residual cycles when it does not.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface FeedbackArcSetStrategy {

    /** @return the type this strategy implements */
    FeedbackArcSetStrategyType type();

    /**
     * Tells whether this strategy can handle the graph.
     *
     * @param graph the graph to break
     * @return false when the strategy declines the graph
     */
    boolean isApplicable(Digraph graph);

    /**
     * Picks the edges to remove.
     *
     * @param graph the graph to break, usually one strongly connected
     *        component
     * @return the local indexes of the edges to remove
     */
    BitSet findFeedbackEdges(Digraph graph);

}
