package co.fanki.citationtree.decomposition.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.BitSet;

/**
 * Removes, one at a time, the edge that lies on the most simple cycles.
 *
 * <p>Cycle enumeration is exponential in the worst case. The strategy is a
 * baseline for small graphs: it declines graphs above {@code maxEdges} and
 * stops enumerating after {@code maxCycles} cycles per round.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class CycleMajorityStrategy implements FeedbackArcSetStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(
            CycleMajorityStrategy.class);

    private final int maxCycles;

    private final int maxEdges;

    /**
     * Creates a new CycleMajorityStrategy.
     *
     * @param theMaxCycles cycles enumerated per round at most
     * @param theMaxEdges largest graph the strategy accepts
     */
    public CycleMajorityStrategy(
            @Value("${decomposition.cycle-majority.max-cycles:100000}")
            final int theMaxCycles,
            @Value("${decomposition.cycle-majority.max-edges:5000}")
            final int theMaxEdges) {
        if (theMaxCycles <= 0 || theMaxEdges <= 0) {
            throw new IllegalArgumentException(
                    "Cycle and edge limits must be positive");
        }
        this.maxCycles = theMaxCycles;
        this.maxEdges = theMaxEdges;
    }

    /** {@inheritDoc} */
    @Override
    public FeedbackArcSetStrategyType type() {
        return FeedbackArcSetStrategyType.CYCLE_MAJORITY;
    }

    /** {@inheritDoc} */
    @Override
    public boolean isApplicable(final Digraph graph) {
        if (graph.edgeCount() > maxEdges) {
            LOG.warn("Cycle majority declined: {} edges exceed the limit of {}",
                    graph.edgeCount(), maxEdges);
            return false;
        }
        return true;
    }

    /** {@inheritDoc} */
    @Override
    public BitSet findFeedbackEdges(final Digraph graph) {
        final BitSet removed = new BitSet(graph.edgeCount());
        int rounds = 0;
        while (true) {
            final int[] cycleCount = countCycles(graph, removed);
            int best = -1;
            for (int e = 0; e < cycleCount.length; e++) {
                if (cycleCount[e] > 0
                        && (best < 0 || cycleCount[e] > cycleCount[best])) {
                    best = e;
                }
            }
            if (best < 0) {
                break;
            }
            removed.set(best);
            rounds++;
        }
        LOG.debug("Cycle majority removed {} edges in {} rounds",
                removed.cardinality(), rounds);
        return removed;
    }

    /**
     * Counts, for every edge, the simple cycles through it.
     *
     * <p>Each cycle is found once, from its lowest vertex, by a depth first
     * search restricted to higher vertices.</p>
     */
    private int[] countCycles(final Digraph graph, final BitSet removed) {
        final int n = graph.vertexCount();
        final int[] counts = new int[graph.edgeCount()];
        final int[] pathVertex = new int[n];
        final int[] pathEdge = new int[n];
        final int[] edgeCursor = new int[n];
        final boolean[] onPath = new boolean[n];
        int found = 0;

        for (int start = 0; start < n && found < maxCycles; start++) {
            int depth = 1;
            pathVertex[0] = start;
            edgeCursor[0] = 0;
            onPath[start] = true;

            while (depth > 0) {
                final int v = pathVertex[depth - 1];
                final int[] out = graph.outEdges(v);
                if (edgeCursor[depth - 1] >= out.length || found >= maxCycles) {
                    onPath[v] = false;
                    depth--;
                    continue;
                }
                final int e = out[edgeCursor[depth - 1]++];
                if (removed.get(e)) {
                    continue;
                }
                final int w = graph.target(e);
                if (w == start) {
                    pathEdge[depth - 1] = e;
                    for (int i = 0; i < depth; i++) {
                        counts[pathEdge[i]]++;
                    }
                    found++;
                } else if (w > start && !onPath[w]) {
                    pathEdge[depth - 1] = e;
                    pathVertex[depth] = w;
                    edgeCursor[depth] = 0;
                    onPath[w] = true;
                    depth++;
                }
            }
        }
        return counts;
    }

}
