package co.fanki.citationtree.decomposition.domain;

import java.util.Optional;

/**
 * Kahn topological sort used as the acyclicity verdict of every
 * decomposition step.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class AcyclicityCheck {

    private AcyclicityCheck() {
    }

    /**
     * Computes a topological order of the graph.
     *
     * @param graph the graph to sort
     * @return the vertices in topological order, or empty if the graph has a
     *         cycle
     */
    public static Optional<int[]> topologicalOrder(final Digraph graph) {
        final int n = graph.vertexCount();
        final int[] inDegree = new int[n];
        for (int v = 0; v < n; v++) {
            inDegree[v] = graph.inEdges(v).length;
        }

        final int[] order = new int[n];
        int head = 0;
        int tail = 0;
        for (int v = 0; v < n; v++) {
            if (inDegree[v] == 0) {
                order[tail++] = v;
            }
        }
        while (head < tail) {
            final int v = order[head++];
            for (final int e : graph.outEdges(v)) {
                final int w = graph.target(e);
                if (--inDegree[w] == 0) {
                    order[tail++] = w;
                }
            }
        }
        return tail == n ? Optional.of(order) : Optional.empty();
    }

    /**
     * Checks whether the graph admits a topological order.
     *
     * @param graph the graph to check
     * @return true if the graph has no directed cycle
     */
    public static boolean isAcyclic(final Digraph graph) {
        return topologicalOrder(graph).isPresent();
    }

}
