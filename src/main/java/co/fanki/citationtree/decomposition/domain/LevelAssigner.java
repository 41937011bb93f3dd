package co.fanki.citationtree.decomposition.domain;

import java.util.Arrays;

/**
 * Assigns topological levels over the tree edges, starting from every root.
 *
 * <p>Both modes advance frontier by frontier, so the level of a node never
 * depends on the order nodes happen to be dequeued.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class LevelAssigner {

    private LevelAssigner() {
    }

    /**
     * Computes the levels.
     *
     * @param tree the tree graph, must be acyclic
     * @param mode how levels are measured
     * @return the level of every vertex
     * @throws DecompositionInvariantException if some vertex is never
     *         reached, which only happens when the graph has a cycle
     */
    public static TopologicalLevels assign(final Digraph tree,
            final LevelMode mode) {
        final int n = tree.vertexCount();
        final int[] levels = new int[n];
        Arrays.fill(levels, -1);

        int[] frontier = new int[n];
        int frontierSize = 0;
        for (int v = 0; v < n; v++) {
            if (tree.inEdges(v).length == 0) {
                levels[v] = 0;
                frontier[frontierSize++] = v;
            }
        }
        final int roots = frontierSize;

        final int reached = mode == LevelMode.LONGEST_PATH
                ? longestPath(tree, levels, frontier, frontierSize)
                : shortestPath(tree, levels, frontier, frontierSize);

        if (reached != n) {
            throw new DecompositionInvariantException("Levels reached "
                    + reached + " of " + n + " nodes, tree edges have a cycle");
        }
        return new TopologicalLevels(levels, roots);
    }

    /** A node joins the next frontier once all its parents are placed. */
    private static int longestPath(final Digraph tree, final int[] levels,
            final int[] roots, final int rootCount) {
        final int[] pendingParents = new int[tree.vertexCount()];
        for (int v = 0; v < tree.vertexCount(); v++) {
            pendingParents[v] = tree.inEdges(v).length;
        }
        int[] frontier = roots;
        int size = rootCount;
        int[] next = new int[tree.vertexCount()];
        int reached = rootCount;
        int level = 0;
        while (size > 0) {
            int nextSize = 0;
            for (int i = 0; i < size; i++) {
                for (final int e : tree.outEdges(frontier[i])) {
                    final int w = tree.target(e);
                    if (--pendingParents[w] == 0) {
                        levels[w] = level + 1;
                        next[nextSize++] = w;
                    }
                }
            }
            reached += nextSize;
            final int[] swap = frontier;
            frontier = next;
            next = swap;
            size = nextSize;
            level++;
        }
        return reached;
    }

    /** A node takes the level of the first frontier that touches it. */
    private static int shortestPath(final Digraph tree, final int[] levels,
            final int[] roots, final int rootCount) {
        int[] frontier = roots;
        int size = rootCount;
        int[] next = new int[tree.vertexCount()];
        int reached = rootCount;
        int level = 0;
        while (size > 0) {
            int nextSize = 0;
            for (int i = 0; i < size; i++) {
                for (final int e : tree.outEdges(frontier[i])) {
                    final int w = tree.target(e);
                    if (levels[w] == -1) {
                        levels[w] = level + 1;
                        next[nextSize++] = w;
                    }
                }
            }
            reached += nextSize;
            final int[] swap = frontier;
            frontier = next;
            next = swap;
            size = nextSize;
            level++;
        }
        return reached;
    }

}
