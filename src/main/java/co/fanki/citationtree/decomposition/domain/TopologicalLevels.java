package co.fanki.citationtree.decomposition.domain;

/**
 * Level of every vertex of a tree graph.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class TopologicalLevels {

    private final int[] levels;

    private final int maxLevel;

    private final int rootCount;

    TopologicalLevels(final int[] theLevels, final int theRootCount) {
        this.levels = theLevels;
        this.rootCount = theRootCount;
        int max = -1;
        for (final int level : theLevels) {
            max = Math.max(max, level);
        }
        this.maxLevel = max;
    }

    /**
     * @param vertex the vertex index
     * @return the level of the vertex, 0 for roots
     */
    public int level(final int vertex) {
        return levels[vertex];
    }

    /** @return the number of vertices */
    public int size() {
        return levels.length;
    }

    /** @return the deepest level, -1 for an empty graph */
    public int maxLevel() {
        return maxLevel;
    }

    /** @return the number of vertices without incoming tree edges */
    public int rootCount() {
        return rootCount;
    }

}
