package co.fanki.citationtree.decomposition.domain;

/**
 * How topological levels are measured from the roots.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum LevelMode {

    /**
     * Length of the longest tree path from any root. Every tree edge goes
     * from a lower to a strictly higher level.
     */
    LONGEST_PATH,

    /**
     * Length of the shortest tree path from any root. A tree edge may join
     * two nodes of the same level, or point to a lower one.
     */
    SHORTEST_PATH

}
