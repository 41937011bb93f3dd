package co.fanki.citationtree.decomposition.domain;

/**
 * Which strongly connected components a run breaks.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum DecompositionScope {

    /**
     * Only the largest component. Any other cycle fails the global
     * acyclicity check.
     */
    LARGEST_COMPONENT,

    /** Every component with more than one vertex. */
    ALL_COMPONENTS

}
