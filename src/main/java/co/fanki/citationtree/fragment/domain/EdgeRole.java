package co.fanki.citationtree.fragment.domain;

/**
 * Role of the node outside a fragment, relative to the node inside.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum EdgeRole {

    /** The external node is the source of the tree edge. */
    PARENT,

    /** The external node is the target of the tree edge. */
    CHILD

}
