package co.fanki.citationtree.decomposition.domain;

/**
 * Heuristics available to break the cycles of a component.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum FeedbackArcSetStrategyType {

    /** Eades, Lin and Smyth vertex ordering, the production default. */
    GREEDY_ORDERING,

    /** Drops citations that do not point back in time. */
    CHRONOLOGICAL,

    /** Repeatedly drops the edge shared by most simple cycles. */
    CYCLE_MAJORITY

}
