package co.fanki.citationtree.query.domain;

/**
 * Classes of store reads, each with its own timeout and lane.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum QueryKind {

    /** Viewport fragment lookups and bounds. */
    VIEWPORT(Lane.INTERACTIVE),

    /** Topological overview. */
    OVERVIEW(Lane.INTERACTIVE),

    /** Edge enrichment and tree expansion for a set of nodes. */
    EDGE_BATCH(Lane.BATCH);

    private final Lane lane;

    QueryKind(final Lane theLane) {
        this.lane = theLane;
    }

    /** @return the pool this kind runs on */
    public Lane lane() {
        return lane;
    }

}
