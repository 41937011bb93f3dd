package co.fanki.citationtree.query.domain;

/**
 * Worker pools of the query executor.
 *
 * <p>Large enrichment batches run on their own pool so they cannot starve
 * interactive viewport lookups.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum Lane {

    /** Small, latency sensitive reads. */
    INTERACTIVE,

    /** Multi node edge batches. */
    BATCH

}
