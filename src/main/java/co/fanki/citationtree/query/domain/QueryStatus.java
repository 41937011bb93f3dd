package co.fanki.citationtree.query.domain;

/**
 * State of an outstanding submission.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum QueryStatus {

    /** Waiting for a worker. */
    QUEUED,

    /** A worker is executing it. */
    RUNNING

}
