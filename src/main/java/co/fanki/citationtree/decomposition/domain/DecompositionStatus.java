package co.fanki.citationtree.decomposition.domain;

/**
 * Lifecycle of a decomposition run.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum DecompositionStatus {

    /** The pipeline is executing. */
    RUNNING,

    /** Tree and extra edges and levels were published. */
    COMPLETED,

    /** The run aborted, the previous decomposition is still served. */
    FAILED;

    /**
     * Checks if the run has finished, whatever the outcome.
     *
     * @return true for completed and failed runs
     */
    public boolean isFinished() {
        return this != RUNNING;
    }

}
