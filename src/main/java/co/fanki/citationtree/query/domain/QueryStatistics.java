package co.fanki.citationtree.query.domain;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Outcome counters of a query executor.
 *
 * <p>Owned by whoever builds the executor and passed to it; every counter is
 * thread safe. Each submission ends in exactly one of succeeded, timed out,
 * cancelled, failed or rejected.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class QueryStatistics {

    private final AtomicLong submitted = new AtomicLong();
    private final AtomicLong succeeded = new AtomicLong();
    private final AtomicLong timedOut = new AtomicLong();
    private final AtomicLong cancelled = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();

    void recordSubmitted() {
        submitted.incrementAndGet();
    }

    void recordSucceeded() {
        succeeded.incrementAndGet();
    }

    void recordTimedOut() {
        timedOut.incrementAndGet();
    }

    void recordCancelled() {
        cancelled.incrementAndGet();
    }

    void recordFailed() {
        failed.incrementAndGet();
    }

    void recordRejected() {
        rejected.incrementAndGet();
    }

    /** @return a consistent enough copy of the counters */
    public Snapshot snapshot() {
        return new Snapshot(submitted.get(), succeeded.get(), timedOut.get(),
                cancelled.get(), failed.get(), rejected.get());
    }

    /**
     * Point in time copy of the counters.
     *
     * @param submitted every submission accepted or rejected
     * @param succeeded results returned to the caller
     * @param timedOut callers released by their timeout
     * @param cancelled submissions cancelled before a result surfaced
     * @param failed submissions whose work threw
     * @param rejected submissions refused by a full lane
     */
    public record Snapshot(
            long submitted,
            long succeeded,
            long timedOut,
            long cancelled,
            long failed,
            long rejected) {
    }

}
