package co.fanki.citationtree.query.domain;

import java.util.concurrent.Callable;

/**
 * The submissions of one request.
 *
 * <p>Every submission gets the id {@code <requestId>-<n>}, with {@code n}
 * drawn from a counter shared by the whole executor. Cancelling the
 * request cancels its outstanding submissions and makes later ones fail
 * with {@link QueryCancelledException} without reaching a worker. Closing
 * the scope unregisters the request id.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class QueryScope implements AutoCloseable {

    private final QueryExecutor executor;

    private final String requestId;

    private volatile boolean cancelled;

    QueryScope(final QueryExecutor theExecutor, final String theRequestId) {
        this.executor = theExecutor;
        this.requestId = theRequestId;
    }

    /**
     * Runs a read and waits for it within the timeout of its kind.
     *
     * @param <T> the result type
     * @param kind the query kind
     * @param description what the read does, for introspection
     * @param work the read, must not mutate shared state
     * @return the result
     * @throws QueryTimeoutException if the timeout elapsed first
     * @throws QueryCancelledException if the request was cancelled
     * @throws QueryExecutionException if the work failed
     * @throws co.fanki.citationtree.shared.DomainException with code
     *         {@code QUERY_REJECTED} if the lane is full
     */
    public <T> T execute(final QueryKind kind, final String description,
            final Callable<T> work) {
        return executor.execute(this, kind, description, work);
    }

    /** @return the request id */
    public String requestId() {
        return requestId;
    }

    /** @return true once the request was cancelled */
    public boolean isCancelled() {
        return cancelled;
    }

    void markCancelled() {
        cancelled = true;
    }

    /** Unregisters the request id from the executor. */
    @Override
    public void close() {
        executor.closeScope(this);
    }

}
