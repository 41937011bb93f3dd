package co.fanki.citationtree.query.domain;

import co.fanki.citationtree.shared.DomainException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs blocking store reads on bounded worker lanes, with a timeout per
 * query kind and cooperative cancellation.
 *
 * <p>A timeout or a cancellation releases the waiting caller; the worker is
 * interrupted but the read is not guaranteed to stop, which is why only
 * side effect free reads may be submitted. Every outcome is counted in the
 * {@link QueryStatistics} handed to the constructor.</p>
 *
 * <p>Callers open a {@link QueryScope} per request and submit through it, so
 * a whole request can be cancelled by its id. Request ids come from clients
 * and may repeat; every scope sharing an id is cancelled together, and query
 * ids stay unique across the executor.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class QueryExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(
            QueryExecutor.class);

    /** Longest description kept for introspection. */
    public static final int MAX_DESCRIPTION_LENGTH = 120;

    private final QueryExecutorSettings settings;

    private final QueryStatistics statistics;

    private final Map<Lane, ThreadPoolExecutor> lanes =
            new EnumMap<>(Lane.class);

    private final Map<String, Submission> outstanding =
            new ConcurrentHashMap<>();

    private final Map<String, Set<QueryScope>> scopes =
            new ConcurrentHashMap<>();

    private final AtomicLong sequence = new AtomicLong();

    /**
     * Creates a new QueryExecutor and starts its lanes.
     *
     * @param theSettings the pool sizes and timeouts
     * @param theStatistics the counters to update
     */
    public QueryExecutor(final QueryExecutorSettings theSettings,
            final QueryStatistics theStatistics) {
        this.settings = theSettings;
        this.statistics = theStatistics;
        for (final Lane lane : Lane.values()) {
            lanes.put(lane, newLane(lane, theSettings.poolSizeFor(lane),
                    theSettings.queueCapacity()));
        }
        LOG.info("Query executor started: {} interactive and {} batch workers,"
                + " queue capacity {}", theSettings.interactivePoolSize(),
                theSettings.batchPoolSize(), theSettings.queueCapacity());
    }

    private static ThreadPoolExecutor newLane(final Lane lane,
            final int size, final int queueCapacity) {
        final AtomicInteger counter = new AtomicInteger();
        final String prefix = "query-" + lane.name().toLowerCase() + "-";
        return new ThreadPoolExecutor(
                size, size,
                0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                r -> {
                    final Thread t = new Thread(r,
                            prefix + counter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Opens the scope of a request.
     *
     * @param requestId the client supplied request id, or null to generate
     *        one
     * @return the scope; close it when the request ends
     */
    public QueryScope openScope(final String requestId) {
        final String id = requestId == null || requestId.isBlank()
                ? UUID.randomUUID().toString() : requestId;
        final QueryScope scope = new QueryScope(this, id);
        scopes.compute(id, (key, live) -> {
            final Set<QueryScope> result = live != null
                    ? live : ConcurrentHashMap.newKeySet();
            result.add(scope);
            return result;
        });
        return scope;
    }

    void closeScope(final QueryScope scope) {
        scopes.computeIfPresent(scope.requestId(), (key, live) -> {
            live.remove(scope);
            return live.isEmpty() ? null : live;
        });
    }

    <T> T execute(final QueryScope scope, final QueryKind kind,
            final String description, final Callable<T> work) {
        final String queryId = scope.requestId() + "-"
                + sequence.incrementAndGet();
        statistics.recordSubmitted();

        if (scope.isCancelled()) {
            statistics.recordCancelled();
            LOG.debug("Query {} not started, request {} was cancelled",
                    queryId, scope.requestId());
            throw new QueryCancelledException("Request " + scope.requestId()
                    + " was cancelled");
        }

        final Submission submission = new Submission(queryId,
                scope.requestId(), kind, truncate(description));
        outstanding.put(queryId, submission);
        try {
            // a cancel between the first check and the put missed this entry
            if (scope.isCancelled()) {
                if (submission.finish(Outcome.CANCELLED)) {
                    statistics.recordCancelled();
                }
                throw cancelled(submission);
            }
            final Future<T> future;
            try {
                future = lanes.get(kind.lane()).submit(() -> {
                    submission.markRunning();
                    return work.call();
                });
            } catch (final RejectedExecutionException e) {
                submission.finish(Outcome.REJECTED);
                statistics.recordRejected();
                LOG.warn("Query {} rejected, {} lane is full", queryId,
                        kind.lane());
                throw new DomainException("The " + kind.lane()
                        + " lane is full, retry later", "QUERY_REJECTED", e);
            }
            submission.attach(future);
            return await(submission, future, settings.timeoutFor(kind));
        } finally {
            outstanding.remove(queryId, submission);
        }
    }

    private <T> T await(final Submission submission, final Future<T> future,
            final Duration timeout) {
        try {
            final T result = future.get(timeout.toNanos(),
                    TimeUnit.NANOSECONDS);
            if (!submission.finish(Outcome.SUCCEEDED)) {
                throw cancelled(submission);
            }
            statistics.recordSucceeded();
            return result;
        } catch (final TimeoutException e) {
            if (!submission.finish(Outcome.TIMED_OUT)) {
                throw cancelled(submission);
            }
            future.cancel(true);
            statistics.recordTimedOut();
            LOG.warn("Query {} timed out after {} ms: {}", submission.queryId,
                    timeout.toMillis(), submission.description);
            throw new QueryTimeoutException("Query " + submission.queryId
                    + " exceeded its " + timeout.toMillis() + " ms timeout");
        } catch (final CancellationException e) {
            throw cancelled(submission);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            if (submission.finish(Outcome.CANCELLED)) {
                future.cancel(true);
                statistics.recordCancelled();
            }
            throw cancelled(submission);
        } catch (final ExecutionException e) {
            if (!submission.finish(Outcome.FAILED)) {
                throw cancelled(submission);
            }
            statistics.recordFailed();
            LOG.error("Query {} failed: {}", submission.queryId,
                    submission.description, e.getCause());
            throw new QueryExecutionException("Query " + submission.queryId
                    + " failed: " + e.getCause().getMessage(), e.getCause());
        }
    }

    private QueryCancelledException cancelled(final Submission submission) {
        LOG.debug("Query {} cancelled", submission.queryId);
        return new QueryCancelledException("Query " + submission.queryId
                + " was cancelled");
    }

    /**
     * Cancels a request or a single query.
     *
     * @param id a request id or a query id
     * @return true if a request scope or a query matched the id
     */
    public boolean cancel(final String id) {
        boolean matched = false;
        final Set<QueryScope> live = scopes.get(id);
        if (live != null) {
            for (final QueryScope scope : live) {
                scope.markCancelled();
                matched = true;
            }
        }
        for (final Submission submission : outstanding.values()) {
            if (submission.requestId.equals(id)
                    || submission.queryId.equals(id)) {
                matched = true;
                cancelSubmission(submission);
            }
        }
        if (matched) {
            LOG.info("Cancelled queries of {}", id);
        }
        return matched;
    }

    /**
     * Cancels every outstanding submission.
     *
     * @return how many submissions were cancelled; queries that completed
     *         meanwhile are not counted
     */
    public int cancelAll() {
        int count = 0;
        for (final Submission submission : outstanding.values()) {
            if (cancelSubmission(submission)) {
                count++;
            }
        }
        LOG.warn("Cancelled all queries: {} outstanding submissions", count);
        return count;
    }

    private boolean cancelSubmission(final Submission submission) {
        if (!submission.finish(Outcome.CANCELLED)) {
            return false;
        }
        statistics.recordCancelled();
        submission.cancelFuture();
        return true;
    }

    /** @return the outstanding submissions, longest running first */
    public List<ActiveQuery> activeQueries() {
        final long now = System.nanoTime();
        final List<ActiveQuery> result = new ArrayList<>();
        for (final Submission submission : outstanding.values()) {
            if (submission.outcome.get() != null) {
                continue;
            }
            result.add(new ActiveQuery(submission.queryId,
                    submission.requestId, submission.kind,
                    submission.status,
                    TimeUnit.NANOSECONDS.toMillis(now - submission.submittedAt),
                    submission.description));
        }
        result.sort(Comparator.comparingLong(ActiveQuery::elapsedMillis)
                .reversed());
        return result;
    }

    /** @return the counters of this executor */
    public QueryStatistics statistics() {
        return statistics;
    }

    /**
     * Stops every lane; running reads are interrupted.
     */
    public void shutdown() {
        LOG.info("Shutting down query executor");
        for (final ThreadPoolExecutor lane : lanes.values()) {
            lane.shutdownNow();
        }
    }

    static String truncate(final String description) {
        if (description == null) {
            return "";
        }
        if (description.length() <= MAX_DESCRIPTION_LENGTH) {
            return description;
        }
        return description.substring(0, MAX_DESCRIPTION_LENGTH - 3) + "...";
    }

    private enum Outcome {
        SUCCEEDED, TIMED_OUT, CANCELLED, FAILED, REJECTED
    }

    /**
     * One submitted unit of work. The first outcome recorded wins, so a
     * query is counted exactly once however its waiter and a cancel race.
     */
    private static final class Submission {

        private final String queryId;
        private final String requestId;
        private final QueryKind kind;
        private final String description;
        private final long submittedAt = System.nanoTime();
        private final AtomicReference<Outcome> outcome =
                new AtomicReference<>();
        private volatile QueryStatus status = QueryStatus.QUEUED;
        private Future<?> future;

        Submission(final String theQueryId, final String theRequestId,
                final QueryKind theKind, final String theDescription) {
            queryId = theQueryId;
            requestId = theRequestId;
            kind = theKind;
            description = theDescription;
        }

        void markRunning() {
            status = QueryStatus.RUNNING;
        }

        boolean finish(final Outcome theOutcome) {
            return outcome.compareAndSet(null, theOutcome);
        }

        synchronized void attach(final Future<?> theFuture) {
            future = theFuture;
            if (outcome.get() == Outcome.CANCELLED) {
                theFuture.cancel(true);
            }
        }

        synchronized void cancelFuture() {
            if (future != null) {
                future.cancel(true);
            }
        }
    }

}
