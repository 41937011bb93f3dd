package co.fanki.citationtree.query.domain;

import co.fanki.citationtree.shared.Preconditions;

import java.time.Duration;

/**
 * Sizing and timeouts of a query executor.
 *
 * @param interactivePoolSize workers of the interactive lane
 * @param batchPoolSize workers of the batch lane
 * @param queueCapacity pending submissions per lane
 * @param viewportTimeout timeout of viewport queries
 * @param overviewTimeout timeout of overview queries
 * @param edgeBatchTimeout timeout of edge batch queries
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record QueryExecutorSettings(
        int interactivePoolSize,
        int batchPoolSize,
        int queueCapacity,
        Duration viewportTimeout,
        Duration overviewTimeout,
        Duration edgeBatchTimeout) {

    /** Validates the settings. */
    public QueryExecutorSettings {
        Preconditions.requirePositive(interactivePoolSize,
                "Interactive pool size must be positive");
        Preconditions.requirePositive(batchPoolSize,
                "Batch pool size must be positive");
        Preconditions.requirePositive(queueCapacity,
                "Queue capacity must be positive");
        requirePositive(viewportTimeout, "Viewport timeout");
        requirePositive(overviewTimeout, "Overview timeout");
        requirePositive(edgeBatchTimeout, "Edge batch timeout");
    }

    /**
     * @param kind the query kind
     * @return how long a caller waits for that kind
     */
    public Duration timeoutFor(final QueryKind kind) {
        return switch (kind) {
            case VIEWPORT -> viewportTimeout;
            case OVERVIEW -> overviewTimeout;
            case EDGE_BATCH -> edgeBatchTimeout;
        };
    }

    /**
     * @param lane the lane
     * @return the number of workers of the lane
     */
    public int poolSizeFor(final Lane lane) {
        return lane == Lane.INTERACTIVE ? interactivePoolSize : batchPoolSize;
    }

    private static void requirePositive(final Duration timeout,
            final String name) {
        Preconditions.requireNonNull(timeout, name + " is required");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

}
