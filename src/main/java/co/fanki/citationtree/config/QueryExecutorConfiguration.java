package co.fanki.citationtree.config;

import co.fanki.citationtree.query.domain.QueryExecutor;
import co.fanki.citationtree.query.domain.QueryExecutorSettings;
import co.fanki.citationtree.query.domain.QueryStatistics;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Wires the query executor that runs every request-path store read.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class QueryExecutorConfiguration {

    /**
     * Binds the executor sizing and timeouts.
     *
     * @param interactivePoolSize workers of the interactive lane
     * @param batchPoolSize workers of the batch lane
     * @param queueCapacity pending submissions per lane
     * @param viewportTimeout viewport query timeout
     * @param overviewTimeout overview query timeout
     * @param edgeBatchTimeout edge batch query timeout
     * @return the settings
     */
    @Bean
    public QueryExecutorSettings queryExecutorSettings(
            @Value("${query.interactive-pool-size:8}")
            final int interactivePoolSize,
            @Value("${query.batch-pool-size:4}") final int batchPoolSize,
            @Value("${query.queue-capacity:256}") final int queueCapacity,
            @Value("${query.timeouts.viewport:5s}")
            final Duration viewportTimeout,
            @Value("${query.timeouts.overview:10s}")
            final Duration overviewTimeout,
            @Value("${query.timeouts.edge-batch:15s}")
            final Duration edgeBatchTimeout) {
        return new QueryExecutorSettings(interactivePoolSize, batchPoolSize,
                queueCapacity, viewportTimeout, overviewTimeout,
                edgeBatchTimeout);
    }

    /**
     * Process wide query counters.
     *
     * @return the statistics
     */
    @Bean
    public QueryStatistics queryStatistics() {
        return new QueryStatistics();
    }

    /**
     * The executor, shut down with the context.
     *
     * @param settings the settings
     * @param statistics the counters to record into
     * @return the executor
     */
    @Bean(destroyMethod = "shutdown")
    public QueryExecutor queryExecutor(final QueryExecutorSettings settings,
            final QueryStatistics statistics) {
        return new QueryExecutor(settings, statistics);
    }

}
