package co.fanki.citationtree.query.application;

import co.fanki.citationtree.query.domain.ActiveQuery;
import co.fanki.citationtree.query.domain.QueryExecutor;
import co.fanki.citationtree.query.domain.QueryStatistics;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Introspection and cancellation of in-flight queries.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/queries")
@Tag(name = "Queries", description = "In-flight query control")
public class QueryAdminController {

    private static final Logger LOG = LoggerFactory.getLogger(
            QueryAdminController.class);

    private final QueryExecutor queryExecutor;

    /**
     * Creates a new QueryAdminController.
     *
     * @param theQueryExecutor the query executor
     */
    public QueryAdminController(final QueryExecutor theQueryExecutor) {
        this.queryExecutor = theQueryExecutor;
    }

    /**
     * Lists the outstanding queries.
     *
     * @return the queries, longest running first
     */
    @GetMapping
    @Operation(summary = "List active queries")
    public ResponseEntity<ActiveQueriesResponse> active() {
        final List<ActiveQuery> queries = queryExecutor.activeQueries();
        return ResponseEntity.ok(new ActiveQueriesResponse(queries.size(),
                queries));
    }

    /**
     * Returns the query counters.
     *
     * @return the counters since startup
     */
    @GetMapping("/statistics")
    @Operation(summary = "Get query statistics")
    public ResponseEntity<QueryStatistics.Snapshot> statistics() {
        return ResponseEntity.ok(queryExecutor.statistics().snapshot());
    }

    /**
     * Cancels a request, or a single query, by id.
     *
     * @param requestId a request id or a query id
     * @return 200 if something was cancelled, 404 otherwise
     */
    @DeleteMapping("/{requestId}")
    @Operation(summary = "Cancel a request",
            description = "Cancels every query of the request. Query ids are"
                    + " accepted too")
    public ResponseEntity<CancelResponse> cancel(
            @PathVariable final String requestId) {
        LOG.info("Cancel requested for {}", requestId);
        if (queryExecutor.cancel(requestId)) {
            return ResponseEntity.ok(new CancelResponse(requestId, 1));
        }
        return ResponseEntity.status(404).body(new CancelResponse(requestId, 0));
    }

    /**
     * Cancels every outstanding query.
     *
     * @return how many were cancelled
     */
    @DeleteMapping
    @Operation(summary = "Cancel all queries")
    public ResponseEntity<CancelResponse> cancelAll() {
        return ResponseEntity.ok(new CancelResponse(null,
                queryExecutor.cancelAll()));
    }

    /**
     * Active queries response.
     *
     * @param count the number of queries
     * @param queries the queries
     */
    public record ActiveQueriesResponse(int count, List<ActiveQuery> queries) {}

    /**
     * Cancellation response.
     *
     * @param id the cancelled id, null when cancelling everything
     * @param cancelled how many were cancelled
     */
    public record CancelResponse(String id, int cancelled) {}

}
