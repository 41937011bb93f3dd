package co.fanki.citationtree.config;

import co.fanki.citationtree.decomposition.domain.DecompositionRun;
import co.fanki.citationtree.decomposition.domain.DecompositionRunRepository;
import co.fanki.citationtree.spatial.domain.SpatialIndexService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Health check controller providing endpoints for liveness and readiness probes.
 *
 * <p>Provides /health for basic liveness check and /ready for readiness
 * check that verifies database connectivity, reports how many nodes the
 * spatial index holds and which decomposition is published.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
public class HealthCheckController {

    private static final Logger LOG = LoggerFactory.getLogger(
            HealthCheckController.class);

    private final DataSource dataSource;

    private final SpatialIndexService spatialIndex;

    private final DecompositionRunRepository runRepository;

    /**
     * Creates a new HealthCheckController.
     *
     * @param theDataSource the data source for database connectivity checks
     * @param theSpatialIndex the spatial index
     * @param theRunRepository the decomposition run repository
     */
    public HealthCheckController(final DataSource theDataSource,
            final SpatialIndexService theSpatialIndex,
            final DecompositionRunRepository theRunRepository) {
        this.dataSource = theDataSource;
        this.spatialIndex = theSpatialIndex;
        this.runRepository = theRunRepository;
    }

    /**
     * Liveness probe endpoint.
     *
     * @return "ok" string
     */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("ok");
    }

    /**
     * Readiness probe endpoint.
     *
     * @return status map with component health information
     */
    @GetMapping("/ready")
    public ResponseEntity<Map<String, Object>> ready() {
        final boolean databaseHealthy = checkDatabaseHealth();

        final Map<String, Object> status = new LinkedHashMap<>();
        status.put("status", databaseHealthy ? "ready" : "not_ready");
        status.put("database", databaseHealthy ? "connected" : "disconnected");
        status.put("indexedNodes", spatialIndex.snapshot().size());

        if (databaseHealthy) {
            status.put("decomposition", publishedDecomposition());
            return ResponseEntity.ok(status);
        }
        return ResponseEntity.status(503).body(status);
    }

    private Map<String, Object> publishedDecomposition() {
        final Optional<DecompositionRun> latest =
                runRepository.findLatestCompleted();
        if (latest.isEmpty()) {
            return Map.of("published", false);
        }
        final DecompositionRun run = latest.get();
        return Map.of(
            "published", true,
            "runId", run.id(),
            "treeEdges", run.treeEdgeCount(),
            "extraEdges", run.extraEdgeCount(),
            "finishedAt", run.finishedAt().toString()
        );
    }

    private boolean checkDatabaseHealth() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(5);
        } catch (final SQLException e) {
            LOG.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

}
