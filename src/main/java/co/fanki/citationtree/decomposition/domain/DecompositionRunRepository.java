package co.fanki.citationtree.decomposition.domain;

import co.fanki.citationtree.shared.Queries;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for persisting and retrieving decomposition runs.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Repository
public class DecompositionRunRepository {

    private final Jdbi jdbi;

    /**
     * Creates a new DecompositionRunRepository.
     *
     * @param theJdbi the JDBI instance
     */
    public DecompositionRunRepository(final Jdbi theJdbi) {
        this.jdbi = theJdbi;
    }

    /**
     * Saves a new run.
     *
     * @param run the run to save
     */
    public void save(final DecompositionRun run) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                INSERT INTO decomposition_runs (
                    id, strategy, scope, level_mode, status,
                    node_count, edge_count, component_count, largest_component,
                    tree_edge_count, extra_edge_count, max_level, attempts,
                    error_message, started_at, finished_at
                ) VALUES (
                    :id, :strategy, :scope, :levelMode, :status,
                    :nodeCount, :edgeCount, :componentCount, :largestComponent,
                    :treeEdgeCount, :extraEdgeCount, :maxLevel, :attempts,
                    :errorMessage, :startedAt, :finishedAt
                )
                """)
                .bind("id", run.id())
                .bind("strategy", run.strategy().name())
                .bind("scope", run.scope().name())
                .bind("levelMode", run.levelMode().name())
                .bind("status", run.status().name())
                .bind("nodeCount", run.nodeCount())
                .bind("edgeCount", run.edgeCount())
                .bind("componentCount", run.componentCount())
                .bind("largestComponent", run.largestComponent())
                .bind("treeEdgeCount", run.treeEdgeCount())
                .bind("extraEdgeCount", run.extraEdgeCount())
                .bind("maxLevel", run.maxLevel())
                .bind("attempts", run.attempts())
                .bind("errorMessage", run.errorMessage())
                .bind("startedAt", toTimestamp(run.startedAt()))
                .bind("finishedAt", toTimestamp(run.finishedAt()))
                .execute());
    }

    /**
     * Updates an existing run.
     *
     * @param run the run to update
     */
    public void update(final DecompositionRun run) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                UPDATE decomposition_runs SET
                    status = :status,
                    node_count = :nodeCount,
                    edge_count = :edgeCount,
                    component_count = :componentCount,
                    largest_component = :largestComponent,
                    tree_edge_count = :treeEdgeCount,
                    extra_edge_count = :extraEdgeCount,
                    max_level = :maxLevel,
                    attempts = :attempts,
                    error_message = :errorMessage,
                    finished_at = :finishedAt
                WHERE id = :id
                """)
                .bind("id", run.id())
                .bind("status", run.status().name())
                .bind("nodeCount", run.nodeCount())
                .bind("edgeCount", run.edgeCount())
                .bind("componentCount", run.componentCount())
                .bind("largestComponent", run.largestComponent())
                .bind("treeEdgeCount", run.treeEdgeCount())
                .bind("extraEdgeCount", run.extraEdgeCount())
                .bind("maxLevel", run.maxLevel())
                .bind("attempts", run.attempts())
                .bind("errorMessage", run.errorMessage())
                .bind("finishedAt", toTimestamp(run.finishedAt()))
                .execute());
    }

    /**
     * Finds a run by its ID.
     *
     * @param id the run ID
     * @return the run if found
     */
    public Optional<DecompositionRun> findById(final String id) {
        return jdbi.withHandle(handle -> handle
                .createQuery(Queries.RUN_FIND_BY_ID)
                .bind("id", id)
                .map(new DecompositionRunRowMapper())
                .findOne());
    }

    /**
     * Finds the most recent runs, newest first.
     *
     * @param limit how many runs to return
     * @return the runs
     */
    public List<DecompositionRun> findRecent(final int limit) {
        return jdbi.withHandle(handle -> handle
                .createQuery(Queries.RUN_FIND_RECENT)
                .bind("limit", limit)
                .map(new DecompositionRunRowMapper())
                .list());
    }

    /**
     * Finds the latest run that published a decomposition.
     *
     * @return the run if any completed
     */
    public Optional<DecompositionRun> findLatestCompleted() {
        return jdbi.withHandle(handle -> handle
                .createQuery(Queries.RUN_FIND_LATEST_COMPLETED)
                .map(new DecompositionRunRowMapper())
                .findOne());
    }

    private Timestamp toTimestamp(final Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static final class DecompositionRunRowMapper
            implements RowMapper<DecompositionRun> {

        @Override
        public DecompositionRun map(final ResultSet rs,
                final StatementContext ctx) throws SQLException {
            final Timestamp finishedTs = rs.getTimestamp("finished_at");
            return DecompositionRun.reconstitute(
                    rs.getString("id"),
                    FeedbackArcSetStrategyType.valueOf(rs.getString("strategy")),
                    DecompositionScope.valueOf(rs.getString("scope")),
                    LevelMode.valueOf(rs.getString("level_mode")),
                    DecompositionStatus.valueOf(rs.getString("status")),
                    rs.getObject("node_count", Integer.class),
                    rs.getObject("edge_count", Integer.class),
                    rs.getObject("component_count", Integer.class),
                    rs.getObject("largest_component", Integer.class),
                    rs.getObject("tree_edge_count", Integer.class),
                    rs.getObject("extra_edge_count", Integer.class),
                    rs.getObject("max_level", Integer.class),
                    rs.getObject("attempts", Integer.class),
                    rs.getString("error_message"),
                    rs.getTimestamp("started_at").toInstant(),
                    finishedTs != null ? finishedTs.toInstant() : null);
        }
    }

}
