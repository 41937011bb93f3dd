package co.fanki.citationtree.graph.domain;

import co.fanki.citationtree.shared.Queries;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.mapper.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Read access to the persisted extra (feedback) edges.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Repository
public class ExtraEdgeRepository {

    private static final RowMapper<ExtraEdge> EXTRA_MAPPER =
            (rs, ctx) -> new ExtraEdge(
                    rs.getString("src"),
                    rs.getString("dst"),
                    rs.getDouble("priority"),
                    rs.getString("edge_type"));

    private final Jdbi jdbi;

    /**
     * Creates a new ExtraEdgeRepository.
     *
     * @param theJdbi the JDBI instance
     */
    public ExtraEdgeRepository(final Jdbi theJdbi) {
        this.jdbi = theJdbi;
    }

    /**
     * Finds extra edges with at least one endpoint in the given set.
     *
     * @param nodeIds the node ids
     * @param maxEdges the maximum number of edges
     * @return the edges, highest priority first
     */
    public List<ExtraEdge> findTouching(final Collection<String> nodeIds,
            final int maxEdges) {
        return find(Queries.EXTRA_EDGE_FIND_TOUCHING, nodeIds, maxEdges);
    }

    /**
     * Finds extra edges with both endpoints in the given set.
     *
     * @param nodeIds the node ids
     * @param maxEdges the maximum number of edges
     * @return the edges, highest priority first
     */
    public List<ExtraEdge> findWithin(final Collection<String> nodeIds,
            final int maxEdges) {
        return find(Queries.EXTRA_EDGE_FIND_WITHIN, nodeIds, maxEdges);
    }

    /**
     * Counts the extra edges.
     *
     * @return the count
     */
    long count() {
        return jdbi.withHandle(handle -> handle
                .createQuery(Queries.EXTRA_EDGE_COUNT)
                .mapTo(Long.class)
                .one());
    }

    private List<ExtraEdge> find(final String sql,
            final Collection<String> nodeIds, final int maxEdges) {
        if (nodeIds.isEmpty() || maxEdges <= 0) {
            return List.of();
        }
        return jdbi.withHandle(handle -> handle
                .createQuery(sql)
                .bindArray("ids", String.class, nodeIds)
                .bind("maxEdges", maxEdges)
                .map(EXTRA_MAPPER)
                .list());
    }

}
