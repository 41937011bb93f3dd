package co.fanki.citationtree.graph.domain;

import co.fanki.citationtree.shared.Queries;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.mapper.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Read access to the persisted tree backbone.
 *
 * <p>Writes happen only through the decomposition publisher, which replaces
 * the whole table inside one transaction.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Repository
public class TreeEdgeRepository {

    private static final RowMapper<CitationEdge> EDGE_MAPPER =
            (rs, ctx) -> new CitationEdge(rs.getString("src"),
                    rs.getString("dst"));

    private final Jdbi jdbi;

    /**
     * Creates a new TreeEdgeRepository.
     *
     * @param theJdbi the JDBI instance
     */
    public TreeEdgeRepository(final Jdbi theJdbi) {
        this.jdbi = theJdbi;
    }

    /**
     * Finds the tree edges with at least one endpoint in the given set.
     *
     * @param nodeIds the node ids
     * @return the touching tree edges, empty for an empty id set
     */
    public List<CitationEdge> findTouching(final Collection<String> nodeIds) {
        if (nodeIds.isEmpty()) {
            return List.of();
        }
        return jdbi.withHandle(handle -> handle
                .createQuery(Queries.TREE_EDGE_FIND_TOUCHING)
                .bindArray("ids", String.class, nodeIds)
                .map(EDGE_MAPPER)
                .list());
    }

    /**
     * Finds the tree edges whose source is in the given set.
     *
     * @param nodeIds the parent node ids
     * @return the outgoing tree edges
     */
    public List<CitationEdge> findBySources(final Collection<String> nodeIds) {
        if (nodeIds.isEmpty()) {
            return List.of();
        }
        return jdbi.withHandle(handle -> handle
                .createQuery(Queries.TREE_EDGE_FIND_BY_SOURCES)
                .bindArray("ids", String.class, nodeIds)
                .map(EDGE_MAPPER)
                .list());
    }

    /**
     * Counts the tree edges.
     *
     * @return the count
     */
    long count() {
        return jdbi.withHandle(handle -> handle
                .createQuery(Queries.TREE_EDGE_COUNT)
                .mapTo(Long.class)
                .one());
    }

}
