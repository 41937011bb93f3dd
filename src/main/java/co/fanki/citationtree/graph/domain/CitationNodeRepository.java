package co.fanki.citationtree.graph.domain;

import co.fanki.citationtree.shared.Preconditions;
import co.fanki.citationtree.shared.Queries;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

/**
 * Read access to the node table produced by the embedding pipeline.
 *
 * <p>The table name is injected configuration so deployments can point the
 * service at a differently named layout table. It is validated once here
 * and substituted into the query templates; it never comes from a
 * request.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Repository
public class CitationNodeRepository {

    private static final RowMapper<CitationNode> NODE_MAPPER =
            new CitationNodeRowMapper();

    private final Jdbi jdbi;

    private final String nodeTable;

    /**
     * Creates a new CitationNodeRepository.
     *
     * @param theJdbi the JDBI instance
     * @param theNodeTable the node table name
     */
    public CitationNodeRepository(final Jdbi theJdbi,
            @Value("${graph.node-table:citation_nodes}")
            final String theNodeTable) {
        this.jdbi = theJdbi;
        this.nodeTable = Preconditions.requireIdentifier(theNodeTable,
                "Node table must be a plain identifier: " + theNodeTable);
    }

    /**
     * Loads every node.
     *
     * @return all nodes ordered by id
     */
    public List<CitationNode> findAll() {
        return jdbi.withHandle(handle -> handle
                .createQuery(Queries.NODE_FIND_ALL)
                .define("nodeTable", nodeTable)
                .map(NODE_MAPPER)
                .list());
    }

    /**
     * Counts the nodes.
     *
     * @return the node count
     */
    public long count() {
        return jdbi.withHandle(handle -> handle
                .createQuery(Queries.NODE_COUNT)
                .define("nodeTable", nodeTable)
                .mapTo(Long.class)
                .one());
    }

    /**
     * Finds the highest-degree nodes of each of the first levels.
     *
     * @param maxLevels how many levels, starting at 0
     * @param maxNodesPerLevel how many nodes per level
     * @return nodes ordered by level, then degree descending
     */
    public List<CitationNode> findTopologicalOverview(final int maxLevels,
            final int maxNodesPerLevel) {
        return jdbi.withHandle(handle -> handle
                .createQuery(Queries.NODE_FIND_TOPOLOGICAL_OVERVIEW)
                .define("nodeTable", nodeTable)
                .bind("maxLevels", maxLevels)
                .bind("maxNodesPerLevel", maxNodesPerLevel)
                .map(NODE_MAPPER)
                .list());
    }

    /**
     * Returns the configured node table name.
     *
     * @return the table name
     */
    public String nodeTable() {
        return nodeTable;
    }

    private static final class CitationNodeRowMapper
            implements RowMapper<CitationNode> {

        @Override
        public CitationNode map(final ResultSet rs, final StatementContext ctx)
                throws SQLException {
            return new CitationNode(
                    rs.getString("id"),
                    rs.getDouble("x"),
                    rs.getDouble("y"),
                    rs.getObject("cluster_id", Integer.class),
                    rs.getInt("degree"),
                    rs.getObject("publication_year", Integer.class),
                    rs.getObject("topo_level", Integer.class));
        }
    }

}
