package co.fanki.citationtree.shared;

/**
 * Contains all SQL used by repositories.
 *
 * <p>Centralizing queries enables index analysis and optimization. The node
 * table name is configuration, so node queries reference it through the
 * {@code <nodeTable>} template attribute, which repositories fill with
 * {@code define} after validating it as a plain identifier. Every other
 * variable input, including node id lists, is a bound parameter.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Queries {

    private Queries() {
    }

    // ========================================================================
    // CitationNodeRepository queries
    // ========================================================================

    /** Find all nodes. Uses: seq scan (full load for the spatial index). */
    public static final String NODE_FIND_ALL = """
            SELECT id, x, y, cluster_id, degree, publication_year, topo_level
            FROM <nodeTable>
            ORDER BY id
            """;

    /** Count nodes. Uses: PK index. */
    public static final String NODE_COUNT =
            "SELECT COUNT(*) FROM <nodeTable>";

    /**
     * Top nodes by degree for each of the first levels.
     * Uses: idx_citation_nodes_topo_level.
     */
    public static final String NODE_FIND_TOPOLOGICAL_OVERVIEW = """
            SELECT id, x, y, cluster_id, degree, publication_year, topo_level
            FROM (
                SELECT n.*, ROW_NUMBER() OVER (
                    PARTITION BY n.topo_level
                    ORDER BY n.degree DESC, n.id) AS level_rank
                FROM <nodeTable> n
                WHERE n.topo_level IS NOT NULL
                  AND n.topo_level < :maxLevels
            ) ranked
            WHERE level_rank <= :maxNodesPerLevel
            ORDER BY topo_level, degree DESC, id
            """;

    /** Clear every level before a new assignment. Uses: seq scan. */
    public static final String NODE_RESET_LEVELS =
            "UPDATE <nodeTable> SET topo_level = NULL"
                    + " WHERE topo_level IS NOT NULL";

    /** Set the level of one node. Uses: PK index. */
    public static final String NODE_UPDATE_LEVEL =
            "UPDATE <nodeTable> SET topo_level = :level WHERE id = :id";

    // ========================================================================
    // CitationEdgeRepository queries
    // ========================================================================

    /** Find all citations. Uses: seq scan (batch decomposition input). */
    public static final String CITATION_FIND_ALL =
            "SELECT src, dst FROM citation_edges";

    // ========================================================================
    // TreeEdgeRepository queries
    // ========================================================================

    /**
     * Tree edges with at least one endpoint in the id set.
     * Uses: idx_tree_edges_src + idx_tree_edges_dst (bitmap OR).
     */
    public static final String TREE_EDGE_FIND_TOUCHING = """
            SELECT src, dst FROM tree_edges
            WHERE src = ANY(:ids) OR dst = ANY(:ids)
            """;

    /** Tree edges leaving the id set. Uses: idx_tree_edges_src. */
    public static final String TREE_EDGE_FIND_BY_SOURCES = """
            SELECT src, dst FROM tree_edges
            WHERE src = ANY(:ids)
            ORDER BY src, dst
            """;

    /** Count tree edges. Uses: PK index. */
    public static final String TREE_EDGE_COUNT =
            "SELECT COUNT(*) FROM tree_edges";

    /** Remove every tree edge. */
    public static final String TREE_EDGE_DELETE_ALL = "DELETE FROM tree_edges";

    /** Insert a tree edge. */
    public static final String TREE_EDGE_INSERT =
            "INSERT INTO tree_edges (src, dst) VALUES (:src, :dst)";

    // ========================================================================
    // ExtraEdgeRepository queries
    // ========================================================================

    /**
     * Extra edges touching the id set, best first.
     * Uses: idx_extra_edges_src + idx_extra_edges_dst (bitmap OR).
     */
    public static final String EXTRA_EDGE_FIND_TOUCHING = """
            SELECT src, dst, priority, edge_type FROM extra_edges
            WHERE src = ANY(:ids) OR dst = ANY(:ids)
            ORDER BY priority DESC, src, dst
            LIMIT :maxEdges
            """;

    /**
     * Extra edges with both endpoints in the id set, best first.
     * Uses: idx_extra_edges_src.
     */
    public static final String EXTRA_EDGE_FIND_WITHIN = """
            SELECT src, dst, priority, edge_type FROM extra_edges
            WHERE src = ANY(:ids) AND dst = ANY(:ids)
            ORDER BY priority DESC, src, dst
            LIMIT :maxEdges
            """;

    /** Count extra edges. Uses: PK index. */
    public static final String EXTRA_EDGE_COUNT =
            "SELECT COUNT(*) FROM extra_edges";

    /** Remove every extra edge. */
    public static final String EXTRA_EDGE_DELETE_ALL = "DELETE FROM extra_edges";

    /** Insert an extra edge. */
    public static final String EXTRA_EDGE_INSERT = """
            INSERT INTO extra_edges (src, dst, priority, edge_type)
            VALUES (:src, :dst, :priority, :edgeType)
            """;

    // ========================================================================
    // DecompositionRunRepository queries
    // ========================================================================

    /** Find a run by ID. Uses: PK index. */
    public static final String RUN_FIND_BY_ID =
            "SELECT * FROM decomposition_runs WHERE id = :id";

    /** Most recent runs first. Uses: idx_decomposition_runs_started_at. */
    public static final String RUN_FIND_RECENT = """
            SELECT * FROM decomposition_runs
            ORDER BY started_at DESC
            LIMIT :limit
            """;

    /** Latest completed run. Uses: idx_decomposition_runs_started_at. */
    public static final String RUN_FIND_LATEST_COMPLETED = """
            SELECT * FROM decomposition_runs
            WHERE status = 'COMPLETED'
            ORDER BY started_at DESC
            LIMIT 1
            """;

}
