package co.fanki.citationtree.decomposition.domain;

import co.fanki.citationtree.graph.domain.CitationEdge;
import co.fanki.citationtree.graph.domain.CitationGraph;
import co.fanki.citationtree.graph.domain.CitationNodeRepository;
import co.fanki.citationtree.graph.domain.ExtraEdge;
import co.fanki.citationtree.shared.Queries;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.statement.PreparedBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

/**
 * Replaces the persisted decomposition with a new one.
 *
 * <p>Tree edges, extra edges and node levels are swapped inside one
 * transaction: readers see either the previous decomposition or the new
 * one, and a failure leaves the previous one untouched.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Repository
public class DecompositionPublisher {

    private static final Logger LOG = LoggerFactory.getLogger(
            DecompositionPublisher.class);

    private final Jdbi jdbi;

    private final String nodeTable;

    /**
     * Creates a new DecompositionPublisher.
     *
     * @param theJdbi the JDBI instance
     * @param theNodeRepository source of the configured node table name
     */
    public DecompositionPublisher(final Jdbi theJdbi,
            final CitationNodeRepository theNodeRepository) {
        this.jdbi = theJdbi;
        this.nodeTable = theNodeRepository.nodeTable();
    }

    /**
     * Publishes a decomposition.
     *
     * @param graph the decomposed graph
     * @param partition the verified partition
     * @param levels the levels of every node of the graph
     */
    public void publish(final CitationGraph graph,
            final EdgePartition partition, final TopologicalLevels levels) {
        if (levels.size() != graph.nodeCount()) {
            throw new IllegalArgumentException("Levels cover " + levels.size()
                    + " nodes, graph has " + graph.nodeCount());
        }

        jdbi.useTransaction(handle -> {
            handle.execute(Queries.TREE_EDGE_DELETE_ALL);
            handle.execute(Queries.EXTRA_EDGE_DELETE_ALL);

            final PreparedBatch treeBatch = handle.prepareBatch(
                    Queries.TREE_EDGE_INSERT);
            for (final CitationEdge edge : partition.treeEdges()) {
                treeBatch.bind("src", edge.src())
                        .bind("dst", edge.dst())
                        .add();
            }
            if (treeBatch.size() > 0) {
                treeBatch.execute();
            }

            final PreparedBatch extraBatch = handle.prepareBatch(
                    Queries.EXTRA_EDGE_INSERT);
            for (final ExtraEdge edge : partition.extraEdges()) {
                extraBatch.bind("src", edge.src())
                        .bind("dst", edge.dst())
                        .bind("priority", edge.priority())
                        .bind("edgeType", edge.edgeType())
                        .add();
            }
            if (extraBatch.size() > 0) {
                extraBatch.execute();
            }

            handle.createUpdate(Queries.NODE_RESET_LEVELS)
                    .define("nodeTable", nodeTable)
                    .execute();

            final PreparedBatch levelBatch = handle.prepareBatch(
                    Queries.NODE_UPDATE_LEVEL);
            levelBatch.define("nodeTable", nodeTable);
            for (int v = 0; v < graph.nodeCount(); v++) {
                levelBatch.bind("level", levels.level(v))
                        .bind("id", graph.node(v).id())
                        .add();
            }
            if (levelBatch.size() > 0) {
                levelBatch.execute();
            }
        });

        LOG.info("Published {} tree edges, {} extra edges and levels for {}"
                + " nodes", partition.treeEdges().size(),
                partition.extraEdges().size(), graph.nodeCount());
    }

}
