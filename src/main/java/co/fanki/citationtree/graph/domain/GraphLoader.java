package co.fanki.citationtree.graph.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Loads the full citation graph from the store into memory.
 *
 * <p>Used by the batch decomposition only; the request path never holds the
 * full edge set.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class GraphLoader {

    private static final Logger LOG = LoggerFactory.getLogger(
            GraphLoader.class);

    private final CitationNodeRepository nodeRepository;

    private final CitationEdgeRepository edgeRepository;

    /**
     * Creates a new GraphLoader.
     *
     * @param theNodeRepository the node repository
     * @param theEdgeRepository the citation edge repository
     */
    public GraphLoader(final CitationNodeRepository theNodeRepository,
            final CitationEdgeRepository theEdgeRepository) {
        this.nodeRepository = theNodeRepository;
        this.edgeRepository = theEdgeRepository;
    }

    /**
     * Loads every node and citation.
     *
     * @return the in-memory graph
     * @throws co.fanki.citationtree.shared.DomainException with code
     *         {@code DANGLING_EDGE} if a citation references an unknown node
     */
    public CitationGraph load() {
        LOG.info("Loading citation graph from {}", nodeRepository.nodeTable());

        final List<CitationNode> nodes = nodeRepository.findAll();
        final List<CitationEdge> edges = edgeRepository.findAll();

        final CitationGraph graph = CitationGraph.of(nodes, edges);

        if (graph.droppedSelfLoops() > 0) {
            LOG.warn("Dropped {} self-citations", graph.droppedSelfLoops());
        }
        if (graph.droppedDuplicates() > 0) {
            LOG.warn("Collapsed {} duplicate citations",
                    graph.droppedDuplicates());
        }

        LOG.info("Loaded citation graph: {} nodes, {} edges",
                graph.nodeCount(), graph.edgeCount());
        return graph;
    }

}
