package co.fanki.citationtree.spatial.domain;

import co.fanki.citationtree.graph.domain.CitationNode;
import co.fanki.citationtree.graph.domain.CitationNodeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationStartedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Holds the current spatial snapshot of the node table.
 *
 * <p>The snapshot is built once the application has started (after Flyway
 * migrations) and rebuilt after every published decomposition, so node
 * levels stay in sync with the tree edges. Readers always get a complete
 * snapshot; a rebuild swaps the reference when it is done.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class SpatialIndexService {

    private static final Logger LOG = LoggerFactory.getLogger(
            SpatialIndexService.class);

    private final CitationNodeRepository nodeRepository;

    private final int nodeCapacity;

    private volatile SpatialSnapshot snapshot;

    /**
     * Creates a new SpatialIndexService.
     *
     * @param theNodeRepository the node repository
     * @param theNodeCapacity the R-tree node capacity
     */
    public SpatialIndexService(final CitationNodeRepository theNodeRepository,
            @Value("${spatial.node-capacity:16}") final int theNodeCapacity) {
        this.nodeRepository = theNodeRepository;
        this.nodeCapacity = theNodeCapacity;
        this.snapshot = SpatialSnapshot.empty(theNodeCapacity);
    }

    /**
     * Builds the first snapshot once the application is fully initialized.
     */
    @EventListener(ApplicationStartedEvent.class)
    public void loadAll() {
        rebuild();
    }

    /**
     * Reloads every node and swaps the snapshot.
     *
     * @return the new snapshot
     */
    public SpatialSnapshot rebuild() {
        LOG.info("Building spatial index");
        final long start = System.currentTimeMillis();

        final List<CitationNode> nodes = nodeRepository.findAll();
        final SpatialSnapshot fresh = SpatialSnapshot.of(nodes, nodeCapacity);
        snapshot = fresh;

        LOG.info("Spatial index ready: {} nodes in {} ms", fresh.size(),
                System.currentTimeMillis() - start);
        return fresh;
    }

    /** @return the current snapshot, never null */
    public SpatialSnapshot snapshot() {
        return snapshot;
    }

}
