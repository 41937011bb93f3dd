package co.fanki.citationtree.spatial.domain;

import co.fanki.citationtree.graph.domain.CitationNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable view of every node: the R-tree plus a lookup by id.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SpatialSnapshot {

    private final PackedRTree tree;

    private final Map<String, CitationNode> byId;

    private SpatialSnapshot(final PackedRTree theTree,
            final Map<String, CitationNode> theById) {
        this.tree = theTree;
        this.byId = theById;
    }

    /**
     * Builds a snapshot.
     *
     * @param nodes the nodes to index
     * @param capacity the R-tree node capacity
     * @return the snapshot
     */
    public static SpatialSnapshot of(final List<CitationNode> nodes,
            final int capacity) {
        final Map<String, CitationNode> byId = new HashMap<>(nodes.size() * 2);
        for (final CitationNode node : nodes) {
            byId.put(node.id(), node);
        }
        return new SpatialSnapshot(PackedRTree.build(nodes, capacity), byId);
    }

    /**
     * @param capacity the R-tree node capacity
     * @return a snapshot without nodes
     */
    public static SpatialSnapshot empty(final int capacity) {
        return of(List.of(), capacity);
    }

    /**
     * Finds every node inside a box.
     *
     * @param box the search box
     * @return the nodes inside, in no particular order
     */
    public List<CitationNode> search(final BoundingBox box) {
        return tree.search(box);
    }

    /**
     * @param id the node id
     * @return the node if indexed
     */
    public Optional<CitationNode> node(final String id) {
        return Optional.ofNullable(byId.get(id));
    }

    /**
     * Resolves several ids, skipping unknown ones.
     *
     * @param ids the node ids
     * @return the known nodes, in the order of {@code ids}
     */
    public List<CitationNode> nodes(final Collection<String> ids) {
        final List<CitationNode> result = new ArrayList<>(ids.size());
        for (final String id : ids) {
            final CitationNode node = byId.get(id);
            if (node != null) {
                result.add(node);
            }
        }
        return result;
    }

    /** @return the number of indexed nodes */
    public int size() {
        return tree.size();
    }

    /** @return the box tightly covering every node, empty without nodes */
    public Optional<BoundingBox> dataBounds() {
        return tree.bounds();
    }

}
