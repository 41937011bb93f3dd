package co.fanki.citationtree.spatial.domain;

import co.fanki.citationtree.graph.domain.CitationNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Static R-tree over node positions, packed with the Sort-Tile-Recursive
 * algorithm.
 *
 * <p>Entries are sorted by x, cut into vertical slices, each slice sorted by
 * y and cut into runs of {@code capacity}. The resulting leaves are packed
 * the same way level after level until a single root remains. The tree never
 * changes after construction, so concurrent searches need no locking.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class PackedRTree {

    private final List<CitationNode> entries;

    private final int capacity;

    private final Node root;

    private final int height;

    private PackedRTree(final List<CitationNode> theEntries,
            final int theCapacity, final Node theRoot, final int theHeight) {
        this.entries = theEntries;
        this.capacity = theCapacity;
        this.root = theRoot;
        this.height = theHeight;
    }

    /**
     * Packs a tree.
     *
     * @param nodes the nodes to index
     * @param capacity children per tree node, at least 2
     * @return the tree
     */
    public static PackedRTree build(final List<CitationNode> nodes,
            final int capacity) {
        if (capacity < 2) {
            throw new IllegalArgumentException(
                    "Node capacity must be at least 2");
        }
        final List<CitationNode> entries = List.copyOf(nodes);
        if (entries.isEmpty()) {
            return new PackedRTree(entries, capacity, null, 0);
        }

        List<Node> level = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            final CitationNode node = entries.get(i);
            level.add(new Node(BoundingBox.ofPoint(node.x(), node.y()),
                    null, i));
        }

        int height = 0;
        do {
            level = pack(level, capacity);
            height++;
        } while (level.size() > 1);

        return new PackedRTree(entries, capacity, level.get(0), height);
    }

    private static List<Node> pack(final List<Node> items,
            final int capacity) {
        final int groups = (items.size() + capacity - 1) / capacity;
        final int slices = (int) Math.ceil(Math.sqrt(groups));
        final int sliceSize = slices * capacity;

        final List<Node> sorted = new ArrayList<>(items);
        sorted.sort(Comparator.comparingDouble(n -> n.box.centerX()));

        final List<Node> parents = new ArrayList<>(groups);
        for (int start = 0; start < sorted.size(); start += sliceSize) {
            final List<Node> slice = new ArrayList<>(sorted.subList(start,
                    Math.min(start + sliceSize, sorted.size())));
            slice.sort(Comparator.comparingDouble(n -> n.box.centerY()));
            for (int from = 0; from < slice.size(); from += capacity) {
                final List<Node> children = slice.subList(from,
                        Math.min(from + capacity, slice.size()));
                BoundingBox box = children.get(0).box;
                for (final Node child : children) {
                    box = box.union(child.box);
                }
                parents.add(new Node(box, children.toArray(new Node[0]), -1));
            }
        }
        return parents;
    }

    /**
     * Finds every node inside a box.
     *
     * @param box the search box, edges inclusive
     * @return the nodes inside, in no particular order
     */
    public List<CitationNode> search(final BoundingBox box) {
        final List<CitationNode> result = new ArrayList<>();
        if (root == null || !root.box.intersects(box)) {
            return result;
        }
        final List<Node> stack = new ArrayList<>();
        stack.add(root);
        while (!stack.isEmpty()) {
            final Node current = stack.remove(stack.size() - 1);
            for (final Node child : current.children) {
                if (!child.box.intersects(box)) {
                    continue;
                }
                if (child.isEntry()) {
                    result.add(entries.get(child.entry));
                } else {
                    stack.add(child);
                }
            }
        }
        return result;
    }

    /** @return the number of indexed nodes */
    public int size() {
        return entries.size();
    }

    /** @return the configured node capacity */
    public int capacity() {
        return capacity;
    }

    /** @return the number of tree levels above the entries */
    public int height() {
        return height;
    }

    /** @return the box covering every entry, empty for an empty tree */
    public Optional<BoundingBox> bounds() {
        return root == null ? Optional.empty() : Optional.of(root.box);
    }

    /** Tree node; entries are leaves pointing at a node position. */
    private static final class Node {

        private final BoundingBox box;

        private final Node[] children;

        private final int entry;

        Node(final BoundingBox theBox, final Node[] theChildren,
                final int theEntry) {
            box = theBox;
            children = theChildren;
            entry = theEntry;
        }

        boolean isEntry() {
            return children == null;
        }
    }

}
