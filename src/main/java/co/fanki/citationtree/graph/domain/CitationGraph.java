package co.fanki.citationtree.graph.domain;

import co.fanki.citationtree.shared.DomainException;
import co.fanki.citationtree.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable in-memory citation graph.
 *
 * <p>Nodes are addressed by a dense index (their position in
 * {@link #nodes()}), edges by their position in {@link #edges()}. The
 * dense indexes let the decomposition algorithms work on plain int arrays
 * instead of maps keyed by paper id.</p>
 *
 * <p>Construction enforces data integrity: an edge whose endpoint is not a
 * known node fails the whole build with {@code DANGLING_EDGE}. Duplicate
 * citations are collapsed and self-citations dropped; both are counted so
 * the loader can report them.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class CitationGraph {

    private final List<CitationNode> nodes;

    private final Map<String, Integer> indexById;

    private final List<CitationEdge> edges;

    private final int[] edgeSources;

    private final int[] edgeTargets;

    private final int droppedSelfLoops;

    private final int droppedDuplicates;

    private CitationGraph(
            final List<CitationNode> theNodes,
            final Map<String, Integer> theIndexById,
            final List<CitationEdge> theEdges,
            final int theDroppedSelfLoops,
            final int theDroppedDuplicates) {
        this.nodes = Collections.unmodifiableList(theNodes);
        this.indexById = theIndexById;
        this.edges = Collections.unmodifiableList(theEdges);
        this.edgeSources = new int[theEdges.size()];
        this.edgeTargets = new int[theEdges.size()];
        for (int i = 0; i < theEdges.size(); i++) {
            edgeSources[i] = theIndexById.get(theEdges.get(i).src());
            edgeTargets[i] = theIndexById.get(theEdges.get(i).dst());
        }
        this.droppedSelfLoops = theDroppedSelfLoops;
        this.droppedDuplicates = theDroppedDuplicates;
    }

    /**
     * Builds a graph from nodes and citation edges.
     *
     * @param nodes the nodes, ids must be unique
     * @param edges the citations between those nodes
     * @return the graph
     * @throws DomainException with code {@code DUPLICATE_NODE} if a node id
     *         repeats, or {@code DANGLING_EDGE} if an edge references an
     *         unknown node
     */
    public static CitationGraph of(final Collection<CitationNode> nodes,
            final Collection<CitationEdge> edges) {
        Preconditions.requireNonNull(nodes, "Nodes are required");
        Preconditions.requireNonNull(edges, "Edges are required");

        final List<CitationNode> nodeList = new ArrayList<>(nodes.size());
        final Map<String, Integer> index = new HashMap<>(nodes.size() * 2);
        for (final CitationNode node : nodes) {
            if (index.putIfAbsent(node.id(), nodeList.size()) != null) {
                throw new DomainException(
                        "Duplicate node id: " + node.id(), "DUPLICATE_NODE");
            }
            nodeList.add(node);
        }

        final Set<CitationEdge> unique = new LinkedHashSet<>(edges.size() * 2);
        int selfLoops = 0;
        int duplicates = 0;
        for (final CitationEdge edge : edges) {
            if (!index.containsKey(edge.src()) || !index.containsKey(edge.dst())) {
                throw new DomainException(
                        "Edge " + edge + " references a node that is not"
                                + " part of the graph",
                        "DANGLING_EDGE");
            }
            if (edge.isSelfLoop()) {
                selfLoops++;
            } else if (!unique.add(edge)) {
                duplicates++;
            }
        }

        return new CitationGraph(nodeList, index, new ArrayList<>(unique),
                selfLoops, duplicates);
    }

    /** @return the number of nodes */
    public int nodeCount() {
        return nodes.size();
    }

    /** @return the number of distinct, non self-loop edges */
    public int edgeCount() {
        return edges.size();
    }

    /** @return the nodes in index order */
    public List<CitationNode> nodes() {
        return nodes;
    }

    /** @return the edges in index order */
    public List<CitationEdge> edges() {
        return edges;
    }

    /**
     * Returns the node at an index.
     *
     * @param index the node index
     * @return the node
     */
    public CitationNode node(final int index) {
        return nodes.get(index);
    }

    /**
     * Returns the index of a node.
     *
     * @param id the node id
     * @return the index, or -1 if the node is unknown
     */
    public int indexOf(final String id) {
        final Integer index = indexById.get(id);
        return index == null ? -1 : index;
    }

    /**
     * Returns the source node index of an edge.
     *
     * @param edge the edge index
     * @return the source node index
     */
    public int source(final int edge) {
        return edgeSources[edge];
    }

    /**
     * Returns the target node index of an edge.
     *
     * @param edge the edge index
     * @return the target node index
     */
    public int target(final int edge) {
        return edgeTargets[edge];
    }

    /** @return how many self-citations were dropped on construction */
    public int droppedSelfLoops() {
        return droppedSelfLoops;
    }

    /** @return how many repeated citations were collapsed on construction */
    public int droppedDuplicates() {
        return droppedDuplicates;
    }

}
