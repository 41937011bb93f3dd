package co.fanki.citationtree.decomposition.domain;

import co.fanki.citationtree.graph.domain.CitationGraph;
import co.fanki.citationtree.graph.domain.CitationNode;

import java.util.Arrays;
import java.util.BitSet;

/**
 * Compact directed graph over dense int indexes.
 *
 * <p>Vertices are {@code 0..vertexCount-1} and edges {@code 0..edgeCount-1}.
 * Every vertex and edge carries a label: its index in the originating
 * {@link CitationGraph}. Subgraphs keep the labels of their parent, so a
 * result computed on a component maps straight back to the full graph.
 * Labels are strictly increasing, which makes label lookups a binary
 * search.</p>
 *
 * <p>Instances are immutable.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Digraph {

    /** Marker for a vertex without a publication year. */
    public static final int NO_YEAR = Integer.MIN_VALUE;

    private final int vertexCount;

    private final int[] sources;

    private final int[] targets;

    private final int[] vertexLabels;

    private final int[] edgeLabels;

    private final int[] years;

    private final int[][] outEdges;

    private final int[][] inEdges;

    private Digraph(final int theVertexCount, final int[] theSources,
            final int[] theTargets, final int[] theVertexLabels,
            final int[] theEdgeLabels, final int[] theYears) {
        this.vertexCount = theVertexCount;
        this.sources = theSources;
        this.targets = theTargets;
        this.vertexLabels = theVertexLabels;
        this.edgeLabels = theEdgeLabels;
        this.years = theYears;

        final int[] outDegree = new int[theVertexCount];
        final int[] inDegree = new int[theVertexCount];
        for (int e = 0; e < theSources.length; e++) {
            outDegree[theSources[e]]++;
            inDegree[theTargets[e]]++;
        }
        this.outEdges = new int[theVertexCount][];
        this.inEdges = new int[theVertexCount][];
        for (int v = 0; v < theVertexCount; v++) {
            outEdges[v] = new int[outDegree[v]];
            inEdges[v] = new int[inDegree[v]];
        }
        final int[] outFill = new int[theVertexCount];
        final int[] inFill = new int[theVertexCount];
        for (int e = 0; e < theSources.length; e++) {
            outEdges[theSources[e]][outFill[theSources[e]]++] = e;
            inEdges[theTargets[e]][inFill[theTargets[e]]++] = e;
        }
    }

    /**
     * Builds the digraph of a full citation graph.
     *
     * @param graph the citation graph
     * @return the digraph, labels equal to the citation graph indexes
     */
    public static Digraph of(final CitationGraph graph) {
        final int n = graph.nodeCount();
        final int m = graph.edgeCount();
        final int[] src = new int[m];
        final int[] dst = new int[m];
        final int[] edgeLabels = new int[m];
        for (int e = 0; e < m; e++) {
            src[e] = graph.source(e);
            dst[e] = graph.target(e);
            edgeLabels[e] = e;
        }
        final int[] vertexLabels = new int[n];
        final int[] years = new int[n];
        for (int v = 0; v < n; v++) {
            vertexLabels[v] = v;
            final CitationNode node = graph.node(v);
            years[v] = node.publicationYear() == null
                    ? NO_YEAR : node.publicationYear();
        }
        return new Digraph(n, src, dst, vertexLabels, edgeLabels, years);
    }

    /**
     * Builds a digraph from raw edge arrays, labels equal to indexes.
     *
     * @param vertexCount the number of vertices
     * @param sources the source vertex of each edge
     * @param targets the target vertex of each edge
     * @return the digraph, no vertex has a year
     */
    public static Digraph of(final int vertexCount, final int[] sources,
            final int[] targets) {
        final int[] vertexLabels = new int[vertexCount];
        final int[] years = new int[vertexCount];
        for (int v = 0; v < vertexCount; v++) {
            vertexLabels[v] = v;
            years[v] = NO_YEAR;
        }
        final int[] edgeLabels = new int[sources.length];
        for (int e = 0; e < sources.length; e++) {
            edgeLabels[e] = e;
        }
        return new Digraph(vertexCount, sources.clone(), targets.clone(),
                vertexLabels, edgeLabels, years);
    }

    /**
     * Returns the subgraph induced by a set of vertices.
     *
     * @param vertices the local vertex indexes to keep
     * @return the induced subgraph, keeping this graph's labels
     */
    public Digraph induced(final int[] vertices) {
        final int[] sorted = vertices.clone();
        Arrays.sort(sorted);
        final int[] localIndex = new int[vertexCount];
        Arrays.fill(localIndex, -1);
        for (int i = 0; i < sorted.length; i++) {
            localIndex[sorted[i]] = i;
        }

        int kept = 0;
        for (int e = 0; e < sources.length; e++) {
            if (localIndex[sources[e]] >= 0 && localIndex[targets[e]] >= 0) {
                kept++;
            }
        }
        final int[] src = new int[kept];
        final int[] dst = new int[kept];
        final int[] labels = new int[kept];
        int next = 0;
        for (int e = 0; e < sources.length; e++) {
            if (localIndex[sources[e]] >= 0 && localIndex[targets[e]] >= 0) {
                src[next] = localIndex[sources[e]];
                dst[next] = localIndex[targets[e]];
                labels[next] = edgeLabels[e];
                next++;
            }
        }

        final int[] subVertexLabels = new int[sorted.length];
        final int[] subYears = new int[sorted.length];
        for (int i = 0; i < sorted.length; i++) {
            subVertexLabels[i] = vertexLabels[sorted[i]];
            subYears[i] = years[sorted[i]];
        }
        return new Digraph(sorted.length, src, dst, subVertexLabels, labels,
                subYears);
    }

    /**
     * Returns this graph minus a set of edges, keeping every vertex.
     *
     * @param removed the local edge indexes to drop
     * @return the reduced graph, keeping this graph's labels
     */
    public Digraph withoutEdges(final BitSet removed) {
        final int kept = sources.length - removed.cardinality();
        final int[] src = new int[kept];
        final int[] dst = new int[kept];
        final int[] labels = new int[kept];
        int next = 0;
        for (int e = 0; e < sources.length; e++) {
            if (!removed.get(e)) {
                src[next] = sources[e];
                dst[next] = targets[e];
                labels[next] = edgeLabels[e];
                next++;
            }
        }
        return new Digraph(vertexCount, src, dst, vertexLabels.clone(),
                labels, years.clone());
    }

    /** @return the number of vertices */
    public int vertexCount() {
        return vertexCount;
    }

    /** @return the number of edges */
    public int edgeCount() {
        return sources.length;
    }

    /**
     * @param edge the edge index
     * @return the source vertex of the edge
     */
    public int source(final int edge) {
        return sources[edge];
    }

    /**
     * @param edge the edge index
     * @return the target vertex of the edge
     */
    public int target(final int edge) {
        return targets[edge];
    }

    /**
     * @param vertex the vertex index
     * @return the outgoing edge indexes, not to be modified
     */
    public int[] outEdges(final int vertex) {
        return outEdges[vertex];
    }

    /**
     * @param vertex the vertex index
     * @return the incoming edge indexes, not to be modified
     */
    public int[] inEdges(final int vertex) {
        return inEdges[vertex];
    }

    /**
     * @param vertex the vertex index
     * @return the publication year, or {@link #NO_YEAR}
     */
    public int year(final int vertex) {
        return years[vertex];
    }

    /**
     * @param vertex the vertex index
     * @return the index of the vertex in the originating citation graph
     */
    public int vertexLabel(final int vertex) {
        return vertexLabels[vertex];
    }

    /**
     * @param edge the edge index
     * @return the index of the edge in the originating citation graph
     */
    public int edgeLabel(final int edge) {
        return edgeLabels[edge];
    }

    /**
     * Finds the local edge carrying a label.
     *
     * @param label the citation graph edge index
     * @return the local edge index, or a negative value if absent
     */
    public int edgeWithLabel(final int label) {
        return Arrays.binarySearch(edgeLabels, label);
    }

}
