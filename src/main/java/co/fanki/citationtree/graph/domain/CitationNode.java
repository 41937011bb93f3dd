package co.fanki.citationtree.graph.domain;

import co.fanki.citationtree.shared.Preconditions;
import co.fanki.citationtree.shared.ValueObject;

/**
 * A paper in the citation graph.
 *
 * <p>Coordinates, cluster and degree are produced upstream by the embedding
 * and clustering pipeline and are read-only here. The topological level is
 * written by the decomposition and is null until a decomposition ran.</p>
 *
 * @param id the paper identifier
 * @param x the layout x coordinate
 * @param y the layout y coordinate
 * @param clusterId the cluster identifier, may be null
 * @param degree the precomputed citation count
 * @param publicationYear the publication year, may be null
 * @param topoLevel the topological level over tree edges, may be null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record CitationNode(
        String id,
        double x,
        double y,
        Integer clusterId,
        int degree,
        Integer publicationYear,
        Integer topoLevel) implements ValueObject {

    /** Validates the node attributes. */
    public CitationNode {
        Preconditions.requireNonBlank(id, "Node id is required");
        Preconditions.requireFinite(x, "Node x must be finite: " + id);
        Preconditions.requireFinite(y, "Node y must be finite: " + id);
        Preconditions.requireNonNegative(degree,
                "Node degree must not be negative: " + id);
    }

    /**
     * Creates a node that has no topological level yet.
     *
     * @param id the paper identifier
     * @param x the x coordinate
     * @param y the y coordinate
     * @param clusterId the cluster identifier, may be null
     * @param degree the citation count
     * @param publicationYear the publication year, may be null
     * @return the node
     */
    public static CitationNode of(final String id, final double x,
            final double y, final Integer clusterId, final int degree,
            final Integer publicationYear) {
        return new CitationNode(id, x, y, clusterId, degree,
                publicationYear, null);
    }

    /**
     * Returns a copy of this node carrying the given level.
     *
     * @param level the topological level
     * @return the new node
     */
    public CitationNode withTopoLevel(final Integer level) {
        return new CitationNode(id, x, y, clusterId, degree,
                publicationYear, level);
    }

}
