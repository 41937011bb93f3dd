package co.fanki.citationtree.graph.domain;

import co.fanki.citationtree.shared.Preconditions;
import co.fanki.citationtree.shared.ValueObject;

/**
 * A citation removed from the tree backbone to break a cycle.
 *
 * <p>Extra edges are served on demand for progressive enrichment, highest
 * priority first.</p>
 *
 * @param src the citing paper id
 * @param dst the cited paper id
 * @param priority the enrichment priority, higher loads first
 * @param edgeType the heuristic that removed the edge
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ExtraEdge(String src, String dst, double priority,
        String edgeType) implements ValueObject {

    /** Validates the edge. */
    public ExtraEdge {
        Preconditions.requireNonBlank(src, "Edge source is required");
        Preconditions.requireNonBlank(dst, "Edge target is required");
        Preconditions.requireNonBlank(edgeType, "Edge type is required");
    }

    /**
     * Computes the enrichment priority from the endpoint degrees.
     *
     * @param srcDegree the citing node degree
     * @param dstDegree the cited node degree
     * @return {@code ln(1 + srcDegree) + ln(1 + dstDegree)}
     */
    public static double priorityOf(final int srcDegree, final int dstDegree) {
        return Math.log1p(srcDegree) + Math.log1p(dstDegree);
    }

    /**
     * Returns the plain citation this edge represents.
     *
     * @return the citation edge
     */
    public CitationEdge asCitation() {
        return new CitationEdge(src, dst);
    }

}
