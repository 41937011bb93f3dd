package co.fanki.citationtree.graph.domain;

import co.fanki.citationtree.shared.Preconditions;
import co.fanki.citationtree.shared.ValueObject;

/**
 * A directed citation: {@code src} cites {@code dst}.
 *
 * <p>Also used for persisted tree edges, which are plain citations that
 * survived the feedback arc set removal.</p>
 *
 * @param src the citing paper id
 * @param dst the cited paper id
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record CitationEdge(String src, String dst) implements ValueObject {

    /** Validates the endpoints. */
    public CitationEdge {
        Preconditions.requireNonBlank(src, "Edge source is required");
        Preconditions.requireNonBlank(dst, "Edge target is required");
    }

    /**
     * Checks if the edge points from a node to itself.
     *
     * @return true for a self-citation
     */
    public boolean isSelfLoop() {
        return src.equals(dst);
    }

    @Override
    public String toString() {
        return src + "->" + dst;
    }

}
