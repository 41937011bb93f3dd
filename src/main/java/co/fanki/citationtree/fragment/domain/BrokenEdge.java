package co.fanki.citationtree.fragment.domain;

import co.fanki.citationtree.graph.domain.CitationEdge;

/**
 * A tree edge leaving a fragment.
 *
 * <p>Tells the client which adjoining node to load next and how important
 * it is: {@code priority} is {@code ln(1 + degree)} of the external
 * node.</p>
 *
 * @param src the tree edge source
 * @param dst the tree edge target
 * @param externalNodeId the endpoint not in the fragment
 * @param role whether the external node is the parent or the child
 * @param priority the loading priority, higher first
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record BrokenEdge(
        String src,
        String dst,
        String externalNodeId,
        EdgeRole role,
        double priority) {

    /**
     * Builds the broken edge of a tree edge with one end outside the
     * fragment.
     *
     * @param edge the tree edge
     * @param externalIsSource true when the source is the external node
     * @param externalDegree the degree of the external node
     * @return the broken edge
     */
    public static BrokenEdge of(final CitationEdge edge,
            final boolean externalIsSource, final int externalDegree) {
        return new BrokenEdge(edge.src(), edge.dst(),
                externalIsSource ? edge.src() : edge.dst(),
                externalIsSource ? EdgeRole.PARENT : EdgeRole.CHILD,
                Math.log1p(externalDegree));
    }

}
