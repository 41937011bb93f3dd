package co.fanki.citationtree.fragment.domain;

import co.fanki.citationtree.graph.domain.CitationNode;
import co.fanki.citationtree.shared.DomainException;
import co.fanki.citationtree.shared.Preconditions;
import co.fanki.citationtree.spatial.domain.BoundingBox;

import java.util.Set;

/**
 * A viewport query: a box, the level of detail filters and a page.
 *
 * @param box the visible area
 * @param minDegree nodes below this degree are filtered out
 * @param visibleClusters clusters to keep, null keeps every cluster
 * @param maxLevel deepest topological level to keep, null keeps all
 * @param offset nodes to skip in degree order
 * @param limit page size
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Viewport(
        BoundingBox box,
        int minDegree,
        Set<Integer> visibleClusters,
        Integer maxLevel,
        int offset,
        int limit) {

    /**
     * Validates the viewport.
     *
     * @throws DomainException with code {@code INVALID_VIEWPORT} for a
     *         negative offset, a non positive limit or a negative degree
     */
    public Viewport {
        Preconditions.requireNonNull(box, "Viewport box is required");
        if (offset < 0 || limit <= 0 || minDegree < 0) {
            throw new DomainException("Offset and minimum degree must not be"
                    + " negative and limit must be positive",
                    "INVALID_VIEWPORT");
        }
        visibleClusters = visibleClusters == null
                ? null : Set.copyOf(visibleClusters);
    }

    /**
     * Checks the level of detail filters, the box aside.
     *
     * @param node the candidate node
     * @return true when the node passes degree, cluster and level filters
     */
    public boolean accepts(final CitationNode node) {
        if (node.degree() < minDegree) {
            return false;
        }
        if (visibleClusters != null && (node.clusterId() == null
                || !visibleClusters.contains(node.clusterId()))) {
            return false;
        }
        return maxLevel == null
                || (node.topoLevel() != null && node.topoLevel() <= maxLevel);
    }

}
