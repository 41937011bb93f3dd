package co.fanki.citationtree.fragment.domain;

/**
 * Extent of the whole layout, padded for display.
 *
 * @param minX the left edge
 * @param maxX the right edge
 * @param minY the bottom edge
 * @param maxY the top edge
 * @param totalNodes the number of nodes in the layout
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record DataBounds(
        double minX,
        double maxX,
        double minY,
        double maxY,
        int totalNodes) {
}
