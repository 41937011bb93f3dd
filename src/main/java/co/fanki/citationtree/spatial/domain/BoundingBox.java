package co.fanki.citationtree.spatial.domain;

import co.fanki.citationtree.shared.DomainException;
import co.fanki.citationtree.shared.ValueObject;

/**
 * Axis aligned rectangle in layout coordinates. Edges are inclusive.
 *
 * @param minX the left edge
 * @param maxX the right edge
 * @param minY the bottom edge
 * @param maxY the top edge
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record BoundingBox(
        double minX,
        double maxX,
        double minY,
        double maxY) implements ValueObject {

    /**
     * Validates the box.
     *
     * @throws DomainException with code {@code INVALID_VIEWPORT} when a
     *         coordinate is not finite or a minimum exceeds its maximum
     */
    public BoundingBox {
        if (!Double.isFinite(minX) || !Double.isFinite(maxX)
                || !Double.isFinite(minY) || !Double.isFinite(maxY)) {
            throw new DomainException("Bounding box coordinates must be"
                    + " finite", "INVALID_VIEWPORT");
        }
        if (minX > maxX || minY > maxY) {
            throw new DomainException("Bounding box minimum exceeds maximum: "
                    + "[" + minX + ", " + maxX + "] x [" + minY + ", " + maxY
                    + "]", "INVALID_VIEWPORT");
        }
    }

    /**
     * Box covering a single point.
     *
     * @param x the x coordinate
     * @param y the y coordinate
     * @return the degenerate box
     */
    public static BoundingBox ofPoint(final double x, final double y) {
        return new BoundingBox(x, x, y, y);
    }

    /** @return the horizontal extent */
    public double width() {
        return maxX - minX;
    }

    /** @return the vertical extent */
    public double height() {
        return maxY - minY;
    }

    /**
     * Checks if a point lies inside this box.
     *
     * @param x the x coordinate
     * @param y the y coordinate
     * @return true when the point is inside or on an edge
     */
    public boolean contains(final double x, final double y) {
        return x >= minX && x <= maxX && y >= minY && y <= maxY;
    }

    /**
     * Checks if two boxes overlap.
     *
     * @param other the other box
     * @return true when the boxes share at least one point
     */
    public boolean intersects(final BoundingBox other) {
        return other.minX <= maxX && other.maxX >= minX
                && other.minY <= maxY && other.maxY >= minY;
    }

    /**
     * Smallest box covering this one and another.
     *
     * @param other the other box
     * @return the union box
     */
    public BoundingBox union(final BoundingBox other) {
        return new BoundingBox(
                Math.min(minX, other.minX), Math.max(maxX, other.maxX),
                Math.min(minY, other.minY), Math.max(maxY, other.maxY));
    }

    /**
     * Grows every side by a share of the box extent on that axis.
     *
     * @param ratio the margin, 0.1 adds 10% of the width on the left and on
     *        the right
     * @return the expanded box
     */
    public BoundingBox expand(final double ratio) {
        if (!Double.isFinite(ratio) || ratio < 0) {
            throw new IllegalArgumentException(
                    "Margin ratio must be a non negative number");
        }
        final double dx = width() * ratio;
        final double dy = height() * ratio;
        return new BoundingBox(minX - dx, maxX + dx, minY - dy, maxY + dy);
    }

    /** @return the horizontal center */
    public double centerX() {
        return (minX + maxX) / 2;
    }

    /** @return the vertical center */
    public double centerY() {
        return (minY + maxY) / 2;
    }

}
