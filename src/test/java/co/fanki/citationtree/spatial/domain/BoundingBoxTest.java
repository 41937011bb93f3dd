package co.fanki.citationtree.spatial.domain;

import co.fanki.citationtree.shared.DomainException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link BoundingBox}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class BoundingBoxTest {

    @Test
    void whenCreating_givenMinAboveMax_shouldThrowInvalidViewport() {
        final DomainException e = assertThrows(DomainException.class,
                () -> new BoundingBox(5, 1, 0, 1));

        assertEquals("INVALID_VIEWPORT", e.getErrorCode());
    }

    @Test
    void whenCreating_givenNaN_shouldThrowInvalidViewport() {
        final DomainException e = assertThrows(DomainException.class,
                () -> new BoundingBox(0, Double.NaN, 0, 1));

        assertEquals("INVALID_VIEWPORT", e.getErrorCode());
    }

    @Test
    void whenCheckingContains_givenPointOnEdge_shouldInclude() {
        final BoundingBox box = new BoundingBox(0, 10, 0, 10);

        assertTrue(box.contains(10, 0));
        assertFalse(box.contains(10.01, 5));
    }

    @Test
    void whenCheckingIntersects_givenTouchingBoxes_shouldIntersect() {
        final BoundingBox a = new BoundingBox(0, 1, 0, 1);

        assertTrue(a.intersects(new BoundingBox(1, 2, 1, 2)));
        assertFalse(a.intersects(new BoundingBox(1.5, 2, 0, 1)));
    }

    @Test
    void whenExpanding_givenRatio_shouldGrowEachSide() {
        final BoundingBox expanded = new BoundingBox(0, 10, 0, 20).expand(0.1);

        assertEquals(-1, expanded.minX(), 1e-9);
        assertEquals(11, expanded.maxX(), 1e-9);
        assertEquals(-2, expanded.minY(), 1e-9);
        assertEquals(22, expanded.maxY(), 1e-9);
    }

    @Test
    void whenUnion_givenDisjointBoxes_shouldCoverBoth() {
        final BoundingBox union = BoundingBox.ofPoint(1, 1)
                .union(BoundingBox.ofPoint(-3, 4));

        assertEquals(new BoundingBox(-3, 1, 1, 4), union);
        assertEquals(-1, union.centerX(), 1e-9);
    }

}
