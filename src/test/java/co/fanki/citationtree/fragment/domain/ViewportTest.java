package co.fanki.citationtree.fragment.domain;

import co.fanki.citationtree.graph.domain.CitationNode;
import co.fanki.citationtree.shared.DomainException;
import co.fanki.citationtree.spatial.domain.BoundingBox;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link Viewport}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ViewportTest {

    private static final BoundingBox BOX = new BoundingBox(0, 10, 0, 10);

    @Test
    void whenAccepting_givenDegreeBelowMinimum_shouldReject() {
        final Viewport viewport = new Viewport(BOX, 5, null, null, 0, 10);

        assertFalse(viewport.accepts(node(4, 1, 0)));
        assertTrue(viewport.accepts(node(5, 1, 0)));
    }

    @Test
    void whenAccepting_givenClusterFilter_shouldKeepListedClustersOnly() {
        final Viewport viewport = new Viewport(BOX, 0, Set.of(1, 2), null, 0,
                10);

        assertTrue(viewport.accepts(node(1, 2, 0)));
        assertFalse(viewport.accepts(node(1, 3, 0)));
        assertFalse(viewport.accepts(node(1, null, 0)));
    }

    @Test
    void whenAccepting_givenMaxLevel_shouldRejectDeeperAndUnleveledNodes() {
        final Viewport viewport = new Viewport(BOX, 0, null, 2, 0, 10);

        assertTrue(viewport.accepts(node(1, 1, 2)));
        assertFalse(viewport.accepts(node(1, 1, 3)));
        assertFalse(viewport.accepts(node(1, 1, null)));
    }

    @Test
    void whenCreating_givenNegativeOffset_shouldThrowInvalidViewport() {
        final DomainException e = assertThrows(DomainException.class,
                () -> new Viewport(BOX, 0, null, null, -1, 10));

        assertEquals("INVALID_VIEWPORT", e.getErrorCode());
    }

    @Test
    void whenCreating_givenZeroLimit_shouldThrowInvalidViewport() {
        assertThrows(DomainException.class,
                () -> new Viewport(BOX, 0, null, null, 0, 0));
    }

    private static CitationNode node(final int degree, final Integer cluster,
            final Integer level) {
        return new CitationNode("n", 1, 1, cluster, degree, null, level);
    }

}
