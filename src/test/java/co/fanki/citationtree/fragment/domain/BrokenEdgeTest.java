package co.fanki.citationtree.fragment.domain;

import co.fanki.citationtree.graph.domain.CitationEdge;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Unit tests for {@link BrokenEdge}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class BrokenEdgeTest {

    @Test
    void whenBuilding_givenExternalSource_shouldBeParent() {
        final BrokenEdge edge = BrokenEdge.of(new CitationEdge("out", "in"),
                true, 9);

        assertEquals("out", edge.externalNodeId());
        assertEquals(EdgeRole.PARENT, edge.role());
        assertEquals(Math.log(10), edge.priority(), 1e-9);
    }

    @Test
    void whenBuilding_givenExternalTarget_shouldBeChild() {
        final BrokenEdge edge = BrokenEdge.of(new CitationEdge("in", "out"),
                false, 0);

        assertEquals("out", edge.externalNodeId());
        assertEquals(EdgeRole.CHILD, edge.role());
        assertEquals(0, edge.priority(), 1e-9);
    }

}
