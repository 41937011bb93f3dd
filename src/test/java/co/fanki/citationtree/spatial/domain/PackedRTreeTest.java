package co.fanki.citationtree.spatial.domain;

import co.fanki.citationtree.graph.domain.CitationNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link PackedRTree}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class PackedRTreeTest {

    @Test
    void whenSearching_givenRandomBoxes_shouldMatchAFullScan() {
        final Random random = new Random(11);
        final List<CitationNode> nodes = new ArrayList<>();
        for (int i = 0; i < 5_000; i++) {
            nodes.add(CitationNode.of("n" + i, random.nextGaussian() * 100,
                    random.nextGaussian() * 100, null, random.nextInt(50),
                    null));
        }
        final PackedRTree tree = PackedRTree.build(nodes, 16);

        for (int round = 0; round < 100; round++) {
            final double x = random.nextGaussian() * 100;
            final double y = random.nextGaussian() * 100;
            final BoundingBox box = new BoundingBox(x, x + random.nextDouble()
                    * 80, y, y + random.nextDouble() * 80);

            final Set<String> expected = nodes.stream()
                    .filter(n -> box.contains(n.x(), n.y()))
                    .map(CitationNode::id)
                    .collect(Collectors.toSet());
            final Set<String> found = tree.search(box).stream()
                    .map(CitationNode::id)
                    .collect(Collectors.toSet());

            assertEquals(expected, found);
            assertEquals(expected.size(), tree.search(box).size());
        }
        assertEquals(5_000, tree.size());
        assertTrue(tree.height() >= 3);
    }

    @Test
    void whenSearching_givenSingleNode_shouldFindIt() {
        final PackedRTree tree = PackedRTree.build(
                List.of(CitationNode.of("only", 1, 2, null, 0, null)), 4);

        assertEquals(1, tree.search(BoundingBox.ofPoint(1, 2)).size());
        assertEquals(BoundingBox.ofPoint(1, 2), tree.bounds().orElseThrow());
    }

    @Test
    void whenSearching_givenEmptyTree_shouldReturnNothing() {
        final PackedRTree tree = PackedRTree.build(List.of(), 16);

        assertTrue(tree.search(new BoundingBox(-1, 1, -1, 1)).isEmpty());
        assertTrue(tree.bounds().isEmpty());
    }

    @Test
    void whenBuilding_givenCapacityOne_shouldThrow() {
        assertThrows(IllegalArgumentException.class,
                () -> PackedRTree.build(List.of(), 1));
    }

}
