package co.fanki.citationtree.decomposition.domain;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link LevelAssigner}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class LevelAssignerTest {

    // 0 -> 1 -> 2 -> 3 and the shortcut 0 -> 3; 4 is isolated
    private final Digraph diamond = Digraph.of(5,
            new int[] {0, 1, 2, 0},
            new int[] {1, 2, 3, 3});

    @Test
    void whenAssigning_givenLongestPath_shouldUseDeepestParent() {
        final TopologicalLevels levels = LevelAssigner.assign(diamond,
                LevelMode.LONGEST_PATH);

        assertEquals(0, levels.level(0));
        assertEquals(2, levels.level(2));
        assertEquals(3, levels.level(3));
        assertEquals(0, levels.level(4));
        assertEquals(3, levels.maxLevel());
        assertEquals(2, levels.rootCount());
    }

    @Test
    void whenAssigning_givenShortestPath_shouldUseNearestRoot() {
        final TopologicalLevels levels = LevelAssigner.assign(diamond,
                LevelMode.SHORTEST_PATH);

        assertEquals(1, levels.level(3));
        assertEquals(2, levels.maxLevel());
    }

    @Test
    void whenAssigning_givenRandomDags_shouldPlaceTargetsBelowSources() {
        final Random random = new Random(7);
        for (int round = 0; round < 20; round++) {
            final int n = 50 + random.nextInt(100);
            final int m = n * 3;
            final int[] sources = new int[m];
            final int[] targets = new int[m];
            for (int e = 0; e < m; e++) {
                final int a = random.nextInt(n - 1);
                sources[e] = a;
                targets[e] = a + 1 + random.nextInt(n - a - 1);
            }
            final Digraph dag = Digraph.of(n, sources, targets);

            final TopologicalLevels levels = LevelAssigner.assign(dag,
                    LevelMode.LONGEST_PATH);

            for (int e = 0; e < m; e++) {
                assertTrue(levels.level(targets[e]) > levels.level(sources[e]));
            }
        }
    }

    @Test
    void whenAssigning_givenCycle_shouldThrow() {
        final Digraph cyclic = Digraph.of(3,
                new int[] {0, 1, 2},
                new int[] {1, 2, 1});

        assertThrows(DecompositionInvariantException.class,
                () -> LevelAssigner.assign(cyclic, LevelMode.LONGEST_PATH));
    }

}
