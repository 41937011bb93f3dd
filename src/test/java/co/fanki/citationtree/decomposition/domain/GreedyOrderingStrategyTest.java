package co.fanki.citationtree.decomposition.domain;

import org.junit.jupiter.api.Test;

import java.util.BitSet;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link GreedyOrderingStrategy}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class GreedyOrderingStrategyTest {

    private final GreedyOrderingStrategy strategy = new GreedyOrderingStrategy();

    @Test
    void whenFindingEdges_givenTriangle_shouldRemoveOneEdge() {
        final Digraph graph = Digraph.of(3,
                new int[] {0, 1, 2},
                new int[] {1, 2, 0});

        final BitSet removed = strategy.findFeedbackEdges(graph);

        assertEquals(1, removed.cardinality());
        assertTrue(AcyclicityCheck.isAcyclic(graph.withoutEdges(removed)));
    }

    @Test
    void whenFindingEdges_givenDag_shouldRemoveNothing() {
        final Digraph graph = Digraph.of(5,
                new int[] {0, 0, 1, 2, 3},
                new int[] {1, 2, 3, 3, 4});

        assertTrue(strategy.findFeedbackEdges(graph).isEmpty());
    }

    @Test
    void whenFindingEdges_givenRandomDenseGraphs_shouldLeaveADag() {
        final Random random = new Random(42);
        for (int round = 0; round < 25; round++) {
            final int n = 20 + random.nextInt(60);
            final int m = n * (2 + random.nextInt(4));
            final int[] sources = new int[m];
            final int[] targets = new int[m];
            for (int e = 0; e < m; e++) {
                sources[e] = random.nextInt(n);
                int target = random.nextInt(n);
                while (target == sources[e]) {
                    target = random.nextInt(n);
                }
                targets[e] = target;
            }
            final Digraph graph = Digraph.of(n, sources, targets);

            final BitSet removed = strategy.findFeedbackEdges(graph);

            assertTrue(AcyclicityCheck.isAcyclic(graph.withoutEdges(removed)),
                    "residual of round " + round + " is cyclic");
            assertTrue(removed.cardinality() <= m / 2,
                    "removed more than half of the edges");
        }
    }

    @Test
    void whenCheckingApplicability_givenAnyGraph_shouldAccept() {
        assertTrue(strategy.isApplicable(Digraph.of(0, new int[0],
                new int[0])));
    }

}
