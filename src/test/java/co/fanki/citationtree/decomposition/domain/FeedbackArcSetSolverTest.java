package co.fanki.citationtree.decomposition.domain;

import org.junit.jupiter.api.Test;

import java.util.BitSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link FeedbackArcSetSolver}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class FeedbackArcSetSolverTest {

    @Test
    void whenSolving_givenSubgraphWithParentLabels_shouldKeyByLabel() {
        final Digraph full = Digraph.of(5,
                new int[] {0, 1, 2, 3, 4, 4},
                new int[] {1, 2, 3, 4, 2, 0});
        final Digraph part = full.induced(new int[] {2, 3, 4});
        final FeedbackArcSetSolver solver = new FeedbackArcSetSolver(
                List.of(new GreedyOrderingStrategy()), 3);

        final FeedbackArcSet result = solver.solve(part,
                FeedbackArcSetStrategyType.GREEDY_ORDERING);

        assertEquals(1, result.size());
        final int label = result.edges().keySet().iterator().next();
        assertTrue(label == 2 || label == 3 || label == 4);
        assertEquals(FeedbackArcSetStrategyType.GREEDY_ORDERING,
                result.removedBy(label));
        assertEquals(1, result.attempts());
    }

    @Test
    void whenSolving_givenChronologicalDeclined_shouldFallBackToGreedy() {
        final Digraph graph = Digraph.of(3,
                new int[] {0, 1, 2},
                new int[] {1, 2, 0});
        final FeedbackArcSetSolver solver = new FeedbackArcSetSolver(
                List.of(new GreedyOrderingStrategy(),
                        new ChronologicalStrategy(0.9)), 3);

        final FeedbackArcSet result = solver.solve(graph,
                FeedbackArcSetStrategyType.CHRONOLOGICAL);

        assertEquals(List.of(FeedbackArcSetStrategyType.GREEDY_ORDERING),
                result.strategies());
        assertEquals(1, result.size());
    }

    @Test
    void whenSolving_givenStrategyLeavingCycles_shouldRetryWithGreedy() {
        // Removes only the first edge of each part, leaving the 2-cycle
        final FeedbackArcSetStrategy firstEdgeOnly = new FeedbackArcSetStrategy() {
            @Override
            public FeedbackArcSetStrategyType type() {
                return FeedbackArcSetStrategyType.CYCLE_MAJORITY;
            }

            @Override
            public boolean isApplicable(final Digraph graph) {
                return true;
            }

            @Override
            public BitSet findFeedbackEdges(final Digraph graph) {
                final BitSet removed = new BitSet();
                removed.set(0);
                return removed;
            }
        };
        // 0 -> 1 -> 0 and 1 -> 2 -> 1
        final Digraph graph = Digraph.of(3,
                new int[] {0, 1, 1, 2},
                new int[] {1, 0, 2, 1});
        final FeedbackArcSetSolver solver = new FeedbackArcSetSolver(
                List.of(new GreedyOrderingStrategy(), firstEdgeOnly), 3);

        final FeedbackArcSet result = solver.solve(graph,
                FeedbackArcSetStrategyType.CYCLE_MAJORITY);

        assertEquals(2, result.attempts());
        assertEquals(List.of(FeedbackArcSetStrategyType.CYCLE_MAJORITY,
                FeedbackArcSetStrategyType.GREEDY_ORDERING),
                result.strategies());
        final BitSet removed = new BitSet();
        result.edges().keySet().forEach(removed::set);
        assertTrue(AcyclicityCheck.isAcyclic(graph.withoutEdges(removed)));
    }

    @Test
    void whenSolving_givenStrategyRemovingNothing_shouldThrowAfterMaxAttempts() {
        final FeedbackArcSetStrategy lazyGreedy = new FeedbackArcSetStrategy() {
            @Override
            public FeedbackArcSetStrategyType type() {
                return FeedbackArcSetStrategyType.GREEDY_ORDERING;
            }

            @Override
            public boolean isApplicable(final Digraph graph) {
                return true;
            }

            @Override
            public BitSet findFeedbackEdges(final Digraph graph) {
                return new BitSet();
            }
        };
        final FeedbackArcSetSolver solver = new FeedbackArcSetSolver(
                List.of(lazyGreedy), 2);

        final DecompositionInvariantException e = assertThrows(
                DecompositionInvariantException.class,
                () -> solver.solve(Digraph.of(2, new int[] {0, 1},
                        new int[] {1, 0}),
                        FeedbackArcSetStrategyType.GREEDY_ORDERING));

        assertEquals("DECOMPOSITION_INVARIANT_VIOLATED", e.getErrorCode());
    }

    @Test
    void whenSolving_givenAcyclicGraph_shouldReturnEmptySet() {
        final FeedbackArcSetSolver solver = new FeedbackArcSetSolver(
                List.of(new GreedyOrderingStrategy()), 1);

        final FeedbackArcSet result = solver.solve(Digraph.of(2,
                new int[] {0}, new int[] {1}),
                FeedbackArcSetStrategyType.GREEDY_ORDERING);

        assertEquals(0, result.size());
        assertEquals(0, result.attempts());
    }

    @Test
    void whenCreating_givenNoGreedyStrategy_shouldThrow() {
        assertThrows(IllegalStateException.class,
                () -> new FeedbackArcSetSolver(
                        List.of(new ChronologicalStrategy(0.5)), 3));
    }

}
