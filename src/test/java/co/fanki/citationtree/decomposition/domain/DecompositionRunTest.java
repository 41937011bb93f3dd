package co.fanki.citationtree.decomposition.domain;

import co.fanki.citationtree.shared.DomainException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link DecompositionRun}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class DecompositionRunTest {

    @Test
    void whenStarting_givenSettings_shouldBeRunning() {
        final DecompositionRun run = start();

        assertNotNull(run.id());
        assertEquals(DecompositionStatus.RUNNING, run.status());
        assertNotNull(run.startedAt());
        assertNull(run.finishedAt());
    }

    @Test
    void whenCompleting_givenPartitionAndLevels_shouldRecordCounts() {
        final DecompositionRun run = start();
        final Digraph tree = Digraph.of(3, new int[] {0, 1},
                new int[] {1, 2});
        run.graphAnalyzed(3, 2, ComponentAnalyzer.analyze(tree));

        run.complete(new EdgePartition(List.of(), List.of(), tree),
                LevelAssigner.assign(tree, LevelMode.LONGEST_PATH), 1);

        assertEquals(DecompositionStatus.COMPLETED, run.status());
        assertEquals(3, run.nodeCount());
        assertEquals(3, run.componentCount());
        assertEquals(2, run.maxLevel());
        assertEquals(1, run.attempts());
        assertNotNull(run.finishedAt());
    }

    @Test
    void whenFailing_givenReason_shouldKeepIt() {
        final DecompositionRun run = start();

        run.fail("boom");

        assertEquals(DecompositionStatus.FAILED, run.status());
        assertEquals("boom", run.errorMessage());
    }

    @Test
    void whenFailing_givenCompletedRun_shouldReject() {
        final DecompositionRun run = start();
        run.fail("first");

        assertThrows(DomainException.class, () -> run.fail("second"));
    }

    private static DecompositionRun start() {
        return DecompositionRun.start(FeedbackArcSetStrategyType.GREEDY_ORDERING,
                DecompositionScope.LARGEST_COMPONENT, LevelMode.LONGEST_PATH);
    }

}
