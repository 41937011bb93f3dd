package co.fanki.citationtree.decomposition.domain;

import co.fanki.citationtree.shared.DomainException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link DecompositionStateMachine}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class DecompositionStateMachineTest {

    @Test
    void whenTransitioning_givenRunningToCompleted_shouldAllow() {
        assertEquals(DecompositionStatus.COMPLETED,
                DecompositionStateMachine.transition(
                        DecompositionStatus.RUNNING,
                        DecompositionStatus.COMPLETED));
    }

    @Test
    void whenTransitioning_givenRunningToFailed_shouldAllow() {
        assertEquals(DecompositionStatus.FAILED,
                DecompositionStateMachine.transition(
                        DecompositionStatus.RUNNING,
                        DecompositionStatus.FAILED));
    }

    @Test
    void whenTransitioning_givenFinishedRun_shouldReject() {
        final DomainException e = assertThrows(DomainException.class,
                () -> DecompositionStateMachine.transition(
                        DecompositionStatus.COMPLETED,
                        DecompositionStatus.FAILED));

        assertEquals("RUN_INVALID_TRANSITION", e.getErrorCode());
    }

    @Test
    void whenTransitioning_givenNull_shouldThrowNullPointer() {
        assertThrows(NullPointerException.class,
                () -> DecompositionStateMachine.transition(null,
                        DecompositionStatus.FAILED));
    }

}
