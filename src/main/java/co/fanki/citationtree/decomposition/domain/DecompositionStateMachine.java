package co.fanki.citationtree.decomposition.domain;

import co.fanki.citationtree.shared.DomainException;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Valid decomposition run status transitions.
 *
 * <pre>
 *   RUNNING → COMPLETED, FAILED
 * </pre>
 *
 * <p>Finished runs never change again.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class DecompositionStateMachine {

    private static final Map<DecompositionStatus, Set<DecompositionStatus>>
            TRANSITIONS;

    static {
        TRANSITIONS = new EnumMap<>(DecompositionStatus.class);
        TRANSITIONS.put(DecompositionStatus.RUNNING, EnumSet.of(
                DecompositionStatus.COMPLETED, DecompositionStatus.FAILED));
        TRANSITIONS.put(DecompositionStatus.COMPLETED,
                EnumSet.noneOf(DecompositionStatus.class));
        TRANSITIONS.put(DecompositionStatus.FAILED,
                EnumSet.noneOf(DecompositionStatus.class));
    }

    private DecompositionStateMachine() {
    }

    /**
     * Validates a status transition.
     *
     * @param from the current status
     * @param to the desired status
     * @return {@code to} when the transition is valid
     * @throws DomainException with code {@code RUN_INVALID_TRANSITION} when
     *         the transition is not permitted
     * @throws NullPointerException if {@code from} or {@code to} is null
     */
    public static DecompositionStatus transition(
            final DecompositionStatus from, final DecompositionStatus to) {
        if (from == null || to == null) {
            throw new NullPointerException("from and to must not be null");
        }
        if (!TRANSITIONS.get(from).contains(to)) {
            throw new DomainException(
                    "Invalid transition: " + from + " → " + to,
                    "RUN_INVALID_TRANSITION");
        }
        return to;
    }

}
