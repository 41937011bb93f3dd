package co.fanki.citationtree.decomposition.domain;

import co.fanki.citationtree.shared.DomainException;

/**
 * Raised when a decomposition cannot be proven acyclic.
 *
 * <p>Always fatal: the run is aborted and nothing is published.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DecompositionInvariantException extends DomainException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new DecompositionInvariantException.
     *
     * @param message what was violated
     */
    public DecompositionInvariantException(final String message) {
        super(message, "DECOMPOSITION_INVARIANT_VIOLATED");
    }

}
