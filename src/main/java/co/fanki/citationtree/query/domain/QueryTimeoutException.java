package co.fanki.citationtree.query.domain;

import co.fanki.citationtree.shared.DomainException;

/**
 * The caller stopped waiting because the query outlived its timeout.
 *
 * <p>Retryable. The worker may still be executing the read.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class QueryTimeoutException extends DomainException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new QueryTimeoutException.
     *
     * @param message the error message
     */
    public QueryTimeoutException(final String message) {
        super(message, "QUERY_TIMEOUT");
    }

}
