package co.fanki.citationtree.query.domain;

import co.fanki.citationtree.shared.DomainException;

/**
 * The query work itself failed.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class QueryExecutionException extends DomainException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new QueryExecutionException.
     *
     * @param message the error message
     * @param cause the failure raised by the work
     */
    public QueryExecutionException(final String message,
            final Throwable cause) {
        super(message, "QUERY_FAILED", cause);
    }

}
