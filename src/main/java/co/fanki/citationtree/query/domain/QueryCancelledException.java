package co.fanki.citationtree.query.domain;

import co.fanki.citationtree.shared.DomainException;

/**
 * The query was cancelled; no result is produced.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class QueryCancelledException extends DomainException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new QueryCancelledException.
     *
     * @param message the error message
     */
    public QueryCancelledException(final String message) {
        super(message, "QUERY_CANCELLED");
    }

}
