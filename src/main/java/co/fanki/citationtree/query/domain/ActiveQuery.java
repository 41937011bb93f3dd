package co.fanki.citationtree.query.domain;

/**
 * Introspection view of an outstanding submission.
 *
 * @param queryId the submission id
 * @param requestId the request the submission belongs to
 * @param kind the query kind
 * @param status queued or running
 * @param elapsedMillis time since submission
 * @param description what the query does, truncated
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ActiveQuery(
        String queryId,
        String requestId,
        QueryKind kind,
        QueryStatus status,
        long elapsedMillis,
        String description) {
}
