package co.fanki.citationtree.shared;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

/**
 * Maps domain errors to HTTP responses carrying {@code error} and
 * {@code errorCode}.
 *
 * <p>A timeout is reported as 504 and flagged retryable so clients can tell
 * it apart from a server error. A cancelled query yields 204 with no
 * body.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ErrorResponses {

    private ErrorResponses() {
    }

    /**
     * Builds the response for a domain error.
     *
     * @param e the error
     * @return the response
     */
    public static ResponseEntity<Object> of(final DomainException e) {
        final HttpStatus status = statusOf(e.getErrorCode());
        if (status == HttpStatus.NO_CONTENT) {
            return ResponseEntity.noContent().build();
        }
        final String message = e.getMessage() != null
                ? e.getMessage() : e.getErrorCode();
        if (status == HttpStatus.GATEWAY_TIMEOUT
                || status == HttpStatus.SERVICE_UNAVAILABLE) {
            return ResponseEntity.status(status).body(Map.of(
                    "error", message,
                    "errorCode", e.getErrorCode(),
                    "retryable", true));
        }
        return ResponseEntity.status(status).body(Map.of(
                "error", message,
                "errorCode", e.getErrorCode()));
    }

    /**
     * @param errorCode a domain error code
     * @return the HTTP status for it, 400 unless listed
     */
    public static HttpStatus statusOf(final String errorCode) {
        return switch (errorCode) {
            case "QUERY_TIMEOUT" -> HttpStatus.GATEWAY_TIMEOUT;
            case "QUERY_CANCELLED" -> HttpStatus.NO_CONTENT;
            case "QUERY_REJECTED" -> HttpStatus.SERVICE_UNAVAILABLE;
            case "QUERY_FAILED", "DECOMPOSITION_INVARIANT_VIOLATED",
                    "DANGLING_EDGE", "DUPLICATE_NODE" ->
                    HttpStatus.INTERNAL_SERVER_ERROR;
            case "NODE_NOT_FOUND", "RUN_NOT_FOUND" -> HttpStatus.NOT_FOUND;
            case "DECOMPOSITION_IN_PROGRESS" -> HttpStatus.CONFLICT;
            default -> HttpStatus.BAD_REQUEST;
        };
    }

}
