package queryrouter.exception;

import io.micronaut.core.annotation.Nullable;
import queryrouter.model.QueryType;

/**
 * Exception thrown when the caller's context was cancelled or expired before
 * or during dispatch.
 */
public class QueryCancelledException extends QueryRoutingException {

    public QueryCancelledException(QueryType queryType, String message, @Nullable Throwable cause) {
        super(queryType, message, cause);
    }

    public QueryCancelledException(QueryType queryType, String message) {
        this(queryType, message, null);
    }
}
