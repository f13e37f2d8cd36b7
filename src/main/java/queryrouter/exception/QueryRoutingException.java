package queryrouter.exception;

import io.micronaut.core.annotation.Nullable;
import queryrouter.model.QueryType;

/**
 * Base class for failures surfaced by the engine router.
 * Carries the classification the router had made when the failure happened.
 */
public abstract class QueryRoutingException extends RuntimeException {

    private final QueryType queryType;

    protected QueryRoutingException(@Nullable QueryType queryType, String message, @Nullable Throwable cause) {
        super(message, cause);
        this.queryType = queryType;
    }

    /**
     * @return the classification, or {@code null} when the failure preceded classification
     */
    @Nullable
    public QueryType getQueryType() {
        return queryType;
    }
}
