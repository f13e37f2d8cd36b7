package queryrouter.exception;

import io.micronaut.core.annotation.Nullable;

/**
 * Thrown when a statement cannot be turned into a plan.
 * The lexical planner never throws it; it is reserved for parser-backed planners.
 */
public class PlanningException extends QueryRoutingException {

    public PlanningException(String message, @Nullable Throwable cause) {
        super(null, message, cause);
    }

    public PlanningException(String message) {
        this(message, null);
    }
}
