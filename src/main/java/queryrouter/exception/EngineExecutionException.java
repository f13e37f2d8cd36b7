package queryrouter.exception;

import queryrouter.model.QueryType;

/**
 * Exception thrown when the selected engine fails a statement or plan.
 * Always attributable to one routing decision: the query type and the engine chosen for it.
 */
public class EngineExecutionException extends QueryRoutingException {

    private final String engineName;

    public EngineExecutionException(QueryType queryType, String engineName, String message, Throwable cause) {
        super(queryType, message, cause);
        this.engineName = engineName;
    }

    public EngineExecutionException(QueryType queryType, String engineName, String message) {
        super(queryType, message, null);
        this.engineName = engineName;
    }

    public String getEngineName() {
        return engineName;
    }
}
