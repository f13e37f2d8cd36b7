package queryrouter.exception;

import io.micronaut.context.annotation.Requires;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.server.exceptions.ExceptionHandler;
import jakarta.inject.Singleton;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import queryrouter.config.RouterProperties;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Global exception handler for the query endpoints.
 * Converts router failures to HTTP responses with structured error bodies.
 * Detail exposure is controlled by router.error-handling configuration.
 */
@Produces
@Singleton
@Requires(classes = {Exception.class, ExceptionHandler.class})
public class GlobalExceptionHandler implements ExceptionHandler<Exception, HttpResponse<Map<String, Object>>> {

    private static final Logger LOG = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final RouterProperties properties;

    public GlobalExceptionHandler(RouterProperties properties) {
        this.properties = properties;
    }

    @Override
    public HttpResponse<Map<String, Object>> handle(HttpRequest request, Exception exception) {
        LOG.error("Request {} {} failed: {}",
                request.getMethod(), request.getPath(), exception.getMessage(), exception);

        Map<String, Object> error = new LinkedHashMap<>();
        error.put("success", false);
        error.put("path", request.getPath());
        error.put("method", request.getMethodName());

        boolean exposeDetails = properties.errorHandling().exposeDetails();
        boolean exposeStackTrace = properties.errorHandling().exposeStackTrace();

        if (exception instanceof QueryCancelledException qce) {
            error.put("error", "Query Cancelled");
            error.put("message", exposeDetails ? qce.getMessage() : "The query was cancelled or timed out");
            putQueryType(error, qce);
            addStackTraceIfEnabled(error, exception, exposeStackTrace);
            return HttpResponse.status(HttpStatus.REQUEST_TIMEOUT).body(error);
        }

        if (exception instanceof EngineExecutionException eee) {
            error.put("error", "Database Error");
            if (exposeDetails) {
                error.put("message", eee.getMessage());
                error.put("engine", eee.getEngineName());
            } else {
                error.put("message", "A database error occurred");
            }
            putQueryType(error, eee);
            // Always log the routing decision for server-side debugging
            LOG.error("Engine failure: queryType={}, engine={}: {}", eee.getQueryType(), eee.getEngineName(),
                    eee.getCause() != null ? eee.getCause().getMessage() : eee.getMessage());
            addStackTraceIfEnabled(error, exception, exposeStackTrace);
            return HttpResponse.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
        }

        if (exception instanceof PlanningException pe) {
            error.put("error", "Planning Error");
            error.put("message", exposeDetails ? pe.getMessage() : "The query could not be planned");
            addStackTraceIfEnabled(error, exception, exposeStackTrace);
            return HttpResponse.status(HttpStatus.BAD_REQUEST).body(error);
        }

        if (exception instanceof ConstraintViolationException cve) {
            error.put("error", "Validation Error");
            if (exposeDetails) {
                error.put("message", cve.getMessage());
                error.put("details", violations(cve));
            } else {
                error.put("message", "Request validation failed");
            }
            addStackTraceIfEnabled(error, exception, exposeStackTrace);
            return HttpResponse.status(HttpStatus.BAD_REQUEST).body(error);
        }

        if (exception instanceof IllegalArgumentException) {
            error.put("error", "Bad Request");
            error.put("message", exposeDetails ? exception.getMessage() : "Invalid request parameters");
            addStackTraceIfEnabled(error, exception, exposeStackTrace);
            return HttpResponse.status(HttpStatus.BAD_REQUEST).body(error);
        }

        // Generic internal error
        error.put("error", "Internal Server Error");
        if (exposeDetails) {
            error.put("message", exception.getMessage());
        } else {
            error.put("message", "An unexpected error occurred");
        }
        addStackTraceIfEnabled(error, exception, exposeStackTrace);

        return HttpResponse.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    private void putQueryType(Map<String, Object> error, QueryRoutingException exception) {
        if (exception.getQueryType() != null) {
            error.put("queryType", exception.getQueryType().name());
        }
    }

    private List<String> violations(ConstraintViolationException exception) {
        return exception.getConstraintViolations().stream()
                .map(this::describe)
                .sorted()
                .toList();
    }

    private String describe(ConstraintViolation<?> violation) {
        return violation.getPropertyPath() + ": " + violation.getMessage();
    }

    /**
     * Adds stack trace to error response if enabled.
     */
    private void addStackTraceIfEnabled(Map<String, Object> error, Exception exception, boolean exposeStackTrace) {
        if (exposeStackTrace) {
            StackTraceElement[] stackTrace = exception.getStackTrace();
            if (stackTrace != null && stackTrace.length > 0) {
                // Include only the first few frames to avoid huge responses
                int maxFrames = Math.min(10, stackTrace.length);
                String[] frames = new String[maxFrames];
                for (int i = 0; i < maxFrames; i++) {
                    frames[i] = stackTrace[i].toString();
                }
                error.put("stackTrace", frames);
            }
        }
    }
}
