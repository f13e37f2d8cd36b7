package queryrouter.exception;

import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import jakarta.validation.ConstraintViolationException;
import org.junit.jupiter.api.Test;
import queryrouter.config.RouterProperties;
import queryrouter.model.QueryType;

import java.sql.SQLException;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for GlobalExceptionHandler.
 * Tests status mapping and how much detail reaches the client.
 */
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler concealingHandler = handler(false, false);
    private final GlobalExceptionHandler exposingHandler = handler(true, true);

    @Test
    void testWhenEngineFailsThenReturns500WithoutEngineName() {
        // Arrange
        HttpRequest<?> request = HttpRequest.POST("/query", "");
        Exception exception = new EngineExecutionException(QueryType.HYBRID, "Analytical",
                "Execution of HYBRID query failed on Analytical engine: boom", new SQLException("boom"));

        // Act
        HttpResponse<Map<String, Object>> response = concealingHandler.handle(request, exception);

        // Assert
        assertThat((Object) response.getStatus()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.body())
                .containsEntry("success", false)
                .containsEntry("error", "Database Error")
                .containsEntry("message", "A database error occurred")
                .containsEntry("queryType", "HYBRID")
                .doesNotContainKeys("engine", "stackTrace");
    }

    @Test
    void testWhenDetailsExposedThenEngineNameAndStackTraceAreIncluded() {
        // Arrange
        HttpRequest<?> request = HttpRequest.POST("/query", "");
        Exception exception = new EngineExecutionException(QueryType.TRANSACTIONAL, "Transactional",
                "Execution of TRANSACTIONAL query failed on Transactional engine: duplicate key");

        // Act
        HttpResponse<Map<String, Object>> response = exposingHandler.handle(request, exception);

        // Assert
        assertThat(response.body())
                .containsEntry("engine", "Transactional")
                .containsEntry("message", exception.getMessage())
                .containsKey("stackTrace");
        assertThat((String[]) response.body().get("stackTrace")).hasSizeLessThanOrEqualTo(10);
    }

    @Test
    void testWhenQueryCancelledThenReturns408() {
        // Arrange
        HttpRequest<?> request = HttpRequest.POST("/query", "");
        Exception exception = new QueryCancelledException(QueryType.ANALYTICAL,
                "Query deadline exceeded before dispatch to Analytical engine");

        // Act
        HttpResponse<Map<String, Object>> response = concealingHandler.handle(request, exception);

        // Assert
        assertThat((Object) response.getStatus()).isEqualTo(HttpStatus.REQUEST_TIMEOUT);
        assertThat(response.body())
                .containsEntry("error", "Query Cancelled")
                .containsEntry("message", "The query was cancelled or timed out")
                .containsEntry("queryType", "ANALYTICAL");
    }

    @Test
    void testWhenPlanningFailsThenReturns400() {
        // Arrange
        HttpRequest<?> request = HttpRequest.POST("/query/explain", "");

        // Act
        HttpResponse<Map<String, Object>> response =
                exposingHandler.handle(request, new PlanningException("Unbalanced parentheses"));

        // Assert
        assertThat((Object) response.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.body())
                .containsEntry("error", "Planning Error")
                .containsEntry("message", "Unbalanced parentheses")
                .doesNotContainKey("queryType");
    }

    @Test
    void testWhenValidationFailsThenReturns400() {
        // Arrange
        HttpRequest<?> request = HttpRequest.POST("/query", "");
        Exception exception = new ConstraintViolationException("query: must not be blank", Set.of());

        // Act
        HttpResponse<Map<String, Object>> response = exposingHandler.handle(request, exception);

        // Assert
        assertThat((Object) response.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.body())
                .containsEntry("error", "Validation Error")
                .containsKey("details");
    }

    @Test
    void testWhenIllegalArgumentThenReturns400() {
        // Arrange
        HttpRequest<?> request = HttpRequest.POST("/query", "");

        // Act
        HttpResponse<Map<String, Object>> response =
                concealingHandler.handle(request, new IllegalArgumentException("timeout must not be negative"));

        // Assert
        assertThat((Object) response.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.body())
                .containsEntry("error", "Bad Request")
                .containsEntry("message", "Invalid request parameters");
    }

    @Test
    void testWhenUnexpectedErrorThenReturns500() {
        // Arrange
        HttpRequest<?> request = HttpRequest.GET("/query");

        // Act
        HttpResponse<Map<String, Object>> response =
                concealingHandler.handle(request, new IllegalStateException("boom"));

        // Assert
        assertThat((Object) response.getStatus()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.body())
                .containsEntry("error", "Internal Server Error")
                .containsEntry("message", "An unexpected error occurred")
                .containsEntry("path", "/query")
                .containsEntry("method", "GET");
    }

    private static GlobalExceptionHandler handler(boolean exposeDetails, boolean exposeStackTrace) {
        return new GlobalExceptionHandler(new RouterProperties(30000, null, null,
                new RouterProperties.ErrorHandlingConfig(exposeDetails, exposeStackTrace)));
    }
}
