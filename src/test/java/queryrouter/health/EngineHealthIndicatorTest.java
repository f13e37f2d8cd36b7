package queryrouter.health;

import com.zaxxer.hikari.HikariDataSource;
import io.micronaut.health.HealthStatus;
import io.micronaut.management.health.indicator.HealthResult;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;
import queryrouter.engine.JdbcQueryEngine;
import queryrouter.router.EngineRouter;
import queryrouter.support.RecordingQueryEngine;
import reactor.core.publisher.Mono;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for EngineHealthIndicator.
 */
@MicronautTest
class EngineHealthIndicatorTest {

    @Inject
    EngineHealthIndicator healthIndicator;

    @Test
    void testWhenBothDataSourcesReachableThenStatusIsUp() {
        // Act
        HealthResult result = Mono.from(healthIndicator.getResult()).block();

        // Assert
        assertThat(result).isNotNull();
        assertThat(result.getName()).isEqualTo("engines");
        assertThat((Object) result.getStatus()).isEqualTo(HealthStatus.UP);

        Map<String, Object> details = details(result);
        assertThat(details).containsOnlyKeys("transactional", "analytical");
        assertThat(engineDetails(details, "transactional"))
                .containsEntry("name", "Transactional")
                .containsEntry("status", "UP")
                .containsEntry("database", "H2")
                .containsKey("version");
        assertThat(engineDetails(details, "analytical"))
                .containsEntry("name", "Analytical")
                .containsEntry("status", "UP");
    }

    @Test
    void testWhenEngineIsNotJdbcBackedThenItIsReportedUnknown() {
        // Arrange
        EngineRouter router = new EngineRouter(
                new RecordingQueryEngine("Transactional"), new RecordingQueryEngine("Analytical"));

        // Act
        HealthResult result = new EngineHealthIndicator(router).checkEngines();

        // Assert
        assertThat((Object) result.getStatus()).isEqualTo(HealthStatus.UP);
        assertThat(engineDetails(details(result), "analytical")).containsEntry("status", "UNKNOWN");
    }

    @Test
    void testWhenOneDataSourceIsUnreachableThenStatusIsDown() {
        // Arrange
        try (HikariDataSource broken = new HikariDataSource()) {
            broken.setJdbcUrl("jdbc:unreachable:warehouse");
            broken.setConnectionTimeout(250);
            EngineRouter router = new EngineRouter(
                    new RecordingQueryEngine("Transactional"),
                    new JdbcQueryEngine("Analytical", broken, 1));

            // Act
            HealthResult result = new EngineHealthIndicator(router).checkEngines();

            // Assert
            assertThat((Object) result.getStatus()).isEqualTo(HealthStatus.DOWN);
            assertThat(engineDetails(details(result), "analytical"))
                    .containsEntry("status", "DOWN")
                    .containsKey("error");
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> details(HealthResult result) {
        return (Map<String, Object>) result.getDetails();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> engineDetails(Map<String, Object> details, String role) {
        return (Map<String, Object>) details.get(role);
    }
}
