package queryrouter.health;

import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import io.micronaut.health.HealthStatus;
import io.micronaut.management.health.indicator.HealthIndicator;
import io.micronaut.management.health.indicator.HealthResult;
import jakarta.inject.Singleton;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import queryrouter.engine.JdbcQueryEngine;
import queryrouter.engine.QueryEngine;
import queryrouter.router.EngineRouter;
import reactor.core.publisher.Mono;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health indicator that checks both engines the router dispatches to.
 * The router is only UP when both engines accept connections.
 */
@Singleton
public class EngineHealthIndicator implements HealthIndicator {

    private static final Logger LOG = LoggerFactory.getLogger(EngineHealthIndicator.class);
    private static final String NAME = "engines";

    private final EngineRouter router;

    public EngineHealthIndicator(EngineRouter router) {
        this.router = router;
    }

    @Override
    public Publisher<HealthResult> getResult() {
        return Mono.fromCallable(this::checkEngines);
    }

    HealthResult checkEngines() {
        Map<String, Object> details = new LinkedHashMap<>();
        boolean transactionalUp = checkEngine(router.getTransactionalEngine(), "transactional", details);
        boolean analyticalUp = checkEngine(router.getAnalyticalEngine(), "analytical", details);

        HealthStatus status = transactionalUp && analyticalUp ? HealthStatus.UP : HealthStatus.DOWN;
        return HealthResult.builder(NAME, status)
                .details(details)
                .build();
    }

    private boolean checkEngine(QueryEngine engine, String role, Map<String, Object> details) {
        Map<String, Object> engineDetails = new LinkedHashMap<>();
        engineDetails.put("name", engine.getName());
        details.put(role, engineDetails);

        if (!(engine instanceof JdbcQueryEngine jdbcEngine)) {
            // Nothing to probe; the engine is trusted to report its own failures
            engineDetails.put("status", "UNKNOWN");
            return true;
        }

        DataSource dataSource = jdbcEngine.getDataSource();
        try (Connection connection = dataSource.getConnection()) {
            boolean isValid = connection.isValid(5); // 5 second timeout

            engineDetails.put("status", isValid ? "UP" : "DOWN");
            engineDetails.put("database", connection.getMetaData().getDatabaseProductName());
            engineDetails.put("version", connection.getMetaData().getDatabaseProductVersion());
            addPoolMetrics(dataSource, engineDetails);

            if (!isValid) {
                LOG.warn("Engine health check failed for {}: connection not valid", engine.getName());
            }
            return isValid;

        } catch (Exception e) {
            engineDetails.put("status", "DOWN");
            engineDetails.put("error", e.getClass().getSimpleName());
            engineDetails.put("message", e.getMessage());

            LOG.error("Engine health check failed for {}", engine.getName(), e);
            return false;
        }
    }

    private void addPoolMetrics(DataSource dataSource, Map<String, Object> details) {
        if (!(dataSource instanceof HikariDataSource hikariDataSource)) {
            return;
        }
        HikariPoolMXBean poolMXBean = hikariDataSource.getHikariPoolMXBean();
        if (poolMXBean != null) {
            details.put("pool.active", poolMXBean.getActiveConnections());
            details.put("pool.idle", poolMXBean.getIdleConnections());
            details.put("pool.total", poolMXBean.getTotalConnections());
            details.put("pool.waiting", poolMXBean.getThreadsAwaitingConnection());
        }
    }
}
