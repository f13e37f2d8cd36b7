package queryrouter.service;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micronaut.core.annotation.Nullable;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import queryrouter.config.RouterProperties;
import queryrouter.engine.QueryContext;
import queryrouter.exception.QueryCancelledException;
import queryrouter.exception.QueryRoutingException;
import queryrouter.model.QueryResult;
import queryrouter.model.QueryType;
import queryrouter.router.EngineRouter;

import java.time.Duration;
import java.util.List;

/**
 * Request-facing layer around the {@link EngineRouter}.
 * Adds logging, timing and the default deadline around each routed call.
 * Like the router, it never retries and never falls back to the other engine.
 */
@Singleton
public class QueryService {

    private static final Logger LOG = LoggerFactory.getLogger(QueryService.class);

    static final String TIMER_NAME = "router.query.execution";

    private final EngineRouter router;
    private final MeterRegistry meterRegistry;
    private final RouterProperties properties;

    public QueryService(EngineRouter router, MeterRegistry meterRegistry, RouterProperties properties) {
        this.router = router;
        this.meterRegistry = meterRegistry;
        this.properties = properties;
    }

    /**
     * Routes a statement to its engine and records the outcome.
     *
     * @param query     statement text
     * @param args      positional parameters, may be null
     * @param explain   whether to attach the plan explanation to the result
     * @param timeoutMs per-call timeout; null uses the configured default, 0 disables it
     * @return the result with the routing decision that produced it
     */
    public RoutedQuery execute(String query, @Nullable List<Object> args, boolean explain, @Nullable Long timeoutMs) {
        QueryType queryType = router.classifyQuery(query);
        String engineName = router.engineFor(queryType).getName();
        Object[] params = args == null ? new Object[0] : args.toArray();
        QueryContext ctx = contextFor(timeoutMs);

        LOG.debug("Routing {} query to {} engine with {} parameter(s)", queryType, engineName, params.length);
        Timer.Sample sample = Timer.start(meterRegistry);

        try {
            QueryResult result = explain
                    ? router.routeAndExplain(ctx, query, params)
                    : router.routeQuery(ctx, query, params);

            sample.stop(timer(queryType, engineName, "success"));
            LOG.debug("{} query on {} engine finished in {} ms",
                    queryType, engineName, result.getExecutionTime().toMillis());
            return new RoutedQuery(queryType, engineName, result);

        } catch (QueryCancelledException e) {
            sample.stop(timer(queryType, engineName, "cancelled"));
            LOG.warn("{} query on {} engine cancelled: {}", queryType, engineName, e.getMessage());
            throw e;

        } catch (QueryRoutingException e) {
            sample.stop(timer(queryType, engineName, "error"));
            LOG.error("{} query on {} engine failed: {}", queryType, engineName, e.getMessage(), e);
            throw e;
        }
    }

    public String explain(String query) {
        return router.explainQuery(QueryContext.background(), query);
    }

    public QueryType classify(String query) {
        return router.classifyQuery(query);
    }

    private QueryContext contextFor(@Nullable Long timeoutMs) {
        long effective = timeoutMs != null ? timeoutMs : properties.defaultTimeoutMs();
        return effective > 0
                ? QueryContext.withTimeout(Duration.ofMillis(effective))
                : QueryContext.background();
    }

    private Timer timer(QueryType queryType, String engineName, String status) {
        return Timer.builder(TIMER_NAME)
                .tag("queryType", queryType.name())
                .tag("engine", engineName)
                .tag("status", status)
                .register(meterRegistry);
    }
}
