package queryrouter.config;

import io.micronaut.context.annotation.Factory;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import queryrouter.classifier.QueryClassifier;
import queryrouter.engine.JdbcQueryEngine;
import queryrouter.engine.QueryEngine;
import queryrouter.planner.QueryPlanner;
import queryrouter.router.EngineRouter;

import javax.sql.DataSource;

/**
 * Factory wiring the two engines to their data sources and both into one router.
 * Data source pools are owned by the container, not by the engines or the router.
 */
@Factory
public class EngineFactory {

    private static final Logger LOG = LoggerFactory.getLogger(EngineFactory.class);

    private final RouterProperties properties;

    public EngineFactory(RouterProperties properties) {
        this.properties = properties;
    }

    @Singleton
    @Named("transactional")
    public QueryEngine transactionalEngine(@Named("transactional") DataSource dataSource) {
        RouterProperties.EnginesConfig engines = properties.engines();
        LOG.info("Creating transactional engine: {}", engines.transactionalName());
        return new JdbcQueryEngine(engines.transactionalName(), dataSource, engines.statementTimeoutSeconds());
    }

    @Singleton
    @Named("analytical")
    public QueryEngine analyticalEngine(@Named("analytical") DataSource dataSource) {
        RouterProperties.EnginesConfig engines = properties.engines();
        LOG.info("Creating analytical engine: {}", engines.analyticalName());
        return new JdbcQueryEngine(engines.analyticalName(), dataSource, engines.statementTimeoutSeconds());
    }

    /**
     * The one router instance shared by every request.
     */
    @Singleton
    public EngineRouter engineRouter(
            @Named("transactional") QueryEngine transactional,
            @Named("analytical") QueryEngine analytical,
            QueryClassifier classifier,
            QueryPlanner planner) {
        return new EngineRouter(transactional, analytical, classifier, planner);
    }
}
