package queryrouter.router;

import io.micronaut.core.annotation.Nullable;
import queryrouter.classifier.QueryClassifier;
import queryrouter.engine.QueryContext;
import queryrouter.engine.QueryEngine;
import queryrouter.exception.EngineExecutionException;
import queryrouter.exception.PlanningException;
import queryrouter.exception.QueryCancelledException;
import queryrouter.model.PlanNode;
import queryrouter.model.PlanNodeKind;
import queryrouter.model.QueryResult;
import queryrouter.model.QueryType;
import queryrouter.planner.QueryPlanner;

import java.sql.SQLException;
import java.util.Objects;

/**
 * Single entry point that couples a query's classification to one of two engines.
 *
 * TRANSACTIONAL statements go to the transactional engine; ANALYTICAL and HYBRID
 * statements go to the analytical engine. Every route invokes exactly one engine
 * exactly once, and engine failures are wrapped, never retried or redirected to
 * the other engine.
 *
 * Immutable and thread-safe. The router does not own the engines' lifecycle.
 */
public final class EngineRouter {

    private final QueryEngine transactional;
    private final QueryEngine analytical;
    private final QueryClassifier classifier;
    private final QueryPlanner planner;

    public EngineRouter(QueryEngine transactional, QueryEngine analytical) {
        this(transactional, analytical, new QueryClassifier(), new QueryPlanner());
    }

    public EngineRouter(
            QueryEngine transactional,
            QueryEngine analytical,
            QueryClassifier classifier,
            QueryPlanner planner) {
        this.transactional = Objects.requireNonNull(transactional, "transactional engine is required");
        this.analytical = Objects.requireNonNull(analytical, "analytical engine is required");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.planner = Objects.requireNonNull(planner, "planner");
    }

    /**
     * Classifies a statement and executes it on the matching engine.
     *
     * @param ctx   cancellation and deadline, checked before dispatch
     * @param query statement text
     * @param args  positional parameters passed through to the engine
     * @return the engine's result
     * @throws QueryCancelledException  if the context is done before or during dispatch
     * @throws EngineExecutionException if the engine fails or returns nothing
     */
    public QueryResult routeQuery(QueryContext ctx, String query, Object... args) {
        Objects.requireNonNull(ctx, "ctx");
        QueryType queryType = classifier.classify(query);
        QueryEngine engine = engineFor(queryType);
        return dispatch(ctx, queryType, engine, () -> engine.execute(ctx, query, args));
    }

    /**
     * Routes like {@link #routeQuery} and attaches the rendered plan to the result.
     */
    public QueryResult routeAndExplain(QueryContext ctx, String query, Object... args) {
        QueryResult result = routeQuery(ctx, query, args);
        return result.withPlanExplanation(planner.explainPlan(planner.plan(query), ""));
    }

    /**
     * Describes how a statement would be classified, planned and routed without executing it.
     *
     * @param ctx   caller context; explaining never blocks, so it is not consulted
     * @param query statement text
     * @return a multi-line explanation
     * @throws PlanningException reserved for parser-backed planning; the lexical planner never fails
     */
    public String explainQuery(QueryContext ctx, String query) {
        QueryType queryType = classifier.classify(query);
        PlanNode plan = planner.plan(query);

        return "Query Type: " + queryType.name() + "\n"
                + "Engine: " + engineFor(queryType).getName() + "\n"
                + "\n"
                + "Execution Plan:\n"
                + planner.explainPlan(plan, "  ");
    }

    public QueryType classifyQuery(@Nullable String query) {
        return classifier.classify(query);
    }

    /**
     * Executes a caller-supplied plan. When the root records a query type, as
     * plans from {@link QueryPlanner} do, the plan goes where {@link #routeQuery}
     * would send its statement. Otherwise a plan rooted at SCAN runs on the
     * transactional engine and any other root runs on the analytical engine.
     *
     * @param ctx  cancellation and deadline, checked before dispatch
     * @param plan root of the plan to execute
     * @return the engine's result
     */
    public QueryResult routeWithPlan(QueryContext ctx, PlanNode plan) {
        Objects.requireNonNull(ctx, "ctx");
        Objects.requireNonNull(plan, "plan");
        QueryType queryType = classifyPlan(plan);
        QueryEngine engine = engineFor(queryType);
        return dispatch(ctx, queryType, engine, () -> engine.executeWithPlan(ctx, plan));
    }

    /**
     * The routing decision alone: which engine serves a query type.
     */
    public QueryEngine engineFor(QueryType queryType) {
        return switch (queryType) {
            case TRANSACTIONAL -> transactional;
            case ANALYTICAL, HYBRID -> analytical;
        };
    }

    public QueryEngine getTransactionalEngine() {
        return transactional;
    }

    public QueryEngine getAnalyticalEngine() {
        return analytical;
    }

    public QueryPlanner getPlanner() {
        return planner;
    }

    private static QueryType classifyPlan(PlanNode plan) {
        QueryType recorded = recordedQueryType(plan);
        if (recorded != null) {
            return recorded;
        }
        if (plan.getKind() == PlanNodeKind.SCAN) {
            return QueryType.TRANSACTIONAL;
        }
        return plan.contains(PlanNodeKind.JOIN) ? QueryType.HYBRID : QueryType.ANALYTICAL;
    }

    @Nullable
    private static QueryType recordedQueryType(PlanNode plan) {
        String value = plan.getAttribute(QueryPlanner.QUERY_TYPE_ATTRIBUTE);
        if (value == null) {
            return null;
        }
        for (QueryType type : QueryType.values()) {
            if (type.name().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        return null;
    }

    private static QueryResult dispatch(
            QueryContext ctx,
            QueryType queryType,
            QueryEngine engine,
            EngineCall call) {

        String reason = ctx.doneReason();
        if (reason != null) {
            throw new QueryCancelledException(queryType,
                    "Query " + reason + " before dispatch to " + engine.getName() + " engine");
        }

        QueryResult result;
        try {
            result = call.run();
        } catch (SQLException | RuntimeException e) {
            String doneReason = ctx.doneReason();
            if (doneReason != null) {
                throw new QueryCancelledException(queryType,
                        "Query " + doneReason + " during execution on " + engine.getName() + " engine", e);
            }
            throw new EngineExecutionException(queryType, engine.getName(),
                    "Execution of " + queryType.name() + " query failed on " + engine.getName()
                            + " engine: " + e.getMessage(), e);
        }

        if (result == null) {
            throw new EngineExecutionException(queryType, engine.getName(),
                    engine.getName() + " engine returned no result");
        }
        return result;
    }

    @FunctionalInterface
    private interface EngineCall {
        QueryResult run() throws SQLException;
    }
}
