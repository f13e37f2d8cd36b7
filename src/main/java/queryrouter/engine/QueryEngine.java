package queryrouter.engine;

import queryrouter.model.PlanNode;
import queryrouter.model.QueryResult;

import java.sql.SQLException;

/**
 * A backing execution engine the router can dispatch to.
 * Implementations must be safe to call from many threads at once;
 * the router adds no serialization of its own.
 */
public interface QueryEngine {

    /**
     * Executes a statement.
     *
     * @param ctx   cancellation and deadline of the call
     * @param query statement text
     * @param args  positional parameters bound to {@code ?} placeholders
     * @return the statement's result, never null
     * @throws SQLException when the engine rejects or fails the statement
     */
    QueryResult execute(QueryContext ctx, String query, Object... args) throws SQLException;

    /**
     * Executes a pre-built plan.
     *
     * @param ctx  cancellation and deadline of the call
     * @param plan root of the plan to run
     * @return the plan's result, never null
     * @throws SQLException when the engine cannot run the plan
     */
    QueryResult executeWithPlan(QueryContext ctx, PlanNode plan) throws SQLException;

    /**
     * Stable engine name. Used for diagnostics only, never for routing decisions.
     */
    String getName();
}
