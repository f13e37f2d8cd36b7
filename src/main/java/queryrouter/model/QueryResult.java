package queryrouter.model;

import io.micronaut.core.annotation.Nullable;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Uniform result of a routed query, whichever engine produced it.
 * Engines adapt their native result shape into this type.
 */
public final class QueryResult {

    private final List<String> columns;
    private final List<List<Object>> rows;
    private final long rowsAffected;
    private final Duration executionTime;
    private final String planExplanation;

    private QueryResult(
            List<String> columns,
            List<List<Object>> rows,
            long rowsAffected,
            Duration executionTime,
            @Nullable String planExplanation) {
        this.columns = List.copyOf(columns);
        List<List<Object>> copiedRows = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            // rows may carry SQL NULLs, which List.copyOf rejects
            copiedRows.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copiedRows);
        this.rowsAffected = rowsAffected;
        this.executionTime = Objects.requireNonNull(executionTime, "executionTime");
        this.planExplanation = planExplanation != null ? planExplanation : "";
    }

    /**
     * Creates a result for a statement that produced a result set.
     *
     * @param columns       column labels in result-set order
     * @param rows          row values, each in column order
     * @param executionTime time spent inside the engine
     * @return QueryResult carrying rows
     */
    public static QueryResult ofRows(List<String> columns, List<List<Object>> rows, Duration executionTime) {
        return new QueryResult(columns, rows, rows.size(), executionTime, null);
    }

    /**
     * Creates a result for a statement that only reports an update count.
     *
     * @param rowsAffected  number of rows inserted, updated or deleted
     * @param executionTime time spent inside the engine
     * @return QueryResult without rows
     */
    public static QueryResult ofUpdateCount(long rowsAffected, Duration executionTime) {
        return new QueryResult(List.of(), List.of(), rowsAffected, executionTime, null);
    }

    /**
     * Returns a copy of this result carrying the given plan explanation.
     */
    public QueryResult withPlanExplanation(String explanation) {
        return new QueryResult(columns, rows, rowsAffected, executionTime, explanation);
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<List<Object>> getRows() {
        return rows;
    }

    public long getRowsAffected() {
        return rowsAffected;
    }

    public Duration getExecutionTime() {
        return executionTime;
    }

    public String getPlanExplanation() {
        return planExplanation;
    }

    /**
     * Converts this result to a Map for JSON serialization.
     *
     * @param queryType the classification the router made for the statement
     * @return Map representation of this result
     */
    public Map<String, Object> toMap(QueryType queryType) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);
        result.put("queryType", queryType.name());
        result.put("columns", columns);
        result.put("rows", rows);
        result.put("rowCount", rows.size());
        result.put("rowsAffected", rowsAffected);
        result.put("executionTimeMs", executionTime.toMillis());

        if (!planExplanation.isEmpty()) {
            result.put("planExplanation", planExplanation);
        }

        return result;
    }

    @Override
    public String toString() {
        return "QueryResult{" +
                "columns=" + columns +
                ", rowCount=" + rows.size() +
                ", rowsAffected=" + rowsAffected +
                ", executionTime=" + executionTime +
                '}';
    }
}
