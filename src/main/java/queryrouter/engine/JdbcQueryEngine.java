package queryrouter.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import queryrouter.model.PlanNode;
import queryrouter.model.QueryResult;
import queryrouter.planner.QueryPlanner;

import javax.sql.DataSource;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link QueryEngine} backed by a pooled JDBC {@link DataSource}.
 * Each call borrows its own connection, so concurrent callers never share one.
 */
public class JdbcQueryEngine implements QueryEngine {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcQueryEngine.class);

    private final String name;
    private final DataSource dataSource;
    private final int defaultStatementTimeoutSeconds;

    /**
     * @param name                           stable engine name for diagnostics
     * @param dataSource                     pool the engine borrows connections from
     * @param defaultStatementTimeoutSeconds timeout applied when the context has no deadline, 0 for none
     */
    public JdbcQueryEngine(String name, DataSource dataSource, int defaultStatementTimeoutSeconds) {
        this.name = Objects.requireNonNull(name, "name");
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.defaultStatementTimeoutSeconds = Math.max(0, defaultStatementTimeoutSeconds);
    }

    @Override
    public QueryResult execute(QueryContext ctx, String query, Object... args) throws SQLException {
        ensureLive(ctx);
        LOG.debug("[{}] Executing statement with {} parameter(s)", name, args == null ? 0 : args.length);

        long start = System.nanoTime();
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(query)) {

            statement.setQueryTimeout(timeoutSeconds(ctx));
            if (args != null) {
                for (int i = 0; i < args.length; i++) {
                    statement.setObject(i + 1, args[i]);
                }
            }

            QueryResult result;
            if (statement.execute()) {
                try (ResultSet resultSet = statement.getResultSet()) {
                    result = readRows(resultSet, start);
                }
            } else {
                result = QueryResult.ofUpdateCount(statement.getUpdateCount(), elapsedSince(start));
            }

            LOG.debug("[{}] Statement returned {} row(s), {} affected in {} ms",
                    name, result.getRows().size(), result.getRowsAffected(), result.getExecutionTime().toMillis());
            return result.withPlanExplanation(name + " default plan");
        }
    }

    /**
     * Runs the statement a plan was built from. Plans without a {@code sql}
     * root attribute cannot be run by this engine.
     */
    @Override
    public QueryResult executeWithPlan(QueryContext ctx, PlanNode plan) throws SQLException {
        String sql = plan.getAttribute(QueryPlanner.SQL_ATTRIBUTE);
        if (sql == null || sql.isBlank()) {
            throw new SQLException("Plan rooted at " + plan.getKind().displayName() + " carries no statement text");
        }
        QueryResult result = execute(ctx, sql);
        return result.withPlanExplanation(name + " executed plan rooted at " + plan.getKind().displayName());
    }

    @Override
    public String getName() {
        return name;
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    private void ensureLive(QueryContext ctx) throws SQLTimeoutException {
        String reason = ctx.doneReason();
        if (reason != null) {
            throw new SQLTimeoutException("Query context " + reason + " before execution on " + name);
        }
    }

    /**
     * Maps the context deadline onto JDBC's whole-second query timeout, rounding up.
     */
    private int timeoutSeconds(QueryContext ctx) {
        Duration remaining = ctx.remaining();
        if (remaining == null) {
            return defaultStatementTimeoutSeconds;
        }
        long millis = remaining.toMillis();
        long seconds = (millis + 999) / 1000;
        return (int) Math.max(1, Math.min(Integer.MAX_VALUE, seconds));
    }

    private static QueryResult readRows(ResultSet resultSet, long start) throws SQLException {
        ResultSetMetaData metaData = resultSet.getMetaData();
        int columnCount = metaData.getColumnCount();

        List<String> columns = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            columns.add(metaData.getColumnLabel(i));
        }

        List<List<Object>> rows = new ArrayList<>();
        while (resultSet.next()) {
            List<Object> row = new ArrayList<>(columnCount);
            for (int i = 1; i <= columnCount; i++) {
                row.add(readValue(resultSet, i));
            }
            rows.add(row);
        }

        return QueryResult.ofRows(columns, rows, elapsedSince(start));
    }

    /**
     * Reads one column into a value that outlives the connection.
     * LOBs are materialized and freed; JDBC date types become java.time values.
     */
    private static Object readValue(ResultSet resultSet, int column) throws SQLException {
        Object value = resultSet.getObject(column);
        if (value instanceof Clob clob) {
            try {
                return clob.getSubString(1, (int) clob.length());
            } finally {
                clob.free();
            }
        }
        if (value instanceof Blob blob) {
            try {
                return blob.getBytes(1, (int) blob.length());
            } finally {
                blob.free();
            }
        }
        if (value instanceof Timestamp timestamp) {
            return timestamp.toLocalDateTime();
        }
        if (value instanceof java.sql.Date date) {
            return date.toLocalDate();
        }
        if (value instanceof Time time) {
            return time.toLocalTime();
        }
        return value;
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
