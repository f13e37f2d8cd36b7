package queryrouter.engine;

import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import queryrouter.model.PlanNode;
import queryrouter.model.QueryResult;
import queryrouter.planner.QueryPlanner;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for JdbcQueryEngine against the in-memory transactional data source.
 */
@MicronautTest
class JdbcQueryEngineTest {

    @Inject
    @Named("transactional")
    DataSource dataSource;

    @Inject
    QueryPlanner planner;

    private JdbcQueryEngine engine;

    @BeforeEach
    void setUp() throws Exception {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute("DROP TABLE IF EXISTS engine_users");
            stmt.execute("""
                CREATE TABLE engine_users (
                    id INT PRIMARY KEY,
                    name VARCHAR(255) NOT NULL,
                    email VARCHAR(255)
                )
                """);
            stmt.execute("INSERT INTO engine_users (id, name, email) VALUES (1, 'Alice', 'alice@example.com')");
            stmt.execute("INSERT INTO engine_users (id, name, email) VALUES (2, 'Bob', NULL)");
        }
        engine = new JdbcQueryEngine("Transactional", dataSource, 30);
    }

    @Test
    void testWhenSelectingThenColumnsKeepSelectOrder() throws SQLException {
        // Act
        QueryResult result = engine.execute(QueryContext.background(),
                "SELECT name AS user_name, id AS user_id FROM engine_users ORDER BY id");

        // Assert
        assertThat(result.getColumns()).containsExactly("USER_NAME", "USER_ID");
        assertThat(result.getRows()).hasSize(2);
        assertThat(result.getRows().get(0)).containsExactly("Alice", 1);
        assertThat(result.getRowsAffected()).isEqualTo(2);
        assertThat(result.getPlanExplanation()).isEqualTo("Transactional default plan");
    }

    @Test
    void testWhenArgumentsGivenThenTheyAreBoundPositionally() throws SQLException {
        // Act
        QueryResult result = engine.execute(QueryContext.background(),
                "SELECT name FROM engine_users WHERE id = ? AND name = ?", 1, "Alice");

        // Assert
        assertThat(result.getRows()).containsExactly(List.of("Alice"));
    }

    @Test
    void testWhenColumnIsNullThenRowKeepsNull() throws SQLException {
        // Act
        QueryResult result = engine.execute(QueryContext.background(),
                "SELECT id, email FROM engine_users WHERE id = 2");

        // Assert
        assertThat(result.getRows().get(0)).isEqualTo(Arrays.asList(2, null));
    }

    @Test
    void testWhenUpdatingThenRowsAffectedIsReported() throws SQLException {
        // Act
        QueryResult result = engine.execute(QueryContext.withTimeout(Duration.ofSeconds(5)),
                "UPDATE engine_users SET email = ? WHERE id = ?", "bob@example.com", 2);

        // Assert
        assertThat(result.getRowsAffected()).isEqualTo(1);
        assertThat(result.getColumns()).isEmpty();
        assertThat(result.getRows()).isEmpty();
    }

    @Test
    void testWhenExecutingPlannedStatementThenPlanRootIsReported() throws SQLException {
        // Arrange
        PlanNode plan = planner.plan("SELECT * FROM engine_users ORDER BY id LIMIT 1");

        // Act
        QueryResult result = engine.executeWithPlan(QueryContext.background(), plan);

        // Assert
        assertThat(result.getRows()).hasSize(1);
        assertThat(result.getPlanExplanation()).isEqualTo("Transactional executed plan rooted at Limit");
    }

    @Test
    void testWhenColumnsHoldLobsThenValuesAreMaterialized() throws Exception {
        // Arrange
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute("DROP TABLE IF EXISTS engine_docs");
            stmt.execute("CREATE TABLE engine_docs (id INT PRIMARY KEY, body CLOB, payload BLOB, created_at TIMESTAMP)");
            stmt.execute("INSERT INTO engine_docs VALUES (1, 'Quarterly report', X'CAFE', TIMESTAMP '2024-03-01 10:15:30')");
        }

        // Act
        QueryResult result = engine.execute(QueryContext.background(),
                "SELECT body, payload, created_at FROM engine_docs WHERE id = ?", 1);

        // Assert
        List<Object> row = result.getRows().get(0);
        assertThat(row.get(0)).isEqualTo("Quarterly report");
        assertThat(row.get(1)).isInstanceOf(byte[].class);
        assertThat((byte[]) row.get(1)).containsExactly((byte) 0xCA, (byte) 0xFE);
        assertThat(row.get(2)).isEqualTo(java.time.LocalDateTime.of(2024, 3, 1, 10, 15, 30));
    }

    @Test
    void testWhenPlanHasNoStatementThenExecutionFails() {
        // Arrange
        PlanNode plan = PlanNode.scan(Map.of("table", "engine_users"));

        // Act & Assert
        assertThatThrownBy(() -> engine.executeWithPlan(QueryContext.background(), plan))
                .isInstanceOf(SQLException.class)
                .hasMessageContaining("carries no statement text");
    }

    @Test
    void testWhenContextAlreadyExpiredThenStatementIsNotRun() {
        // Arrange
        QueryContext ctx = QueryContext.withDeadline(Instant.now().minusSeconds(1));

        // Act & Assert
        assertThatThrownBy(() -> engine.execute(ctx, "DELETE FROM engine_users"))
                .isInstanceOf(SQLTimeoutException.class)
                .hasMessageContaining("deadline exceeded");

        assertThatCode(() -> {
            QueryResult remaining = engine.execute(QueryContext.background(), "SELECT COUNT(*) FROM engine_users");
            assertThat(remaining.getRows().get(0).get(0)).isEqualTo(2L);
        }).doesNotThrowAnyException();
    }

    @Test
    void testWhenStatementIsInvalidThenSqlExceptionPropagates() {
        assertThatThrownBy(() -> engine.execute(QueryContext.background(), "SELECT * FROM missing_table"))
                .isInstanceOf(SQLException.class);
    }
}
