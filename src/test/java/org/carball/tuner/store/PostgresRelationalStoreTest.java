package org.carball.tuner.store;

import org.carball.tuner.model.index.IndexDescriptor;
import org.carball.tuner.model.query.SlowQueryRecord;
import org.carball.tuner.model.query.StoreKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class PostgresRelationalStoreTest {

    @Mock
    private Connection connection;

    @Mock
    private PreparedStatement preparedStatement;

    @Mock
    private Statement statement;

    @Mock
    private ResultSet resultSet;

    private PostgresRelationalStore store;

    @BeforeEach
    void setUp() {
        store = new PostgresRelationalStore(() -> connection, 15);
    }

    @Test
    void shouldReadSlowStatementsWithBufferCounters() throws Exception {
        // Given
        when(connection.prepareStatement(anyString())).thenReturn(preparedStatement);
        when(preparedStatement.executeQuery()).thenReturn(resultSet);
        when(resultSet.next()).thenReturn(true, false);
        when(resultSet.getString("query")).thenReturn("SELECT * FROM orders WHERE id = $1");
        when(resultSet.getLong("calls")).thenReturn(5L);
        when(resultSet.getDouble("total_exec_time")).thenReturn(4200.0);
        when(resultSet.getDouble("mean_exec_time")).thenReturn(840.0);
        when(resultSet.getLong("shared_blks_hit")).thenReturn(90L);
        when(resultSet.getLong("shared_blks_read")).thenReturn(10L);

        // When
        List<SlowQueryRecord> records = store.findSlowStatements(1000, 50);

        // Then
        assertThat(records).hasSize(1);
        SlowQueryRecord record = records.get(0);
        assertThat(record.storeKind()).isEqualTo(StoreKind.RELATIONAL);
        assertThat(record.callCount()).isEqualTo(5);
        assertThat(record.totalTime()).isEqualTo(4200.0);
        assertThat(record.meanTime()).isEqualTo(840.0);
        assertThat(record.bufferStats().cacheHitRatio()).isCloseTo(0.9, within(0.0001));

        verify(preparedStatement).setQueryTimeout(15);
        verify(preparedStatement).setDouble(1, 1000);
        verify(preparedStatement).setInt(2, 50);
        verify(connection).close();
    }

    @Test
    void shouldWrapDriverFailures() throws Exception {
        // Given
        when(connection.prepareStatement(anyString())).thenThrow(new SQLException("connection reset"));

        // Then
        assertThatThrownBy(() -> store.findSlowStatements(1000, 50))
                .isInstanceOf(StoreException.class)
                .hasMessageStartingWith("PostgreSQL: ")
                .hasCauseInstanceOf(SQLException.class)
                .satisfies(e -> assertThat(((StoreException) e).getStoreKind()).isEqualTo(StoreKind.RELATIONAL));
    }

    @Test
    void shouldExplainWithAnalyzeAndJsonFormat() throws Exception {
        // Given
        when(connection.createStatement()).thenReturn(statement);
        when(statement.executeQuery("EXPLAIN (ANALYZE, BUFFERS, FORMAT JSON) SELECT 1")).thenReturn(resultSet);
        when(resultSet.next()).thenReturn(true, false);
        when(resultSet.getString(1)).thenReturn("[{\"Plan\": {\"Node Type\": \"Result\"}}]");

        // When
        String plan = store.explain("SELECT 1");

        // Then
        assertThat(plan).isEqualTo("[{\"Plan\": {\"Node Type\": \"Result\"}}]");
        verify(statement).setQueryTimeout(15);
    }

    @Test
    void shouldReadIndexColumnsInKeyOrder() throws Exception {
        // Given
        Array columns = mock(Array.class);
        when(columns.getArray()).thenReturn(new String[]{"tenant_id", "created_at"});
        when(connection.prepareStatement(anyString())).thenReturn(preparedStatement);
        when(preparedStatement.executeQuery()).thenReturn(resultSet);
        when(resultSet.next()).thenReturn(true, false);
        when(resultSet.getString("table_name")).thenReturn("orders");
        when(resultSet.getString("index_name")).thenReturn("idx_orders_tenant_created");
        when(resultSet.getArray("columns")).thenReturn(columns);
        when(resultSet.getLong("idx_scan")).thenReturn(321L);
        when(resultSet.getBoolean("indisprimary")).thenReturn(false);
        when(resultSet.getBoolean("indisunique")).thenReturn(true);

        // When
        List<IndexDescriptor> indexes = store.findIndexes();

        // Then
        assertThat(indexes).hasSize(1);
        IndexDescriptor index = indexes.get(0);
        assertThat(index.getOwner()).isEqualTo("orders");
        assertThat(index.getColumns()).containsExactly("tenant_id", "created_at");
        assertThat(index.getScanCount()).isEqualTo(321);
        assertThat(index.isProtected()).isTrue();
    }

    @Test
    void shouldDeriveCacheHitRatioFromMetrics() throws Exception {
        // Given
        ResultSetMetaData meta = mock(ResultSetMetaData.class);
        when(meta.getColumnCount()).thenReturn(2);
        when(meta.getColumnLabel(1)).thenReturn("blocks_read");
        when(meta.getColumnLabel(2)).thenReturn("blocks_hit");
        when(connection.prepareStatement(anyString())).thenReturn(preparedStatement);
        when(preparedStatement.executeQuery()).thenReturn(resultSet);
        when(resultSet.next()).thenReturn(true);
        when(resultSet.getMetaData()).thenReturn(meta);
        when(resultSet.getObject(1)).thenReturn(10L);
        when(resultSet.getObject(2)).thenReturn(90L);

        // When
        Map<String, Object> metrics = store.collectMetrics();

        // Then
        assertThat(metrics).containsEntry("blocks_read", 10L).containsEntry("blocks_hit", 90L);
        assertThat((Double) metrics.get("cache_hit_ratio")).isCloseTo(0.9, within(0.0001));
    }

    @Test
    void shouldReportRejectedDdl() throws Exception {
        // Given
        when(connection.createStatement()).thenReturn(statement);
        when(statement.execute(anyString())).thenThrow(new SQLException("must be owner of table orders"));

        // Then
        assertThatThrownBy(() -> store.execute("CREATE INDEX idx ON orders (a)"))
                .isInstanceOf(StoreException.class)
                .hasMessageContaining("must be owner of table orders");
    }

    @Test
    void shouldRollBackStatementsExecutedByExplain() throws Exception {
        // Given
        String insert = "INSERT INTO audit_events (kind) VALUES ('x') RETURNING id";
        when(connection.createStatement()).thenReturn(statement);
        when(statement.executeQuery("EXPLAIN (ANALYZE, BUFFERS, FORMAT JSON) " + insert)).thenReturn(resultSet);
        when(resultSet.next()).thenReturn(true, false);
        when(resultSet.getString(1)).thenReturn("[{\"Plan\": {\"Node Type\": \"ModifyTable\"}}]");

        // When
        store.explain(insert);

        // Then
        InOrder inOrder = inOrder(connection, statement);
        inOrder.verify(connection).setAutoCommit(false);
        inOrder.verify(statement).executeQuery("EXPLAIN (ANALYZE, BUFFERS, FORMAT JSON) " + insert);
        inOrder.verify(connection).rollback();
        verify(connection, never()).commit();
    }

    @Test
    void shouldRollBackWhenExplainFails() throws Exception {
        // Given
        when(connection.createStatement()).thenReturn(statement);
        when(statement.executeQuery(anyString())).thenThrow(new SQLException("relation \"missing\" does not exist"));

        // Then
        assertThatThrownBy(() -> store.explain("SELECT * FROM missing"))
                .isInstanceOf(StoreException.class)
                .hasMessageContaining("EXPLAIN failed");
        verify(connection).rollback();
    }

    @Test
    void shouldKeepExpressionIndexesWithoutColumnNames() throws Exception {
        // Given
        when(connection.prepareStatement(anyString())).thenReturn(preparedStatement);
        when(preparedStatement.executeQuery()).thenReturn(resultSet);
        when(resultSet.next()).thenReturn(true, false);
        when(resultSet.getString("table_name")).thenReturn("users");
        when(resultSet.getString("index_name")).thenReturn("idx_users_lower_email");
        when(resultSet.getArray("columns")).thenReturn(null);
        when(resultSet.getLong("idx_scan")).thenReturn(2L);
        when(resultSet.getLong("n_live_tup")).thenReturn(50_000L);

        // When
        List<IndexDescriptor> indexes = store.findIndexes();

        // Then
        assertThat(indexes).singleElement().satisfies(index -> {
            assertThat(index.getName()).isEqualTo("idx_users_lower_email");
            assertThat(index.getColumns()).isEmpty();
            assertThat(index.getScanCount()).isEqualTo(2);
        });
    }

    @Test
    void shouldReportHealthWithVacuumBacklogAndConnectionUtilization() throws Exception {
        // Given
        when(connection.prepareStatement(anyString())).thenReturn(preparedStatement);
        when(preparedStatement.executeQuery()).thenReturn(resultSet);
        when(resultSet.next()).thenReturn(true);
        when(resultSet.getLong("active_connections")).thenReturn(25L);
        when(resultSet.getLong("max_connections")).thenReturn(100L);
        when(resultSet.getLong("table_count")).thenReturn(12L);
        when(resultSet.getLong("tables_needing_vacuum")).thenReturn(3L);
        when(resultSet.getString("database_size")).thenReturn("42 MB");

        // When
        Map<String, Object> health = store.healthCheck();

        // Then
        assertThat(health)
                .containsEntry("tables_needing_vacuum", 3L)
                .containsEntry("database_size", "42 MB")
                .containsEntry("connection_utilization", "25%");
        verify(preparedStatement).setLong(1, 10_000L);
    }

    @Test
    void shouldFailHealthCheckWhenConnectionIsRefused() {
        // Given
        PostgresRelationalStore unreachable = new PostgresRelationalStore(() -> {
            throw new SQLException("Connection refused");
        }, 15);

        // Then
        assertThatThrownBy(unreachable::healthCheck)
                .isInstanceOf(StoreException.class)
                .hasMessageContaining("Connection refused");
    }

    @Test
    void shouldVacuumWithoutQueryTimeout() throws Exception {
        // Given
        when(connection.createStatement()).thenReturn(statement);

        // When
        store.vacuumAnalyze();

        // Then
        verify(statement).execute("VACUUM ANALYZE");
        verify(statement, never()).setQueryTimeout(anyInt());
        verify(connection).close();
    }
}
