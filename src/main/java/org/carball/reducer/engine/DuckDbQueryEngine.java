package org.carball.reducer.engine;

import lombok.extern.slf4j.Slf4j;
import org.carball.reducer.model.filter.CompiledPredicate;
import org.carball.reducer.model.schema.DatasetHandle;

import java.io.IOException;
import java.sql.*;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Runs dataset queries on DuckDB over JDBC. Each call opens its own in-memory connection,
 * reads the dataset's CSV file through {@code read_csv_auto}, and closes statement, cursor
 * and connection on every exit path.
 */
@Slf4j
public class DuckDbQueryEngine implements QueryEngine {

    public static final String IN_MEMORY_URL = "jdbc:duckdb:";

    private static final String DRIVER_CLASS = "org.duckdb.DuckDBDriver";

    private final String jdbcUrl;
    private final int queryTimeoutSeconds;
    private final boolean ignoreCsvErrors;

    public DuckDbQueryEngine() {
        this(IN_MEMORY_URL, 0, true);
    }

    public DuckDbQueryEngine(String jdbcUrl, int queryTimeoutSeconds, boolean ignoreCsvErrors) {
        this.jdbcUrl = jdbcUrl;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
        this.ignoreCsvErrors = ignoreCsvErrors;
        loadDriver();
    }

    @Override
    public List<EngineColumn> describe(DatasetHandle handle) throws SQLException {
        String sql = "DESCRIBE SELECT * FROM " + source(handle);
        List<EngineColumn> columns = new ArrayList<>();

        try (Connection conn = DriverManager.getConnection(jdbcUrl);
             PreparedStatement stmt = prepare(conn, sql, List.of());
             ResultSet rs = stmt.executeQuery()) {

            while (rs.next()) {
                columns.add(new EngineColumn(
                        rs.getString("column_name"),
                        rs.getString("column_type"),
                        !"NO".equalsIgnoreCase(rs.getString("null"))
                ));
            }
        }

        log.debug("Described dataset {}: {} columns", handle.datasetId(), columns.size());
        return columns;
    }

    @Override
    public long count(DatasetHandle handle, CompiledPredicate predicate) throws SQLException {
        String sql = "SELECT COUNT(*) FROM " + source(handle) + predicate.whereClause();

        try (Connection conn = DriverManager.getConnection(jdbcUrl);
             PreparedStatement stmt = prepare(conn, sql, predicate.parameters());
             ResultSet rs = stmt.executeQuery()) {

            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    @Override
    public <T> T select(DatasetHandle handle, SelectStatement statement, RowConsumer<T> consumer)
            throws SQLException, IOException {
        String sql = statement.render(source(handle));

        try (Connection conn = DriverManager.getConnection(jdbcUrl);
             PreparedStatement stmt = prepare(conn, sql, statement.getPredicate().parameters());
             ResultSet rs = stmt.executeQuery()) {

            return consumer.consume(new ResultSetCursor(rs));
        }
    }

    private String source(DatasetHandle handle) {
        return SqlDialect.csvSource(handle.path(), ignoreCsvErrors);
    }

    private PreparedStatement prepare(Connection conn, String sql, List<Object> parameters) throws SQLException {
        log.debug("Preparing statement with {} parameters: {}", parameters.size(), sql);
        PreparedStatement stmt = conn.prepareStatement(sql);
        try {
            applyTimeout(stmt);
            for (int i = 0; i < parameters.size(); i++) {
                stmt.setObject(i + 1, parameters.get(i));
            }
            return stmt;
        } catch (SQLException e) {
            stmt.close();
            throw e;
        }
    }

    private void applyTimeout(Statement stmt) throws SQLException {
        if (queryTimeoutSeconds <= 0) {
            return;
        }
        try {
            stmt.setQueryTimeout(queryTimeoutSeconds);
        } catch (SQLFeatureNotSupportedException e) {
            log.debug("Driver does not support query timeouts, running without one: {}", e.getMessage());
        }
    }

    private static void loadDriver() {
        try {
            Class.forName(DRIVER_CLASS);
        } catch (ClassNotFoundException e) {
            throw new IllegalStateException("DuckDB JDBC driver not on the classpath", e);
        }
    }

    private static final class ResultSetCursor implements RowCursor {

        private final ResultSet rs;
        private final List<String> columnNames;

        private ResultSetCursor(ResultSet rs) throws SQLException {
            this.rs = rs;
            ResultSetMetaData metaData = rs.getMetaData();
            List<String> names = new ArrayList<>(metaData.getColumnCount());
            for (int i = 1; i <= metaData.getColumnCount(); i++) {
                names.add(metaData.getColumnLabel(i));
            }
            this.columnNames = Collections.unmodifiableList(names);
        }

        @Override
        public List<String> columnNames() {
            return columnNames;
        }

        @Override
        public boolean next() throws SQLException {
            return rs.next();
        }

        @Override
        public Object get(int index) throws SQLException {
            return rs.getObject(index + 1);
        }

        @Override
        public List<Object> currentRow() throws SQLException {
            List<Object> row = new ArrayList<>(columnNames.size());
            for (int i = 0; i < columnNames.size(); i++) {
                row.add(get(i));
            }
            return row;
        }
    }
}
