package org.carball.pginsight.db;

import lombok.extern.slf4j.Slf4j;
import org.carball.pginsight.exception.QueryFailedException;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link DatabaseSession} over a single autocommit JDBC connection to PostgreSQL.
 */
@Slf4j
public class JdbcDatabaseSession implements DatabaseSession {

    private static final int LOGIN_TIMEOUT_SECONDS = 10;

    private final Connection connection;
    private final String databaseName;
    private final RunDeadline deadline;

    JdbcDatabaseSession(Connection connection, String databaseName, RunDeadline deadline) {
        this.connection = connection;
        this.databaseName = databaseName;
        this.deadline = deadline;
    }

    /**
     * Opens a session for a postgres:// or jdbc:postgresql:// URL.
     */
    public static JdbcDatabaseSession open(String url, RunDeadline deadline) throws SQLException {
        String jdbcUrl = ConnectionUrls.toJdbcUrl(url);
        DriverManager.setLoginTimeout(LOGIN_TIMEOUT_SECONDS);
        Connection connection = DriverManager.getConnection(jdbcUrl);
        connection.setAutoCommit(true);
        connection.setReadOnly(true);
        String database = connection.getCatalog();
        log.debug("Connected to database '{}'", database);
        return new JdbcDatabaseSession(connection, database, deadline);
    }

    @Override
    public List<Row> query(String sql, Duration timeout) throws QueryFailedException {
        int seconds = timeoutSeconds(sql, timeout);
        try (Statement stmt = connection.createStatement()) {
            stmt.setQueryTimeout(seconds);
            try (ResultSet rs = stmt.executeQuery(sql)) {
                return readRows(rs);
            }
        } catch (SQLException e) {
            throw new QueryFailedException(sql, e);
        }
    }

    @Override
    public void execute(String sql, Duration timeout) throws QueryFailedException {
        int seconds = timeoutSeconds(sql, timeout);
        try (Statement stmt = connection.createStatement()) {
            stmt.setQueryTimeout(seconds);
            stmt.execute(sql);
        } catch (SQLException e) {
            throw new QueryFailedException(sql, e);
        }
    }

    @Override
    public String databaseName() {
        return databaseName;
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException e) {
            log.debug("Error closing connection to '{}': {}", databaseName, e.getMessage());
        }
    }

    private int timeoutSeconds(String sql, Duration timeout) throws QueryFailedException {
        if (deadline.isExpired()) {
            throw new QueryFailedException(sql, "run deadline exceeded");
        }
        long millis = deadline.bound(timeout).toMillis();
        // JDBC query timeouts have whole-second resolution
        return (int) Math.max(1, (millis + 999) / 1000);
    }

    private static List<Row> readRows(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columns = meta.getColumnCount();
        List<Row> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (int i = 1; i <= columns; i++) {
                values.put(meta.getColumnLabel(i), rs.getObject(i));
            }
            rows.add(new Row(values));
        }
        return rows;
    }
}
