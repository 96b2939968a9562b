package com.routine.loader.database;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTransientConnectionException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DataLayer} on top of a single JDBC connection in auto-commit mode.
 */
public class JdbcDataLayer implements DataLayer {
    private static final Logger log = LoggerFactory.getLogger(JdbcDataLayer.class);

    private final Connection connection;

    public JdbcDataLayer(Connection connection) {
        this.connection = connection;
    }

    public static JdbcDataLayer connect(String url, String user, String password) {
        try {
            log.debug("Connecting to {}", url);
            return new JdbcDataLayer(DriverManager.getConnection(url, user, password));
        } catch (SQLException e) {
            throw new DatabaseUnavailableException("Unable to connect to " + url + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void executeNone(String sql) {
        log.debug("Executing: {}", sql);
        try (Statement statement = connection.createStatement()) {
            statement.execute(sql);
        } catch (SQLException e) {
            throw translate(e, sql);
        }
    }

    @Override
    public List<Map<String, Object>> executeRows(String sql) {
        log.debug("Querying: {}", sql);
        try (Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery(sql)) {
            ResultSetMetaData meta = rs.getMetaData();
            int columnCount = meta.getColumnCount();

            List<Map<String, Object>> rows = new ArrayList<>();
            while (rs.next()) {
                Map<String, Object> row = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
                for (int i = 1; i <= columnCount; i++) {
                    row.put(meta.getColumnLabel(i), rs.getObject(i));
                }
                rows.add(row);
            }
            return rows;
        } catch (SQLException e) {
            throw translate(e, sql);
        }
    }

    @Override
    public Object executeSingleton0(String sql) {
        log.debug("Querying: {}", sql);
        try (Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery(sql)) {
            if (!rs.next()) {
                return null;
            }
            Object value = rs.getObject(1);
            if (rs.next()) {
                throw new DataLayerException("Expected zero or one row, got more", sql, null);
            }
            return value;
        } catch (SQLException e) {
            throw translate(e, sql);
        }
    }

    @Override
    public String realEscapeString(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 8);
        for (char c : value.toCharArray()) {
            switch (c) {
                case '\0' -> sb.append("\\0");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\\' -> sb.append("\\\\");
                case '\'' -> sb.append("\\'");
                case '"' -> sb.append("\\\"");
                case '\u001A' -> sb.append("\\Z");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to close database connection: {}", e.getMessage());
        }
    }

    private RuntimeException translate(SQLException e, String sql) {
        if (isConnectionFailure(e)) {
            return new DatabaseUnavailableException("Lost connection to the database: " + e.getMessage(), e);
        }
        return new DataLayerException("MySQL Error no " + e.getErrorCode() + ": " + e.getMessage(), sql, e);
    }

    private static boolean isConnectionFailure(SQLException e) {
        if (e instanceof SQLTransientConnectionException || e instanceof SQLNonTransientConnectionException) {
            return true;
        }
        String state = e.getSQLState();
        return state != null && state.startsWith("08");
    }
}
