package com.baskettecase.dbmcp.db;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * One live connection to a configured database, owned by a single tool call.
 *
 * The {@link JdbcTemplate} is bound to this connection only. Closing the handle closes the connection.
 */
@Slf4j
@Getter
public class DatabaseConnection implements AutoCloseable {

    private final String databaseName;
    private final Connection connection;
    private final JdbcTemplate jdbcTemplate;

    public DatabaseConnection(String databaseName, Connection connection, JdbcTemplate jdbcTemplate) {
        this.databaseName = databaseName;
        this.connection = connection;
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void close() {
        try {
            if (!connection.isClosed()) {
                connection.close();
                log.debug("🔌 Closed connection to {}", databaseName);
            }
        } catch (SQLException e) {
            log.warn("Failed to close connection to {}: {}", databaseName, e.getMessage());
        }
    }
}
