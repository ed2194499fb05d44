package com.baskettecase.dbmcp.db;

import com.baskettecase.dbmcp.config.DbMcpProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Properties;

/**
 * Database Connection Manager
 *
 * Resolves a logical database name to a fresh connection using the {@link ConnectionRegistry}.
 * There is no pooling: every call opens its own connection, and the caller closes it
 * with try-with-resources. The handshake is bounded by a fixed timeout; statement execution is not.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DatabaseConnectionManager {

    public static final int CONNECT_TIMEOUT_SECONDS = 10;

    private final ConnectionRegistry registry;
    private final DbMcpProperties properties;

    /**
     * Open a connection to a configured database.
     *
     * @param databaseName logical database name from the registry
     * @return a handle the caller must close
     * @throws UnknownDatabaseException if the name is not configured (no network I/O is attempted)
     * @throws ConnectionFailureException if the connection cannot be established
     */
    public DatabaseConnection resolve(String databaseName) {
        ConnectionProfile profile = registry.find(databaseName)
                .orElseThrow(() -> new UnknownDatabaseException(databaseName));

        Connection connection;
        try {
            connection = createDataSource(profile).getConnection();
        } catch (SQLException e) {
            log.error("❌ Failed to connect to database {}: {}", databaseName, e.getMessage());
            throw new ConnectionFailureException(databaseName, e);
        }

        try {
            if (properties.isReadOnlySessions()) {
                connection.setReadOnly(true);
            }
        } catch (SQLException e) {
            closeQuietly(connection, databaseName);
            log.error("❌ Failed to prepare connection to database {}: {}", databaseName, e.getMessage());
            throw new ConnectionFailureException(databaseName, e);
        }

        log.debug("🔗 Opened connection to {} ({}, user: {})", databaseName, profile.getJdbcUrl(), profile.getUser());

        JdbcTemplate template = new JdbcTemplate(new SingleConnectionDataSource(connection, true));
        return new DatabaseConnection(databaseName, connection, template);
    }

    /**
     * Build a non-pooling DataSource for a profile. Every {@code getConnection()} opens a new socket.
     */
    protected DataSource createDataSource(ConnectionProfile profile) {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
                profile.getJdbcUrl(), profile.getUser(), profile.getPassword());

        Properties connectionProperties = new Properties();
        connectionProperties.setProperty("connectTimeout", String.valueOf(CONNECT_TIMEOUT_SECONDS));
        connectionProperties.setProperty("loginTimeout", String.valueOf(CONNECT_TIMEOUT_SECONDS));
        connectionProperties.setProperty("ApplicationName", properties.getApplicationName());
        if (properties.isReadOnlySessions()) {
            // The driver's default mode ignores setReadOnly(true) under autocommit
            connectionProperties.setProperty("readOnlyMode", "always");
        }
        dataSource.setConnectionProperties(connectionProperties);

        return dataSource;
    }

    private void closeQuietly(Connection connection, String databaseName) {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to close connection to {}: {}", databaseName, e.getMessage());
        }
    }
}
