package com.baskettecase.dbmcp.service;

import com.baskettecase.dbmcp.config.DbMcpProperties;
import com.baskettecase.dbmcp.db.ConnectionFailureException;
import com.baskettecase.dbmcp.db.ConnectionProfile;
import com.baskettecase.dbmcp.db.ConnectionRegistry;
import com.baskettecase.dbmcp.db.DatabaseConnection;
import com.baskettecase.dbmcp.db.DatabaseConnectionManager;
import com.baskettecase.dbmcp.db.ReadableColumnMapRowMapper;
import com.baskettecase.dbmcp.db.UnknownDatabaseException;
import com.baskettecase.dbmcp.schema.ColumnDescriptor;
import com.baskettecase.dbmcp.schema.IndexDescriptor;
import com.baskettecase.dbmcp.schema.SchemaCache;
import com.baskettecase.dbmcp.schema.TableSchema;
import com.baskettecase.dbmcp.sql.SqlValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapperResultSetExtractor;
import org.springframework.jdbc.core.StatementCallback;
import org.springframework.stereotype.Service;

import java.sql.ResultSet;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Query and Introspection Executor
 *
 * Runs validated read-only SQL and the fixed catalog queries against a configured database.
 * Every operation returns a result object; failures are reported in it and never thrown to the caller.
 *
 * Safe for concurrent calls: each call opens and closes its own connection, and the only shared mutable
 * state is the {@link SchemaCache}. Statement execution has no application-level timeout; a slow query runs
 * until the server finishes or cancels it.
 */
@Slf4j
@Service
public class QueryExecutor {

    public static final String DISALLOWED_QUERY_MESSAGE =
        "Query contains disallowed operations: only read-only statements (SELECT, WITH, EXPLAIN, SHOW, DESCRIBE, VALUES) are allowed";

    private static final String TABLE_COLUMNS_SQL = """
        SELECT column_name, data_type, is_nullable, column_default,
               character_maximum_length, numeric_precision, numeric_scale
        FROM information_schema.columns
        WHERE table_schema = ? AND table_name = ?
        ORDER BY ordinal_position
        """;

    private static final String TABLE_INDEXES_SQL = """
        SELECT indexname, indexdef
        FROM pg_indexes
        WHERE schemaname = ? AND tablename = ?
        ORDER BY indexname
        """;

    private static final String SERVER_INFO_SQL = """
        SELECT current_database() AS database_name,
               current_user AS current_user,
               version() AS version,
               pg_database_size(current_database()) AS size_bytes
        """;

    private static final String TABLE_COUNT_SQL = """
        SELECT COUNT(*)
        FROM information_schema.tables
        WHERE table_schema = ?
        """;

    private static final String TABLE_SIZES_SQL = """
        SELECT tablename AS table_name,
               pg_size_pretty(pg_total_relation_size(quote_ident(schemaname) || '.' || quote_ident(tablename))) AS size,
               pg_total_relation_size(quote_ident(schemaname) || '.' || quote_ident(tablename)) AS size_bytes
        FROM pg_tables
        WHERE schemaname = ?
        ORDER BY size_bytes DESC
        """;

    private static final String ALL_COLUMNS_SQL = """
        SELECT table_name, column_name, data_type, is_nullable, column_default,
               character_maximum_length, numeric_precision, numeric_scale
        FROM information_schema.columns
        WHERE table_schema = ?
        ORDER BY table_name, ordinal_position
        """;

    private static final String ALL_INDEXES_SQL = """
        SELECT tablename, indexname, indexdef
        FROM pg_indexes
        WHERE schemaname = ?
        ORDER BY tablename, indexname
        """;

    private final SqlValidator sqlValidator;
    private final DatabaseConnectionManager connectionManager;
    private final ConnectionRegistry registry;
    private final SchemaCache schemaCache;
    private final String defaultSchema;
    private final QueryErrorHints errorHints;

    public QueryExecutor(SqlValidator sqlValidator,
                         DatabaseConnectionManager connectionManager,
                         ConnectionRegistry registry,
                         SchemaCache schemaCache,
                         DbMcpProperties properties) {
        this.sqlValidator = sqlValidator;
        this.connectionManager = connectionManager;
        this.registry = registry;
        this.schemaCache = schemaCache;
        this.defaultSchema = properties.getDefaultSchema();
        this.errorHints = new QueryErrorHints(defaultSchema);
    }

    /**
     * Validate and run a raw SQL statement, returning every row.
     *
     * {@code executionTime} covers execution and row materialization on success, and the time
     * from the start of the call to the failure point otherwise.
     */
    public QueryOutcome executeQuery(String sql, String database) {
        SqlValidator.ValidationResult validation = sqlValidator.validate(sql);
        if (!validation.isValid()) {
            log.warn("🚫 Rejected query for database {}: {}", database, validation.getErrorMessage());
            return QueryOutcome.failure(database, ErrorType.DISALLOWED_QUERY, DISALLOWED_QUERY_MESSAGE, 0);
        }

        if (!registry.contains(database)) {
            return QueryOutcome.failure(database, ErrorType.UNKNOWN_DATABASE,
                    new UnknownDatabaseException(database).getMessage(), 0);
        }

        long started = System.nanoTime();
        try (DatabaseConnection connection = connectionManager.resolve(database)) {
            long executionStarted = System.nanoTime();
            List<Map<String, Object>> rows;
            try {
                rows = runStatement(connection.getJdbcTemplate(), sql);
            } catch (DataAccessException e) {
                double elapsed = secondsSince(started);
                String message = errorHints.enhance(connection.getJdbcTemplate(), mostSpecificMessage(e));
                log.error("❌ Query on database {} failed after {}s: {}", database, format(elapsed), mostSpecificMessage(e));
                return QueryOutcome.failure(database, ErrorType.EXECUTION_FAILURE, message, elapsed);
            }

            double elapsed = secondsSince(executionStarted);
            log.info("✅ Query on database {} returned {} rows in {}s", database, rows.size(), format(elapsed));
            return QueryOutcome.success(database, rows, elapsed);

        } catch (UnknownDatabaseException e) {
            return QueryOutcome.failure(database, ErrorType.UNKNOWN_DATABASE, e.getMessage(), secondsSince(started));
        } catch (ConnectionFailureException e) {
            return QueryOutcome.failure(database, ErrorType.CONNECTION_FAILURE, e.getMessage(), secondsSince(started));
        } catch (RuntimeException e) {
            log.error("❌ Query on database {} failed", database, e);
            return QueryOutcome.failure(database, ErrorType.EXECUTION_FAILURE, e.getMessage(), secondsSince(started));
        }
    }

    /**
     * Columns and indexes of one table, served from the schema cache when present.
     *
     * @param tableName {@code table} (resolved in the default schema) or {@code schema.table}
     */
    public TableSchemaResult getTableSchema(String tableName, String database) {
        if (!registry.contains(database)) {
            return TableSchemaResult.failure(database, tableName, ErrorType.UNKNOWN_DATABASE,
                    new UnknownDatabaseException(database).getMessage());
        }

        if (tableName == null || tableName.isBlank()) {
            return TableSchemaResult.failure(database, tableName, ErrorType.INTROSPECTION_FAILURE, "Table name is required");
        }

        String schemaName = defaultSchema;
        String table = tableName;
        int dot = tableName.indexOf('.');
        if (dot > 0) {
            schemaName = tableName.substring(0, dot);
            table = tableName.substring(dot + 1);
        }
        String qualifiedName = schemaName + "." + table;

        final String schemaFilter = schemaName;
        final String tableFilter = table;
        try {
            TableSchema schema = schemaCache.getOrCompute(database, qualifiedName,
                    () -> readTableSchema(database, schemaFilter, tableFilter));
            return TableSchemaResult.success(database, tableName, schema);
        } catch (ConnectionFailureException e) {
            return TableSchemaResult.failure(database, tableName, ErrorType.CONNECTION_FAILURE, e.getMessage());
        } catch (DataAccessException e) {
            log.error("❌ Failed to get schema of table {} in database {}: {}", tableName, database, mostSpecificMessage(e));
            return TableSchemaResult.failure(database, tableName, ErrorType.INTROSPECTION_FAILURE, mostSpecificMessage(e));
        } catch (RuntimeException e) {
            log.error("❌ Failed to get schema of table {} in database {}", tableName, database, e);
            return TableSchemaResult.failure(database, tableName, ErrorType.INTROSPECTION_FAILURE, e.getMessage());
        }
    }

    /**
     * Status of every configured database. A database that cannot be reached is reported
     * as unavailable; the others are still listed.
     */
    public Map<String, DatabaseStatus> listDatabases() {
        Map<String, DatabaseStatus> statuses = new LinkedHashMap<>();

        registry.asMap().forEach((name, profile) -> {
            ConnectionSummary summary = ConnectionSummary.of(profile);
            try (DatabaseConnection connection = connectionManager.resolve(name)) {
                JdbcTemplate jdbcTemplate = connection.getJdbcTemplate();
                ServerInfo info = ServerInfo.fromRow(jdbcTemplate.queryForMap(SERVER_INFO_SQL));
                Long tablesCount = jdbcTemplate.queryForObject(TABLE_COUNT_SQL, Long.class, defaultSchema);
                statuses.put(name, DatabaseStatus.available(info, tablesCount == null ? 0 : tablesCount, summary));
            } catch (ConnectionFailureException e) {
                statuses.put(name, DatabaseStatus.unavailable(summary, ErrorType.CONNECTION_FAILURE, e.getMessage()));
            } catch (DataAccessException e) {
                log.error("❌ Failed to read status of database {}: {}", name, mostSpecificMessage(e));
                statuses.put(name, DatabaseStatus.unavailable(summary, ErrorType.INTROSPECTION_FAILURE, mostSpecificMessage(e)));
            } catch (RuntimeException e) {
                log.error("❌ Failed to read status of database {}", name, e);
                statuses.put(name, DatabaseStatus.unavailable(summary, ErrorType.INTROSPECTION_FAILURE, String.valueOf(e.getMessage())));
            }
        });

        long available = statuses.values().stream().filter(DatabaseStatus::isAvailable).count();
        log.info("✅ Listed {} databases ({} available)", statuses.size(), available);
        return statuses;
    }

    /**
     * Server details of one database plus its tables in the default schema, largest first.
     */
    public DatabaseInfoResult getDatabaseInfo(String database) {
        ConnectionProfile profile = registry.find(database).orElse(null);
        if (profile == null) {
            return DatabaseInfoResult.failure(database, null, ErrorType.UNKNOWN_DATABASE,
                    new UnknownDatabaseException(database).getMessage());
        }

        ConnectionSummary summary = ConnectionSummary.of(profile);
        try (DatabaseConnection connection = connectionManager.resolve(database)) {
            JdbcTemplate jdbcTemplate = connection.getJdbcTemplate();
            ServerInfo info = ServerInfo.fromRow(jdbcTemplate.queryForMap(SERVER_INFO_SQL));
            List<TableSize> tables = jdbcTemplate.queryForList(TABLE_SIZES_SQL, defaultSchema).stream()
                    .map(TableSize::fromRow)
                    .toList();

            log.info("✅ Retrieved info for database {} with {} tables", database, tables.size());
            return DatabaseInfoResult.success(database, info, tables, summary);
        } catch (ConnectionFailureException e) {
            return DatabaseInfoResult.failure(database, summary, ErrorType.CONNECTION_FAILURE, e.getMessage());
        } catch (DataAccessException e) {
            log.error("❌ Failed to get info for database {}: {}", database, mostSpecificMessage(e));
            return DatabaseInfoResult.failure(database, summary, ErrorType.INTROSPECTION_FAILURE, mostSpecificMessage(e));
        } catch (RuntimeException e) {
            log.error("❌ Failed to get info for database {}", database, e);
            return DatabaseInfoResult.failure(database, summary, ErrorType.INTROSPECTION_FAILURE, e.getMessage());
        }
    }

    /**
     * Columns and indexes of every table in the default schema, read with two queries and grouped by table.
     * A table with only indexes or only columns is still listed, with the other list empty.
     */
    public AllTableSchemasResult getAllTableSchemas(String database) {
        if (!registry.contains(database)) {
            return AllTableSchemasResult.failure(database, ErrorType.UNKNOWN_DATABASE,
                    new UnknownDatabaseException(database).getMessage());
        }

        try (DatabaseConnection connection = connectionManager.resolve(database)) {
            JdbcTemplate jdbcTemplate = connection.getJdbcTemplate();
            List<Map<String, Object>> columnRows = jdbcTemplate.queryForList(ALL_COLUMNS_SQL, defaultSchema);
            List<Map<String, Object>> indexRows = jdbcTemplate.queryForList(ALL_INDEXES_SQL, defaultSchema);

            Map<String, TableSchema> tables = groupByTable(columnRows, indexRows, Instant.now());

            log.info("✅ Retrieved schemas of {} tables in database {}", tables.size(), database);
            return AllTableSchemasResult.success(database, tables);
        } catch (ConnectionFailureException e) {
            return AllTableSchemasResult.failure(database, ErrorType.CONNECTION_FAILURE, e.getMessage());
        } catch (DataAccessException e) {
            log.error("❌ Failed to get table schemas for database {}: {}", database, mostSpecificMessage(e));
            return AllTableSchemasResult.failure(database, ErrorType.INTROSPECTION_FAILURE, mostSpecificMessage(e));
        } catch (RuntimeException e) {
            log.error("❌ Failed to get table schemas for database {}", database, e);
            return AllTableSchemasResult.failure(database, ErrorType.INTROSPECTION_FAILURE, e.getMessage());
        }
    }

    static Map<String, TableSchema> groupByTable(List<Map<String, Object>> columnRows,
                                                 List<Map<String, Object>> indexRows,
                                                 Instant readAt) {
        Map<String, List<ColumnDescriptor>> columns = new LinkedHashMap<>();
        Map<String, List<IndexDescriptor>> indexes = new LinkedHashMap<>();

        for (Map<String, Object> row : columnRows) {
            String table = (String) row.get("table_name");
            columns.computeIfAbsent(table, t -> new ArrayList<>()).add(ColumnDescriptor.fromRow(row));
            indexes.computeIfAbsent(table, t -> new ArrayList<>());
        }
        for (Map<String, Object> row : indexRows) {
            String table = (String) row.get("tablename");
            indexes.computeIfAbsent(table, t -> new ArrayList<>()).add(IndexDescriptor.fromRow(row));
            columns.computeIfAbsent(table, t -> new ArrayList<>());
        }

        Map<String, TableSchema> tables = new LinkedHashMap<>();
        columns.forEach((table, tableColumns) ->
                tables.put(table, new TableSchema(tableColumns, indexes.get(table), readAt)));
        return tables;
    }

    private TableSchema readTableSchema(String database, String schemaName, String tableName) {
        try (DatabaseConnection connection = connectionManager.resolve(database)) {
            JdbcTemplate jdbcTemplate = connection.getJdbcTemplate();

            List<ColumnDescriptor> columns = jdbcTemplate.queryForList(TABLE_COLUMNS_SQL, schemaName, tableName).stream()
                    .map(ColumnDescriptor::fromRow)
                    .toList();
            List<IndexDescriptor> indexes = jdbcTemplate.queryForList(TABLE_INDEXES_SQL, schemaName, tableName).stream()
                    .map(IndexDescriptor::fromRow)
                    .toList();

            log.info("✅ Read schema of {}.{} in database {}: {} columns, {} indexes",
                    schemaName, tableName, database, columns.size(), indexes.size());
            return new TableSchema(columns, indexes, Instant.now());
        }
    }

    /**
     * Execute any statement text and return the rows of its last result set.
     * Statements that produce no result set yield no rows.
     */
    private List<Map<String, Object>> runStatement(JdbcTemplate jdbcTemplate, String sql) {
        List<Map<String, Object>> rows = jdbcTemplate.execute((StatementCallback<List<Map<String, Object>>>) statement -> {
            RowMapperResultSetExtractor<Map<String, Object>> extractor =
                    new RowMapperResultSetExtractor<>(new ReadableColumnMapRowMapper());
            List<Map<String, Object>> last = List.of();

            boolean isResultSet = statement.execute(sql);
            while (isResultSet || statement.getUpdateCount() != -1) {
                if (isResultSet) {
                    try (ResultSet resultSet = statement.getResultSet()) {
                        last = extractor.extractData(resultSet);
                    }
                }
                isResultSet = statement.getMoreResults();
            }
            return last;
        });
        return rows != null ? rows : List.of();
    }

    private static String mostSpecificMessage(DataAccessException e) {
        return e.getMostSpecificCause().getMessage();
    }

    private static double secondsSince(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    private static String format(double seconds) {
        return String.format("%.3f", seconds);
    }
}
