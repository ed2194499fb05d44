package com.baskettecase.dbmcp.tools;

import com.baskettecase.dbmcp.service.QueryExecutor;
import com.baskettecase.dbmcp.util.JsonResponseFormatter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springaicommunity.mcp.annotation.McpTool;
import org.springaicommunity.mcp.annotation.McpToolParam;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Database Tools for MCP Server
 *
 * Publishes the five read-only database operations as MCP tools. Arguments are checked here,
 * the work is done by {@link QueryExecutor}, and every result is returned as indented JSON text.
 *
 * @see <a href="https://docs.spring.io/spring-ai/reference/api/mcp/mcp-annotations-server.html">Spring AI MCP Annotations</a>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DatabaseTools {

    static final String EXECUTE_QUERY = "execute_query";
    static final String GET_TABLE_SCHEMA = "get_table_schema";
    static final String LIST_DATABASES = "list_databases";
    static final String GET_DATABASE_INFO = "get_database_info";
    static final String GET_ALL_TABLES_SCHEMAS = "get_all_tables_schemas";

    private static final List<String> TOOL_NAMES = List.of(
        EXECUTE_QUERY, GET_TABLE_SCHEMA, LIST_DATABASES, GET_DATABASE_INFO, GET_ALL_TABLES_SCHEMAS
    );

    static final String MISSING_ARGUMENTS_PREFIX = "Error: missing required argument(s): ";

    private final QueryExecutor queryExecutor;
    private final MeterRegistry meterRegistry;

    private final Map<String, Counter> invocationCounters = new HashMap<>();
    private final Map<String, Timer> durationTimers = new HashMap<>();

    @PostConstruct
    public void initializeMetrics() {
        for (String tool : TOOL_NAMES) {
            invocationCounters.put(tool, Counter.builder("db_mcp.tool.invocations")
                    .description("Total number of tool invocations")
                    .tag("tool", tool)
                    .register(meterRegistry));
            durationTimers.put(tool, Timer.builder("db_mcp.tool.duration")
                    .description("Time taken to process tool invocations")
                    .tag("tool", tool)
                    .register(meterRegistry));
        }
    }

    @McpTool(
        name = EXECUTE_QUERY,
        description = "Run a read-only SQL query (SELECT, WITH, EXPLAIN, SHOW, DESCRIBE, VALUES) against a configured database and return all rows."
    )
    public String executeQuery(
        @McpToolParam(
            description = "SQL query. Statements containing INSERT, UPDATE, DELETE, DROP, CREATE, ALTER, TRUNCATE, GRANT, REVOKE, EXEC or EXECUTE are rejected",
            required = true
        ) String query,
        @McpToolParam(
            description = "Configured database name (see list_databases)",
            required = true
        ) String database
    ) {
        log.info("🔧 TOOL CALLED: {} (database: {})", EXECUTE_QUERY, database);
        log.debug("   📊 query: {}", query);

        if (isBlank(query) || isBlank(database)) {
            return missingArguments("query, database");
        }
        return invoke(EXECUTE_QUERY, () -> queryExecutor.executeQuery(query, database));
    }

    @McpTool(
        name = GET_TABLE_SCHEMA,
        description = "Get the columns (in ordinal order) and indexes of a table. Results are cached for the life of the server."
    )
    public String getTableSchema(
        @McpToolParam(
            description = "Table name, optionally schema-qualified (schema.table)",
            required = true
        ) String table_name,
        @McpToolParam(
            description = "Configured database name",
            required = true
        ) String database
    ) {
        log.info("🔧 TOOL CALLED: {} (table: {}, database: {})", GET_TABLE_SCHEMA, table_name, database);

        if (isBlank(table_name) || isBlank(database)) {
            return missingArguments("table_name, database");
        }
        return invoke(GET_TABLE_SCHEMA, () -> queryExecutor.getTableSchema(table_name.trim(), database));
    }

    @McpTool(
        name = LIST_DATABASES,
        description = "List every configured database with its availability, server version, size and table count."
    )
    public String listDatabases() {
        log.info("🔧 TOOL CALLED: {}", LIST_DATABASES);
        return invoke(LIST_DATABASES, queryExecutor::listDatabases);
    }

    @McpTool(
        name = GET_DATABASE_INFO,
        description = "Get details of one database: server info and its tables with sizes, largest first."
    )
    public String getDatabaseInfo(
        @McpToolParam(
            description = "Configured database name",
            required = true
        ) String database
    ) {
        log.info("🔧 TOOL CALLED: {} (database: {})", GET_DATABASE_INFO, database);

        if (isBlank(database)) {
            return missingArguments("database");
        }
        return invoke(GET_DATABASE_INFO, () -> queryExecutor.getDatabaseInfo(database));
    }

    @McpTool(
        name = GET_ALL_TABLES_SCHEMAS,
        description = "Get the columns and indexes of every table in a database."
    )
    public String getAllTablesSchemas(
        @McpToolParam(
            description = "Configured database name",
            required = true
        ) String database
    ) {
        log.info("🔧 TOOL CALLED: {} (database: {})", GET_ALL_TABLES_SCHEMAS, database);

        if (isBlank(database)) {
            return missingArguments("database");
        }
        return invoke(GET_ALL_TABLES_SCHEMAS, () -> queryExecutor.getAllTableSchemas(database));
    }

    private String invoke(String tool, Callable<Object> operation) {
        Timer.Sample sample = Timer.start(meterRegistry);
        invocationCounters.get(tool).increment();
        try {
            return JsonResponseFormatter.format(operation.call());
        } catch (Exception e) {
            log.error("❌ Tool {} failed", tool, e);
            return "Error: " + e.getMessage();
        } finally {
            sample.stop(durationTimers.get(tool));
        }
    }

    private static String missingArguments(String names) {
        return MISSING_ARGUMENTS_PREFIX + names;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
