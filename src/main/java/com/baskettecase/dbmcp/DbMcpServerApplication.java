package com.baskettecase.dbmcp;

import com.baskettecase.dbmcp.cli.CommandLineMode;
import com.baskettecase.dbmcp.db.ConnectionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

/**
 * Database MCP Server Application
 *
 * Provides read-only query and schema inspection tools for a set of configured
 * PostgreSQL databases via Model Context Protocol.
 * Supports Streamable-HTTP transport, plus a few command line modes for checking connectivity.
 *
 * @see <a href="https://docs.spring.io/spring-ai/reference/api/mcp/mcp-overview.html">Spring AI MCP Documentation</a>
 */
@Slf4j
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
@RequiredArgsConstructor
public class DbMcpServerApplication {

    private final ConnectionRegistry connectionRegistry;

    public static void main(String[] args) {
        CommandLineMode mode = CommandLineMode.fromArgs(args);

        switch (mode) {
            case HELP -> System.out.println(CommandLineMode.helpText());
            case UNKNOWN -> {
                System.out.println("Unknown argument: " + CommandLineMode.unknownArgument(args).orElse(""));
                System.out.println("Use --help for usage");
            }
            case LIST_DATABASES, TEST -> new SpringApplicationBuilder(DbMcpServerApplication.class)
                    .web(WebApplicationType.NONE)
                    .properties("spring.ai.mcp.server.enabled=false", "spring.main.banner-mode=off")
                    .run(args);
            default -> new SpringApplicationBuilder(DbMcpServerApplication.class).run(args);
        }
    }

    @EventListener
    public void onApplicationReady(ApplicationReadyEvent event) {
        if (CommandLineMode.isListingMode(event.getArgs())) {
            return;
        }
        log.info("🚀 Database MCP Server is ready!");
        log.info("🗄️ Configured databases: {} {}", connectionRegistry.size(), connectionRegistry.names());
        log.info("🔧 Available tools: execute_query, get_table_schema, list_databases, get_database_info, get_all_tables_schemas");
        log.info("📊 Metrics available at: /actuator/prometheus");
        log.info("🏥 Health check at: /actuator/health");
    }
}
