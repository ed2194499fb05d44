package com.baskettecase.dbmcp.cli;

import java.util.Arrays;
import java.util.Optional;

/**
 * Process-level modes selected from the command line.
 *
 * Spring property overrides ({@code --name=value}) are passed through untouched in every mode.
 */
public enum CommandLineMode {

    SERVE,
    HELP,
    LIST_DATABASES,
    TEST,
    UNKNOWN;

    public static CommandLineMode fromArgs(String[] args) {
        if (args == null || args.length == 0) {
            return SERVE;
        }
        if (unknownArgument(args).isPresent()) {
            return UNKNOWN;
        }
        for (String arg : args) {
            switch (arg) {
                case "--help", "-h":
                    return HELP;
                case "--list-databases":
                    return LIST_DATABASES;
                case "--test":
                    return TEST;
                default:
                    break;
            }
        }
        return SERVE;
    }

    /**
     * First argument that is neither a mode flag nor a Spring property override.
     */
    public static Optional<String> unknownArgument(String[] args) {
        if (args == null) {
            return Optional.empty();
        }
        return Arrays.stream(args)
                .filter(arg -> !isModeFlag(arg) && !isPropertyOverride(arg))
                .findFirst();
    }

    public static boolean isListingMode(String[] args) {
        CommandLineMode mode = fromArgs(args);
        return mode == LIST_DATABASES || mode == TEST;
    }

    private static boolean isModeFlag(String arg) {
        return arg.equals("--help") || arg.equals("-h")
                || arg.equals("--list-databases") || arg.equals("--test");
    }

    private static boolean isPropertyOverride(String arg) {
        return arg.startsWith("--") && arg.indexOf('=') > 2;
    }

    public static String helpText() {
        return """
                MCP server for read-only access to PostgreSQL databases

                Usage:
                  db-mcp-server                    - Start the MCP server
                  db-mcp-server --help             - Show this help
                  db-mcp-server --list-databases   - List configured databases and their status
                  db-mcp-server --test             - Check connectivity to every configured database

                Available MCP tools:
                  • execute_query          - Run a SELECT/WITH/EXPLAIN/SHOW/DESCRIBE/VALUES query
                  • get_table_schema       - Columns and indexes of a table
                  • list_databases         - All configured databases and their status
                  • get_database_info      - Database details (size, tables)
                  • get_all_tables_schemas - Columns and indexes of every table in a database

                Configuration:
                  --db.mcp.config-path=<file> or MCP_DB_CONFIG
                  ./.db.yaml
                  ~/.config/mcp-db/.db.yaml
                """;
    }
}
