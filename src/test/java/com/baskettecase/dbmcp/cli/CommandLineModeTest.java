package com.baskettecase.dbmcp.cli;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CommandLineMode
 */
class CommandLineModeTest {

    @Test
    void testNoArgumentsStartsServer() {
        assertEquals(CommandLineMode.SERVE, CommandLineMode.fromArgs(new String[0]));
        assertEquals(CommandLineMode.SERVE, CommandLineMode.fromArgs(null));
    }

    @Test
    void testModeFlags() {
        assertEquals(CommandLineMode.HELP, CommandLineMode.fromArgs(new String[]{"--help"}));
        assertEquals(CommandLineMode.HELP, CommandLineMode.fromArgs(new String[]{"-h"}));
        assertEquals(CommandLineMode.LIST_DATABASES, CommandLineMode.fromArgs(new String[]{"--list-databases"}));
        assertEquals(CommandLineMode.TEST, CommandLineMode.fromArgs(new String[]{"--test"}));
    }

    @Test
    void testPropertyOverridesAreAccepted() {
        String[] args = {"--db.mcp.config-path=/etc/mcp/.db.yaml", "--test"};

        assertEquals(CommandLineMode.TEST, CommandLineMode.fromArgs(args));
        assertTrue(CommandLineMode.isListingMode(args));
        assertEquals(CommandLineMode.SERVE, CommandLineMode.fromArgs(new String[]{"--server.port=9090"}));
    }

    @Test
    void testUnknownArgument() {
        String[] args = {"--verbose"};

        assertEquals(CommandLineMode.UNKNOWN, CommandLineMode.fromArgs(args));
        assertEquals(Optional.of("--verbose"), CommandLineMode.unknownArgument(args));
        assertFalse(CommandLineMode.isListingMode(args));
    }

    @Test
    void testHelpTextNamesEveryTool() {
        String help = CommandLineMode.helpText();

        assertTrue(help.contains("execute_query"));
        assertTrue(help.contains("get_table_schema"));
        assertTrue(help.contains("list_databases"));
        assertTrue(help.contains("get_database_info"));
        assertTrue(help.contains("get_all_tables_schemas"));
    }
}
