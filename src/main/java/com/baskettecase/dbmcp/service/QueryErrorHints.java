package com.baskettecase.dbmcp.service;

import com.baskettecase.dbmcp.util.FuzzyMatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Adds "did you mean" suggestions to engine errors about missing relations or schemas.
 *
 * Runs on the connection that produced the error. If the lookup itself fails the original message is kept.
 */
@Slf4j
class QueryErrorHints {

    private static final Pattern MISSING_RELATION = Pattern.compile("relation \"([^\"]+)\" does not exist", Pattern.CASE_INSENSITIVE);
    private static final Pattern MISSING_SCHEMA = Pattern.compile("schema \"([^\"]+)\" does not exist", Pattern.CASE_INSENSITIVE);

    private static final String TABLES_IN_SCHEMA_SQL = """
        SELECT table_name
        FROM information_schema.tables
        WHERE table_schema = ?
        """;

    private static final String USER_SCHEMAS_SQL = """
        SELECT schema_name
        FROM information_schema.schemata
        WHERE schema_name NOT IN ('pg_catalog', 'information_schema', 'pg_toast')
        """;

    private final String defaultSchema;

    QueryErrorHints(String defaultSchema) {
        this.defaultSchema = defaultSchema;
    }

    String enhance(JdbcTemplate jdbcTemplate, String errorMessage) {
        if (errorMessage == null) {
            return "Unknown database error occurred";
        }

        try {
            Matcher relation = MISSING_RELATION.matcher(errorMessage);
            if (relation.find()) {
                return withRelationHint(jdbcTemplate, errorMessage, relation.group(1));
            }

            Matcher schema = MISSING_SCHEMA.matcher(errorMessage);
            if (schema.find()) {
                List<String> schemas = jdbcTemplate.queryForList(USER_SCHEMAS_SQL, String.class);
                return withHint(errorMessage, schema.group(1), FuzzyMatcher.suggestions(schema.group(1), schemas), "");
            }
        } catch (DataAccessException e) {
            log.warn("Failed to generate suggestions for error '{}': {}", errorMessage, e.getMessage());
        }

        return errorMessage;
    }

    private String withRelationHint(JdbcTemplate jdbcTemplate, String errorMessage, String missing) {
        String schemaName = defaultSchema;
        String tableName = missing;
        int dot = missing.indexOf('.');
        if (dot > 0) {
            schemaName = missing.substring(0, dot);
            tableName = missing.substring(dot + 1);
        }

        List<String> tables = jdbcTemplate.queryForList(TABLES_IN_SCHEMA_SQL, String.class, schemaName);
        return withHint(errorMessage, missing, FuzzyMatcher.suggestions(tableName, tables), schemaName + ".");
    }

    private String withHint(String errorMessage, String missing, List<String> suggestions, String prefix) {
        if (suggestions.isEmpty()) {
            return errorMessage;
        }

        log.info("💡 Suggestions for '{}': {}", missing, suggestions);
        String quoted = suggestions.stream()
                .map(s -> "'" + prefix + s + "'")
                .collect(Collectors.joining(", "));
        String hint = suggestions.size() == 1 ? "Did you mean " + quoted + "?" : "Did you mean one of these? " + quoted;
        return errorMessage + "\n\n💡 " + hint;
    }
}
