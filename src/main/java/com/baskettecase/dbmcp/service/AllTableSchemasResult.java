package com.baskettecase.dbmcp.service;

import com.baskettecase.dbmcp.schema.TableSchema;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Map;

/**
 * Result of {@code get_all_tables_schemas}: table name to its columns and indexes.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AllTableSchemasResult {
    boolean success;
    String database;
    Map<String, TableSchema> tables;
    Integer tablesCount;
    String error;
    ErrorType errorType;

    public static AllTableSchemasResult success(String database, Map<String, TableSchema> tables) {
        return new AllTableSchemasResult(true, database, tables, tables.size(), null, null);
    }

    public static AllTableSchemasResult failure(String database, ErrorType errorType, String error) {
        return new AllTableSchemasResult(false, database, null, null, error, errorType);
    }
}
