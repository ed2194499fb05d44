package com.baskettecase.dbmcp.service;

import com.baskettecase.dbmcp.schema.ColumnDescriptor;
import com.baskettecase.dbmcp.schema.IndexDescriptor;
import com.baskettecase.dbmcp.schema.TableSchema;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Result of {@code get_table_schema}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TableSchemaResult {
    boolean success;
    String tableName;
    String database;
    List<ColumnDescriptor> columns;
    List<IndexDescriptor> indexes;
    Instant cachedAt;
    String error;
    ErrorType errorType;

    public static TableSchemaResult success(String database, String tableName, TableSchema schema) {
        return new TableSchemaResult(true, tableName, database,
                schema.getColumns(), schema.getIndexes(), schema.getReadAt(), null, null);
    }

    public static TableSchemaResult failure(String database, String tableName, ErrorType errorType, String error) {
        return new TableSchemaResult(false, tableName, database, null, null, null, error, errorType);
    }
}
