package com.baskettecase.dbmcp.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * Result of {@code get_database_info}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DatabaseInfoResult {
    boolean success;
    String database;
    ServerInfo info;
    List<TableSize> tables;
    Integer tablesCount;
    ConnectionSummary connectionConfig;
    String error;
    ErrorType errorType;

    public static DatabaseInfoResult success(String database, ServerInfo info, List<TableSize> tables,
                                             ConnectionSummary connectionConfig) {
        return new DatabaseInfoResult(true, database, info, tables, tables.size(), connectionConfig, null, null);
    }

    public static DatabaseInfoResult failure(String database, ConnectionSummary connectionConfig,
                                             ErrorType errorType, String error) {
        return new DatabaseInfoResult(false, database, null, null, null, connectionConfig, error, errorType);
    }
}
