package com.baskettecase.dbmcp.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Result of {@code execute_query}. Either {@code data} and {@code rowCount} are set (success),
 * or {@code error} and {@code errorType} are; never both.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryOutcome {
    boolean success;
    List<Map<String, Object>> data;
    Integer rowCount;
    double executionTime;
    String error;
    ErrorType errorType;
    String database;

    public static QueryOutcome success(String database, List<Map<String, Object>> rows, double executionTime) {
        return new QueryOutcome(true, rows, rows.size(), executionTime, null, null, database);
    }

    public static QueryOutcome failure(String database, ErrorType errorType, String error, double executionTime) {
        return new QueryOutcome(false, null, null, executionTime, error, errorType, database);
    }
}
