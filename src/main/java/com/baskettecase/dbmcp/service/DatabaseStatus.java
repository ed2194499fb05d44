package com.baskettecase.dbmcp.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * One entry of {@code list_databases}: either the server details or the reason it could not be reached.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DatabaseStatus {
    boolean available;
    String databaseName;
    String currentUser;
    String version;
    Long sizeBytes;
    Long tablesCount;
    ConnectionSummary connectionConfig;
    String error;
    ErrorType errorType;

    public static DatabaseStatus available(ServerInfo info, long tablesCount, ConnectionSummary connectionConfig) {
        return new DatabaseStatus(true, info.getDatabaseName(), info.getCurrentUser(), info.getVersion(),
                info.getSizeBytes(), tablesCount, connectionConfig, null, null);
    }

    public static DatabaseStatus unavailable(ConnectionSummary connectionConfig, ErrorType errorType, String error) {
        return new DatabaseStatus(false, null, null, null, null, null, connectionConfig, error, errorType);
    }
}
