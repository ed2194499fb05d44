package com.baskettecase.dbmcp.service;

import lombok.Value;

import java.util.Map;

/**
 * Identity and size of a connected database, as reported by the server itself.
 */
@Value
public class ServerInfo {
    String databaseName;
    String currentUser;
    String version;
    Long sizeBytes;

    static ServerInfo fromRow(Map<String, Object> row) {
        Object size = row.get("size_bytes");
        return new ServerInfo(
                (String) row.get("database_name"),
                (String) row.get("current_user"),
                (String) row.get("version"),
                size == null ? null : ((Number) size).longValue());
    }
}
