package com.baskettecase.dbmcp.db;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * Connection parameters for one logical database.
 * The password is plaintext: never log or serialize this object as a whole.
 */
@Value
@Builder
public class ConnectionProfile {
    String host;
    int port;
    String databaseName;
    String user;
    @ToString.Exclude
    String password;

    /**
     * JDBC URL: jdbc:postgresql://host:port/database
     */
    public String getJdbcUrl() {
        return String.format("jdbc:postgresql://%s:%d/%s", host, port, databaseName);
    }
}
