package com.baskettecase.dbmcp.db;

import lombok.Getter;

/**
 * The network or authentication handshake with a configured database did not complete.
 */
@Getter
public class ConnectionFailureException extends RuntimeException {

    private final String databaseName;

    public ConnectionFailureException(String databaseName, Throwable cause) {
        super(String.format("Failed to connect to database %s: %s", databaseName, cause.getMessage()), cause);
        this.databaseName = databaseName;
    }
}
