package com.baskettecase.dbmcp.db;

import lombok.Getter;

/**
 * The requested logical database name is not in the registry.
 */
@Getter
public class UnknownDatabaseException extends RuntimeException {

    private final String databaseName;

    public UnknownDatabaseException(String databaseName) {
        super(String.format("Database %s not found in configuration", databaseName));
        this.databaseName = databaseName;
    }
}
