package com.baskettecase.dbmcp.service;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Failure categories reported in tool results.
 */
public enum ErrorType {
    UNKNOWN_DATABASE("UnknownDatabase"),
    DISALLOWED_QUERY("DisallowedQuery"),
    CONNECTION_FAILURE("ConnectionFailure"),
    EXECUTION_FAILURE("ExecutionFailure"),
    INTROSPECTION_FAILURE("IntrospectionFailure");

    private final String label;

    ErrorType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
