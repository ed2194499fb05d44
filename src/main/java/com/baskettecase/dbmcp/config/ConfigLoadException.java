package com.baskettecase.dbmcp.config;

import lombok.Getter;

import java.nio.file.Path;

/**
 * The database registry file could not be found, read or parsed.
 */
@Getter
public class ConfigLoadException extends RuntimeException {

    private final Path path;

    public ConfigLoadException(Path path, String message) {
        super(message);
        this.path = path;
    }

    public ConfigLoadException(Path path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }
}
