package com.baskettecase.dbmcp.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Server settings bound from {@code db.mcp.*}.
 */
@Data
@ConfigurationProperties(prefix = "db.mcp")
public class DbMcpProperties {

    /**
     * Explicit path of the database registry file. Empty means search the default locations.
     */
    private String configPath;

    /**
     * Schema used for unqualified table names and database-wide listings.
     */
    private String defaultSchema = "public";

    /**
     * Mark every opened connection read-only, so the engine itself rejects writes.
     */
    private boolean readOnlySessions = true;

    /**
     * Reported to the server as the JDBC application name.
     */
    private String applicationName = "db-mcp-server";
}
