package com.baskettecase.dbmcp.config;

import com.baskettecase.dbmcp.db.ConnectionProfile;
import com.baskettecase.dbmcp.db.ConnectionRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Database Registry Loader
 *
 * Reads the YAML file that maps logical database names to connection parameters
 * and turns it into a {@link ConnectionRegistry}.
 *
 * Each entry names its fields explicitly:
 * <pre>
 * math:
 *   host: db.internal
 *   port: 5432
 *   user: reader
 *   password: secret
 *   database: math      # optional, defaults to the entry name
 * </pre>
 */
@Slf4j
public class DatabaseConfigLoader {

    static final String FILE_NAME = ".db.yaml";
    static final String USER_CONFIG_DIR = ".config/mcp-db";

    private static final TypeReference<LinkedHashMap<String, DatabaseEntry>> ENTRIES_TYPE = new TypeReference<>() {};

    private final ObjectMapper yamlMapper = YAMLMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    /**
     * Pick the registry file: explicit path, then ./.db.yaml, then ~/.config/mcp-db/.db.yaml.
     * Falls back to ./.db.yaml when nothing exists so the load fails with a clear path.
     */
    public static Path resolveConfigPath(String explicitPath, Path workingDir, Path homeDir) {
        if (explicitPath != null && !explicitPath.isBlank()) {
            return Path.of(explicitPath.trim());
        }

        Path local = workingDir.resolve(FILE_NAME);
        if (Files.exists(local)) {
            return local;
        }

        Path userConfig = homeDir.resolve(USER_CONFIG_DIR).resolve(FILE_NAME);
        if (Files.exists(userConfig)) {
            return userConfig;
        }

        return local;
    }

    /**
     * Load the registry from a file.
     *
     * @throws ConfigLoadException if the file is missing, unreadable or not a mapping of entries
     */
    public ConnectionRegistry load(Path path) {
        log.info("📂 Loading database configuration from {}", path);

        String content;
        try {
            content = Files.readString(path);
        } catch (NoSuchFileException e) {
            log.error("❌ Configuration file {} not found", path);
            throw new ConfigLoadException(path, "Configuration file not found: " + path, e);
        } catch (IOException e) {
            log.error("❌ Could not read configuration file {}: {}", path, e.getMessage());
            throw new ConfigLoadException(path, "Could not read configuration file " + path + ": " + e.getMessage(), e);
        }

        return parse(path, content);
    }

    ConnectionRegistry parse(Path path, String content) {
        Map<String, DatabaseEntry> entries;
        try {
            entries = content.isBlank() ? null : yamlMapper.readValue(content, ENTRIES_TYPE);
        } catch (JsonProcessingException e) {
            log.error("❌ Invalid configuration in {}: {}", path, e.getOriginalMessage());
            throw new ConfigLoadException(path, "Invalid configuration in " + path + ": " + e.getOriginalMessage(), e);
        }

        if (entries == null || entries.isEmpty()) {
            log.warn("⚠️ No databases configured in {}", path);
            return ConnectionRegistry.empty();
        }

        Map<String, ConnectionProfile> profiles = new LinkedHashMap<>();
        entries.forEach((name, entry) -> {
            if (entry == null || !entry.isComplete()) {
                log.warn("⚠️ Incomplete configuration for database {} (host, port, user and password are required), skipping", name);
                return;
            }
            profiles.put(name, entry.toProfile(name));
            log.info("✅ Loaded configuration for database: {}", name);
        });

        return new ConnectionRegistry(profiles);
    }

    /**
     * One entry of the registry file as written by the user.
     */
    @Data
    static class DatabaseEntry {
        private String host;
        private Integer port;
        private String user;
        private String password;
        private String database;

        boolean isComplete() {
            return hasText(host) && port != null && hasText(user) && password != null;
        }

        ConnectionProfile toProfile(String name) {
            return ConnectionProfile.builder()
                    .host(host.trim())
                    .port(port)
                    .databaseName(hasText(database) ? database.trim() : name)
                    .user(user.trim())
                    .password(password)
                    .build();
        }

        private static boolean hasText(String value) {
            return value != null && !value.isBlank();
        }
    }
}
