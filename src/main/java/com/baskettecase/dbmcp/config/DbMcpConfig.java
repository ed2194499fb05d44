package com.baskettecase.dbmcp.config;

import com.baskettecase.dbmcp.db.ConnectionRegistry;
import com.baskettecase.dbmcp.schema.SchemaCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Wires the process-wide registry and schema cache.
 *
 * Both are built once here and injected by reference; nothing reaches them through static state.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(DbMcpProperties.class)
public class DbMcpConfig {

    @Bean
    public DatabaseConfigLoader databaseConfigLoader() {
        return new DatabaseConfigLoader();
    }

    @Bean
    public ConnectionRegistry connectionRegistry(DatabaseConfigLoader loader, DbMcpProperties properties) {
        Path path = DatabaseConfigLoader.resolveConfigPath(
                properties.getConfigPath(),
                Path.of("").toAbsolutePath(),
                Path.of(System.getProperty("user.home")));

        ConnectionRegistry registry = loader.load(path);
        log.info("🗄️ Loaded {} database(s): {}", registry.size(), registry.names());
        return registry;
    }

    @Bean
    public SchemaCache schemaCache() {
        return new SchemaCache();
    }
}
