package com.baskettecase.dbmcp.config;

import com.baskettecase.dbmcp.db.ConnectionProfile;
import com.baskettecase.dbmcp.db.ConnectionRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for DatabaseConfigLoader
 */
class DatabaseConfigLoaderTest {

    @TempDir
    Path tempDir;

    private DatabaseConfigLoader loader;

    @BeforeEach
    void setUp() {
        loader = new DatabaseConfigLoader();
    }

    @Test
    void testLoadsNamedFields() throws IOException {
        Path file = write("""
            math:
              host: db.internal
              port: 5432
              user: reader
              password: secret
            english:
              host: db2.internal
              port: 6432
              user: analyst
              password: other
              database: skysmart_english
            """);

        ConnectionRegistry registry = loader.load(file);

        assertEquals(2, registry.size());
        assertEquals(List.of("math", "english"), List.copyOf(registry.names()));

        ConnectionProfile math = registry.find("math").orElseThrow();
        assertEquals("db.internal", math.getHost());
        assertEquals(5432, math.getPort());
        assertEquals("reader", math.getUser());
        assertEquals("secret", math.getPassword());
        assertEquals("math", math.getDatabaseName());
        assertEquals("jdbc:postgresql://db.internal:5432/math", math.getJdbcUrl());

        ConnectionProfile english = registry.find("english").orElseThrow();
        assertEquals("skysmart_english", english.getDatabaseName());
        assertEquals(6432, english.getPort());
    }

    @Test
    void testNumericPasswordAndQuotedPortAreAccepted() throws IOException {
        Path file = write("""
            math:
              host: localhost
              port: "5432"
              user: reader
              password: 12345
            """);

        ConnectionProfile math = loader.load(file).find("math").orElseThrow();

        assertEquals(5432, math.getPort());
        assertEquals("12345", math.getPassword());
    }

    @Test
    void testIncompleteEntriesAreSkipped() throws IOException {
        Path file = write("""
            complete:
              host: localhost
              port: 5432
              user: reader
              password: secret
            no_password:
              host: localhost
              port: 5432
              user: reader
            empty:
            legacy:
              localhost: 5432
              reader: secret
            """);

        ConnectionRegistry registry = loader.load(file);

        assertEquals(1, registry.size());
        assertTrue(registry.contains("complete"));
        assertFalse(registry.contains("no_password"));
        assertFalse(registry.contains("empty"));
        assertFalse(registry.contains("legacy"));
    }

    @Test
    void testEmptyFileYieldsEmptyRegistry() throws IOException {
        ConnectionRegistry registry = loader.load(write(""));

        assertEquals(0, registry.size());
    }

    @Test
    void testMissingFileFails() {
        Path missing = tempDir.resolve("missing.yaml");

        ConfigLoadException e = assertThrows(ConfigLoadException.class, () -> loader.load(missing));

        assertEquals(missing, e.getPath());
        assertTrue(e.getMessage().contains("not found"));
    }

    @Test
    void testMalformedYamlFails() throws IOException {
        Path file = write("math: [unclosed\n");

        assertThrows(ConfigLoadException.class, () -> loader.load(file));
    }

    @Test
    void testNonNumericPortFails() throws IOException {
        Path file = write("""
            math:
              host: localhost
              port: five
              user: reader
              password: secret
            """);

        assertThrows(ConfigLoadException.class, () -> loader.load(file));
    }

    @Test
    void testExplicitPathWins() throws IOException {
        Files.writeString(tempDir.resolve(DatabaseConfigLoader.FILE_NAME), "");

        Path resolved = DatabaseConfigLoader.resolveConfigPath("/etc/db.yaml", tempDir, tempDir);

        assertEquals(Path.of("/etc/db.yaml"), resolved);
    }

    @Test
    void testLocalFileBeforeUserConfig() throws IOException {
        Path work = Files.createDirectory(tempDir.resolve("work"));
        Path home = Files.createDirectory(tempDir.resolve("home"));
        Path local = Files.writeString(work.resolve(DatabaseConfigLoader.FILE_NAME), "");
        Path userDir = Files.createDirectories(home.resolve(DatabaseConfigLoader.USER_CONFIG_DIR));
        Files.writeString(userDir.resolve(DatabaseConfigLoader.FILE_NAME), "");

        assertEquals(local, DatabaseConfigLoader.resolveConfigPath(null, work, home));
    }

    @Test
    void testUserConfigWhenNoLocalFile() throws IOException {
        Path work = Files.createDirectory(tempDir.resolve("work"));
        Path home = Files.createDirectory(tempDir.resolve("home"));
        Path userDir = Files.createDirectories(home.resolve(DatabaseConfigLoader.USER_CONFIG_DIR));
        Path userConfig = Files.writeString(userDir.resolve(DatabaseConfigLoader.FILE_NAME), "");

        assertEquals(userConfig, DatabaseConfigLoader.resolveConfigPath("  ", work, home));
    }

    @Test
    void testFallsBackToLocalPathWhenNothingExists() {
        Path resolved = DatabaseConfigLoader.resolveConfigPath(null, tempDir, tempDir.resolve("home"));

        assertEquals(tempDir.resolve(DatabaseConfigLoader.FILE_NAME), resolved);
    }

    private Path write(String content) throws IOException {
        return Files.writeString(tempDir.resolve("db.yaml"), content);
    }
}
