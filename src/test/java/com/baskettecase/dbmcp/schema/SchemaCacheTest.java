package com.baskettecase.dbmcp.schema;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SchemaCache
 */
class SchemaCacheTest {

    private SchemaCache schemaCache;

    @BeforeEach
    void setUp() {
        schemaCache = new SchemaCache();
    }

    @Test
    void testMissComputesAndStores() {
        TableSchema schema = schemaWithColumn("id");

        TableSchema result = schemaCache.getOrCompute("math", "public.users", () -> schema);

        assertSame(schema, result);
        assertTrue(schemaCache.contains("math", "public.users"));
        assertEquals(1, schemaCache.size());
    }

    @Test
    void testHitReturnsStoredEntryWithoutComputing() {
        TableSchema first = schemaWithColumn("id");
        schemaCache.getOrCompute("math", "public.users", () -> first);

        AtomicInteger calls = new AtomicInteger();
        TableSchema second = schemaCache.getOrCompute("math", "public.users", () -> {
            calls.incrementAndGet();
            return schemaWithColumn("renamed");
        });

        assertSame(first, second);
        assertEquals(0, calls.get());
    }

    @Test
    void testKeysAreScopedByDatabase() {
        TableSchema mathUsers = schemaWithColumn("id");
        TableSchema englishUsers = schemaWithColumn("uuid");

        schemaCache.getOrCompute("math", "public.users", () -> mathUsers);
        TableSchema result = schemaCache.getOrCompute("english", "public.users", () -> englishUsers);

        assertSame(englishUsers, result);
        assertEquals(2, schemaCache.size());
    }

    @Test
    void testFailedComputationIsNotCached() {
        assertThrows(IllegalStateException.class, () -> schemaCache.getOrCompute("math", "public.users", () -> {
            throw new IllegalStateException("connection refused");
        }));

        assertFalse(schemaCache.contains("math", "public.users"));

        TableSchema schema = schemaWithColumn("id");
        assertSame(schema, schemaCache.getOrCompute("math", "public.users", () -> schema));
    }

    @Test
    void testFirstStoredEntryWinsWhenComputationsRace() {
        TableSchema winner = schemaWithColumn("first");
        TableSchema loser = schemaWithColumn("second");

        // Another caller stores its result while this one is still computing
        TableSchema result = schemaCache.getOrCompute("math", "public.users", () -> {
            schemaCache.getOrCompute("math", "public.users", () -> winner);
            return loser;
        });

        assertSame(winner, result);
        assertSame(winner, schemaCache.getOrCompute("math", "public.users", () -> loser));
    }

    private static TableSchema schemaWithColumn(String columnName) {
        ColumnDescriptor column = ColumnDescriptor.builder()
                .name(columnName)
                .dataType("integer")
                .nullable(false)
                .build();
        return new TableSchema(List.of(column), List.of(), Instant.now());
    }
}
