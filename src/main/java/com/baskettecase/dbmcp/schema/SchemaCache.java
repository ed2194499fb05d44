package com.baskettecase.dbmcp.schema;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Schema Cache
 *
 * Keeps the first successfully computed {@link TableSchema} per (database, table) for the life of the process.
 * Entries are never refreshed, evicted or invalidated, so a schema change made after the first lookup
 * is not visible until restart.
 *
 * The compute function runs outside any lock. Two concurrent misses on the same key may both query the
 * database; the first one to store wins and both callers get that entry. Failed computations are not cached.
 */
@Slf4j
public class SchemaCache {

    private final Map<Key, TableSchema> entries = new ConcurrentHashMap<>();

    public TableSchema getOrCompute(String databaseName, String tableName, Supplier<TableSchema> compute) {
        Key key = new Key(databaseName, tableName);

        TableSchema cached = entries.get(key);
        if (cached != null) {
            log.debug("📦 Schema cache hit for {}:{}", databaseName, tableName);
            return cached;
        }

        TableSchema computed = compute.get();
        TableSchema winner = entries.putIfAbsent(key, computed);
        return winner != null ? winner : computed;
    }

    public boolean contains(String databaseName, String tableName) {
        return entries.containsKey(new Key(databaseName, tableName));
    }

    public int size() {
        return entries.size();
    }

    private record Key(String databaseName, String tableName) {}
}
