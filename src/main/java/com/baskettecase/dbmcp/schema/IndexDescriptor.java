package com.baskettecase.dbmcp.schema;

import lombok.Value;

import java.util.Map;

/**
 * One index with its full definition from {@code pg_indexes}.
 */
@Value
public class IndexDescriptor {
    String name;
    String definition;

    public static IndexDescriptor fromRow(Map<String, Object> row) {
        return new IndexDescriptor((String) row.get("indexname"), (String) row.get("indexdef"));
    }
}
