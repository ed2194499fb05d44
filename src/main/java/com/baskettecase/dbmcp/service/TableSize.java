package com.baskettecase.dbmcp.service;

import lombok.Value;

import java.util.Map;

/**
 * A table of the default schema with its total on-disk size (data, indexes and TOAST).
 */
@Value
public class TableSize {
    String tableName;
    String size;
    Long sizeBytes;

    static TableSize fromRow(Map<String, Object> row) {
        Object bytes = row.get("size_bytes");
        return new TableSize(
                (String) row.get("table_name"),
                (String) row.get("size"),
                bytes == null ? null : ((Number) bytes).longValue());
    }
}
