package com.baskettecase.dbmcp.schema;

import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Columns (in ordinal order) and indexes of one table, with the time they were read from the database.
 */
@Value
public class TableSchema {
    List<ColumnDescriptor> columns;
    List<IndexDescriptor> indexes;
    Instant readAt;

    public TableSchema(List<ColumnDescriptor> columns, List<IndexDescriptor> indexes, Instant readAt) {
        this.columns = List.copyOf(columns);
        this.indexes = List.copyOf(indexes);
        this.readAt = readAt;
    }
}
