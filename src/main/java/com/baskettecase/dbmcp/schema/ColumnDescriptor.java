package com.baskettecase.dbmcp.schema;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * One column as reported by {@code information_schema.columns}.
 */
@Value
@Builder
public class ColumnDescriptor {
    String name;
    String dataType;
    boolean nullable;
    String defaultExpression;
    Integer maxLength;
    Integer numericPrecision;
    Integer numericScale;

    /**
     * Map an {@code information_schema.columns} row (column_name, data_type, is_nullable, ...).
     */
    public static ColumnDescriptor fromRow(Map<String, Object> row) {
        return ColumnDescriptor.builder()
                .name((String) row.get("column_name"))
                .dataType((String) row.get("data_type"))
                .nullable("YES".equals(row.get("is_nullable")))
                .defaultExpression((String) row.get("column_default"))
                .maxLength(toInteger(row.get("character_maximum_length")))
                .numericPrecision(toInteger(row.get("numeric_precision")))
                .numericScale(toInteger(row.get("numeric_scale")))
                .build();
    }

    private static Integer toInteger(Object value) {
        return value == null ? null : ((Number) value).intValue();
    }
}
