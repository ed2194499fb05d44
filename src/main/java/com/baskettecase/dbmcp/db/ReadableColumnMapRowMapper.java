package com.baskettecase.dbmcp.db;

import org.postgresql.util.PGobject;
import org.springframework.jdbc.core.ColumnMapRowMapper;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Arrays;

/**
 * Column-name to value rows whose values serialize cleanly:
 * SQL arrays become lists and driver-specific objects (json, interval, ...) their text form.
 */
public class ReadableColumnMapRowMapper extends ColumnMapRowMapper {

    @Override
    protected Object getColumnValue(ResultSet rs, int index) throws SQLException {
        Object value = super.getColumnValue(rs, index);

        if (value instanceof Array array) {
            try {
                Object content = array.getArray();
                return content instanceof Object[] elements ? Arrays.asList(elements) : content;
            } finally {
                array.free();
            }
        }
        if (value instanceof PGobject pgObject) {
            return pgObject.getValue();
        }
        return value;
    }
}
