package com.baskettecase.dbmcp.db;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.postgresql.util.PGobject;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for ReadableColumnMapRowMapper
 */
@ExtendWith(MockitoExtension.class)
class ReadableColumnMapRowMapperTest {

    @Mock
    private ResultSet resultSet;

    @Mock
    private Array array;

    private final ReadableColumnMapRowMapper rowMapper = new ReadableColumnMapRowMapper();

    @Test
    void testSqlArrayBecomesList() throws SQLException {
        when(resultSet.getObject(1)).thenReturn(array);
        when(array.getArray()).thenReturn(new String[]{"algebra", "geometry"});

        Object value = rowMapper.getColumnValue(resultSet, 1);

        assertEquals(List.of("algebra", "geometry"), value);
        verify(array).free();
    }

    @Test
    void testDriverObjectBecomesText() throws SQLException {
        PGobject json = new PGobject();
        json.setType("jsonb");
        json.setValue("{\"level\": 3}");
        when(resultSet.getObject(1)).thenReturn(json);

        assertEquals("{\"level\": 3}", rowMapper.getColumnValue(resultSet, 1));
    }

    @Test
    void testPlainValuesAreUnchanged() throws SQLException {
        when(resultSet.getObject(1)).thenReturn(42L);

        assertEquals(42L, rowMapper.getColumnValue(resultSet, 1));
    }
}
