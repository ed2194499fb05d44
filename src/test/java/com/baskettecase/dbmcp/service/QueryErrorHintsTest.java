package com.baskettecase.dbmcp.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for QueryErrorHints
 */
@ExtendWith(MockitoExtension.class)
class QueryErrorHintsTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    private QueryErrorHints errorHints;

    @BeforeEach
    void setUp() {
        errorHints = new QueryErrorHints("public");
    }

    @Test
    void testMissingRelationInQualifiedSchema() {
        when(jdbcTemplate.queryForList(contains("information_schema.tables"), eq(String.class), eq("sales")))
                .thenReturn(List.of("orders", "order_items", "customers"));

        String message = errorHints.enhance(jdbcTemplate, "ERROR: relation \"sales.ordrs\" does not exist");

        assertTrue(message.startsWith("ERROR: relation \"sales.ordrs\" does not exist\n\n💡 Did you mean one of these? "));
        assertTrue(message.contains("'sales.orders'"));
        assertFalse(message.contains("customers"));
    }

    @Test
    void testMissingSchema() {
        when(jdbcTemplate.queryForList(contains("information_schema.schemata"), eq(String.class)))
                .thenReturn(List.of("public", "analytics"));

        String message = errorHints.enhance(jdbcTemplate, "ERROR: schema \"analytic\" does not exist");

        assertTrue(message.endsWith("💡 Did you mean 'analytics'?"));
    }

    @Test
    void testOtherErrorsAreUnchanged() {
        String original = "ERROR: division by zero";

        assertEquals(original, errorHints.enhance(jdbcTemplate, original));
        verifyNoInteractions(jdbcTemplate);
    }

    @Test
    void testLookupFailureKeepsOriginalMessage() {
        when(jdbcTemplate.queryForList(contains("information_schema.tables"), eq(String.class), eq("public")))
                .thenThrow(new DataAccessResourceFailureException("current transaction is aborted"));
        String original = "ERROR: relation \"userz\" does not exist";

        assertEquals(original, errorHints.enhance(jdbcTemplate, original));
    }

    @Test
    void testNullMessage() {
        assertEquals("Unknown database error occurred", errorHints.enhance(jdbcTemplate, null));
    }
}
