package com.baskettecase.dbmcp.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Utility class for rendering MCP tool results as indented JSON text.
 *
 * Result fields are written in snake_case ({@code row_count}, {@code execution_time}, ...).
 * Row maps keep the column names returned by the database. Dates and timestamps are ISO-8601 strings.
 */
public final class JsonResponseFormatter {

    private static final ObjectMapper mapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .build();

    private JsonResponseFormatter() {
    }

    /**
     * Serialize a tool result.
     *
     * @throws JsonProcessingException if a value cannot be serialized
     */
    public static String format(Object result) throws JsonProcessingException {
        return mapper.writeValueAsString(result);
    }
}
