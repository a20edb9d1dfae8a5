package de.mirkosertic.jsonschema.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * JSON serialization of {@link Schema} trees and decoding of JSON literals.
 */
public final class SchemaMapper {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private SchemaMapper() {
    }

    public static ObjectMapper objectMapper() {
        return OBJECT_MAPPER;
    }

    /**
     * Serialize a schema (or any other value) to compact JSON.
     */
    public static String toJson(final Object value) {
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (final JsonProcessingException e) {
            throw new UncheckedIOException("JSON serialization error", e);
        }
    }

    public static String toPrettyJson(final Object value) {
        try {
            return OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (final JsonProcessingException e) {
            throw new UncheckedIOException("JSON serialization error", e);
        }
    }

    public static Schema fromJson(final byte[] json) throws IOException {
        return OBJECT_MAPPER.readValue(json, Schema.class);
    }

    public static Schema fromJson(final String json) throws IOException {
        return OBJECT_MAPPER.readValue(json, Schema.class);
    }

    /**
     * Decode an arbitrary JSON literal into plain Java values (maps, lists, strings, numbers, booleans).
     */
    public static Object readLiteral(final String json) throws JsonProcessingException {
        return OBJECT_MAPPER.readValue(json, Object.class);
    }
}
