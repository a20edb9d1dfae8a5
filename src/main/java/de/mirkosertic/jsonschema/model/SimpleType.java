package de.mirkosertic.jsonschema.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Primitive JSON Schema types as used by the {@code type} keyword.
 */
public enum SimpleType {

    ARRAY("array"),
    BOOLEAN("boolean"),
    INTEGER("integer"),
    NULL("null"),
    NUMBER("number"),
    OBJECT("object"),
    STRING("string");

    private final String jsonName;

    SimpleType(final String jsonName) {
        this.jsonName = jsonName;
    }

    @JsonValue
    public String jsonName() {
        return jsonName;
    }

    @JsonCreator
    public static SimpleType fromJsonName(final String name) {
        for (final SimpleType type : values()) {
            if (type.jsonName.equals(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown schema type: " + name);
    }

    @Override
    public String toString() {
        return jsonName;
    }
}
