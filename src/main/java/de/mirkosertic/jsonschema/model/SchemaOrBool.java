package de.mirkosertic.jsonschema.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.util.Objects;

/**
 * Either a full {@link Schema} or the boolean shorthand ({@code true} accepts anything,
 * {@code false} accepts nothing).
 */
@JsonDeserialize(using = SchemaOrBool.Deserializer.class)
public final class SchemaOrBool {

    private final @Nullable Schema schema;
    private final @Nullable Boolean bool;

    private SchemaOrBool(@Nullable final Schema schema, @Nullable final Boolean bool) {
        this.schema = schema;
        this.bool = bool;
    }

    public static SchemaOrBool of(final Schema schema) {
        return new SchemaOrBool(Objects.requireNonNull(schema, "schema"), null);
    }

    public static SchemaOrBool of(final boolean value) {
        return new SchemaOrBool(null, value);
    }

    public @Nullable Schema schema() {
        return schema;
    }

    public @Nullable Boolean bool() {
        return bool;
    }

    public boolean isSchema() {
        return schema != null;
    }

    @JsonValue
    Object jsonValue() {
        return schema != null ? schema : bool;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SchemaOrBool other)) {
            return false;
        }
        return Objects.equals(schema, other.schema) && Objects.equals(bool, other.bool);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schema, bool);
    }

    @Override
    public String toString() {
        return schema != null ? schema.toString() : String.valueOf(bool);
    }

    static final class Deserializer extends JsonDeserializer<SchemaOrBool> {

        @Override
        public SchemaOrBool deserialize(final JsonParser parser, final DeserializationContext context) throws IOException {
            final JsonToken token = parser.currentToken();
            if (token == JsonToken.VALUE_TRUE || token == JsonToken.VALUE_FALSE) {
                return SchemaOrBool.of(parser.getBooleanValue());
            }
            return SchemaOrBool.of(context.readValue(parser, Schema.class));
        }
    }
}
