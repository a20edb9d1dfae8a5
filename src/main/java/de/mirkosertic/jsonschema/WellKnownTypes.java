package de.mirkosertic.jsonschema;

import com.fasterxml.jackson.databind.JsonNode;
import de.mirkosertic.jsonschema.model.Schema;
import de.mirkosertic.jsonschema.model.SimpleType;

import java.net.URI;
import java.net.URL;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Fixed schemas of JDK and library types that are not reflected structurally.
 */
final class WellKnownTypes {

    private static final Map<Class<?>, Consumer<Schema>> SCHEMAS = Map.ofEntries(
            Map.entry(UUID.class, schema -> schema.withType(SimpleType.STRING).withFormat("uuid")
                    .addExample("248df4b7-aa70-47b8-a036-33ac447e668d")),
            Map.entry(Instant.class, dateTime()),
            Map.entry(OffsetDateTime.class, dateTime()),
            Map.entry(ZonedDateTime.class, dateTime()),
            Map.entry(Date.class, dateTime()),
            Map.entry(LocalDate.class, schema -> schema.withType(SimpleType.STRING).withFormat("date")),
            Map.entry(LocalTime.class, schema -> schema.withType(SimpleType.STRING).withFormat("time")),
            Map.entry(OffsetTime.class, schema -> schema.withType(SimpleType.STRING).withFormat("time")),
            Map.entry(LocalDateTime.class, schema -> schema.withType(SimpleType.STRING)),
            Map.entry(Duration.class, schema -> schema.withType(SimpleType.STRING).withFormat("duration")),
            Map.entry(URI.class, schema -> schema.withType(SimpleType.STRING).withFormat("uri")),
            Map.entry(URL.class, schema -> schema.withType(SimpleType.STRING).withFormat("uri")),
            Map.entry(byte[].class, schema -> schema.withType(SimpleType.STRING).withFormat("base64")));

    private WellKnownTypes() {
    }

    private static Consumer<Schema> dateTime() {
        return schema -> schema.withType(SimpleType.STRING).withFormat("date-time");
    }

    /**
     * Fills the schema of a well known type.
     *
     * @return {@code false} if the type is not well known
     */
    static boolean apply(final Class<?> type, final Schema schema) {
        if (JsonNode.class.isAssignableFrom(type)) {
            return true;
        }
        final Consumer<Schema> filler = SCHEMAS.get(type);
        if (filler == null) {
            return false;
        }
        filler.accept(schema);
        return true;
    }
}
