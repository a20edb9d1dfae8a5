package de.mirkosertic.jsonschema;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.jsonschema.capability.Compositions;
import de.mirkosertic.jsonschema.capability.Described;
import de.mirkosertic.jsonschema.capability.ElseExposer;
import de.mirkosertic.jsonschema.capability.Enumerated;
import de.mirkosertic.jsonschema.capability.Exposer;
import de.mirkosertic.jsonschema.capability.IfExposer;
import de.mirkosertic.jsonschema.capability.NamedEnum;
import de.mirkosertic.jsonschema.capability.NotExposer;
import de.mirkosertic.jsonschema.capability.OneOfExposer;
import de.mirkosertic.jsonschema.capability.Preparer;
import de.mirkosertic.jsonschema.capability.RawExposer;
import de.mirkosertic.jsonschema.capability.ThenExposer;
import de.mirkosertic.jsonschema.capability.Titled;
import de.mirkosertic.jsonschema.model.Schema;
import de.mirkosertic.jsonschema.model.SchemaMapper;
import de.mirkosertic.jsonschema.model.SimpleType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Tests for composition keywords and the other capabilities a reflected type can implement.
 */
@DisplayName("SubSchemaComposer Tests")
class SubSchemaComposerTest {

    record Circle(@JsonProperty("radius") double radius) {
    }

    record Square(@JsonProperty("side") double side) {
    }

    static class Shape implements OneOfExposer {
        @Override
        public List<Object> jsonSchemaOneOf() {
            return List.of(new Circle(1.0), new Square(2.0));
        }
    }

    static class Conditional implements IfExposer, ThenExposer, ElseExposer {
        @Override
        public Object jsonSchemaIf() {
            return true;
        }

        @Override
        public Object jsonSchemaThen() {
            return "text";
        }

        @Override
        public Object jsonSchemaElse() {
            return 0;
        }
    }

    static class NotANumber implements NotExposer {
        @Override
        public Object jsonSchemaNot() {
            return 0.0;
        }
    }

    record Currency(String code) implements Exposer {
        @Override
        public Schema jsonSchema() {
            return new Schema().withType(SimpleType.STRING).withPattern("^[A-Z]{3}$");
        }
    }

    record Price(@JsonProperty("amount") double amount, @JsonProperty("currency") Currency currency) {
    }

    record Email(String address) implements RawExposer {
        @Override
        public byte[] jsonSchemaBytes() {
            return "{\"type\":\"string\",\"format\":\"email\"}".getBytes(StandardCharsets.UTF_8);
        }
    }

    record Temperature(@JsonProperty("celsius") double celsius) implements Preparer {
        @Override
        public void prepareJsonSchema(final Schema schema) {
            schema.withDescription("Temperature in degrees Celsius");
            schema.getProperties().get("celsius").schema().withMinimum(new BigDecimal("-273.15"));
        }
    }

    record Tagged(@JsonProperty("name") String name) implements Titled, Described {
        @Override
        public String title() {
            return "Tagged value";
        }

        @Override
        public String description() {
            return "Carries a name";
        }
    }

    enum Weekday implements Enumerated {
        MONDAY,
        TUESDAY;

        @Override
        public List<Object> enumValues() {
            return List.of("mon", "tue");
        }
    }

    record Priority(@JsonValue int level) implements NamedEnum {
        @Override
        public Values namedEnum() {
            return new Values(List.of(1, 2, 3), List.of("low", "medium", "high"));
        }
    }

    record Faulty(@JsonProperty("text") String text) implements Described {
        @Override
        public String description() {
            throw new IllegalStateException("no text");
        }
    }

    record Unreachable(String url) implements Exposer {
        @Override
        public Schema jsonSchema() throws IOException {
            throw new IOException("connection refused");
        }
    }

    record Holder(@JsonProperty("payload") Object payload) {
    }

    private Reflector reflector;

    @BeforeEach
    void setUp() {
        reflector = new Reflector();
    }

    private static void assertJson(final Schema schema, final String expected) throws Exception {
        final ObjectMapper mapper = SchemaMapper.objectMapper();
        assertThat(mapper.readTree(SchemaMapper.toJson(schema)))
                .as("Reflected schema %s", SchemaMapper.toJson(schema))
                .isEqualTo(mapper.readTree(expected));
    }

    @Nested
    @DisplayName("Composition Keywords")
    class CompositionTests {

        @Test
        @DisplayName("Should reference named alternatives in oneOf")
        void shouldReferenceNamedAlternatives() throws Exception {
            // When
            final Schema schema = reflector.reflect(Shape.class);

            // Then
            assertJson(schema, """
                    {
                      "definitions": {
                        "JsonschemaCircle": {"properties": {"radius": {"type": "number"}}, "type": "object"},
                        "JsonschemaSquare": {"properties": {"side": {"type": "number"}}, "type": "object"}
                      },
                      "oneOf": [
                        {"$ref": "#/definitions/JsonschemaCircle"},
                        {"$ref": "#/definitions/JsonschemaSquare"}
                      ],
                      "type": "object"
                    }
                    """);
        }

        @Test
        @DisplayName("Should fill conditional keywords")
        void shouldFillConditionalKeywords() throws Exception {
            // When
            final Schema schema = reflector.reflect(Conditional.class);

            // Then
            assertJson(schema, """
                    {
                      "if": {"type": "boolean"},
                      "then": {"type": "string"},
                      "else": {"type": "integer"},
                      "type": "object"
                    }
                    """);
        }

        @Test
        @DisplayName("Should fill the not keyword")
        void shouldFillNot() throws Exception {
            // When
            final Schema schema = reflector.reflect(NotANumber.class);

            // Then
            assertJson(schema, """
                    {"not": {"type": "number"}, "type": "object"}
                    """);
        }

        @Test
        @DisplayName("Should reflect composition helpers without an object type")
        void shouldReflectCompositionHelpers() throws Exception {
            // When
            final Schema schema = reflector.reflect(Compositions.oneOf(1.23, "abc"));

            // Then
            assertJson(schema, """
                    {"oneOf": [{"type": "number"}, {"type": "string"}]}
                    """);
        }

        @Test
        @DisplayName("Should reflect composition helpers held by untyped properties")
        void shouldReflectCompositionProperties() throws Exception {
            // When
            final Schema schema = reflector.reflect(new Holder(Compositions.anyOf(1, "x")));

            // Then
            assertJson(schema, """
                    {
                      "properties": {
                        "payload": {"anyOf": [{"type": "integer"}, {"type": "string"}]}
                      },
                      "type": "object"
                    }
                    """);
        }
    }

    @Nested
    @DisplayName("Schema Capabilities")
    class CapabilityTests {

        @Test
        @DisplayName("Should use the exposed schema as definition")
        void shouldUseExposedSchema() throws Exception {
            // When
            final Schema schema = reflector.reflect(Price.class);

            // Then
            assertJson(schema, """
                    {
                      "definitions": {
                        "JsonschemaCurrency": {"pattern": "^[A-Z]{3}$", "type": "string"}
                      },
                      "properties": {
                        "amount": {"type": "number"},
                        "currency": {"$ref": "#/definitions/JsonschemaCurrency"}
                      },
                      "type": "object"
                    }
                    """);
        }

        @Test
        @DisplayName("Should parse raw exposed schemas")
        void shouldParseRawSchemas() throws Exception {
            // When
            final Schema schema = reflector.reflect(Email.class);

            // Then
            assertJson(schema, """
                    {"format": "email", "type": "string"}
                    """);
        }

        @Test
        @DisplayName("Should let preparers adjust the finished schema")
        void shouldRunPreparers() throws Exception {
            // When
            final Schema schema = reflector.reflect(Temperature.class);

            // Then
            assertJson(schema, """
                    {
                      "description": "Temperature in degrees Celsius",
                      "properties": {"celsius": {"minimum": -273.15, "type": "number"}},
                      "type": "object"
                    }
                    """);
        }

        @Test
        @DisplayName("Should apply title and description capabilities")
        void shouldApplyTitleAndDescription() throws Exception {
            // When
            final Schema schema = reflector.reflect(Tagged.class);

            // Then
            assertThat(schema.getTitle()).isEqualTo("Tagged value");
            assertThat(schema.getDescription()).isEqualTo("Carries a name");
        }

        @Test
        @DisplayName("Should replace enum constants by enumerated values")
        void shouldUseEnumeratedValues() throws Exception {
            // When
            final Schema schema = reflector.reflect(Weekday.class);

            // Then
            assertJson(schema, """
                    {"enum": ["mon", "tue"], "type": "string"}
                    """);
        }

        @Test
        @DisplayName("Should emit named enumerations with their names")
        void shouldEmitNamedEnum() throws Exception {
            // When
            final Schema schema = reflector.reflect(Priority.class);

            // Then
            assertJson(schema, """
                    {"enum": [1, 2, 3], "type": "integer", "x-enum-names": ["low", "medium", "high"]}
                    """);
        }

        @Test
        @DisplayName("Should wrap failing capabilities into HookException")
        void shouldWrapFailingCapabilities() {
            assertThatThrownBy(() -> reflector.reflect(Faulty.class))
                    .isInstanceOf(HookException.class)
                    .hasMessage("description failed: no text")
                    .hasCauseInstanceOf(IllegalStateException.class);

            assertThatThrownBy(() -> reflector.reflect(Unreachable.class))
                    .isInstanceOf(HookException.class)
                    .hasMessageContaining("connection refused")
                    .hasCauseInstanceOf(IOException.class);
        }
    }

    @Nested
    @DisplayName("Direct Composition")
    class DirectTests {

        private final SubSchemaComposer composer = new SubSchemaComposer();

        @Test
        @DisplayName("Should walk every alternative below the composed schema")
        void shouldWalkEveryAlternative() throws Exception {
            // Given
            final SubSchemaComposer.AlternativeWalker walker = mock(SubSchemaComposer.AlternativeWalker.class);
            when(walker.walk(any(), anyString(), any())).thenReturn(new Schema().withType(SimpleType.STRING));
            final Schema schema = new Schema();

            // When
            composer.compose(Compositions.allOf("a", "b"), schema, new ReflectContext(), walker);

            // Then
            verify(walker).walk(eq("a"), eq("allOf"), eq(schema));
            verify(walker).walk(eq("b"), eq("allOf"), eq(schema));
            assertThat(schema.getAllOf()).hasSize(2);
            assertThat(schema.getOneOf()).isNull();
        }

        @Test
        @DisplayName("Should ignore values without composition capabilities")
        void shouldIgnorePlainValues() throws Exception {
            // Given
            final SubSchemaComposer.AlternativeWalker walker = mock(SubSchemaComposer.AlternativeWalker.class);

            // When
            composer.compose(null, new Schema(), new ReflectContext(), walker);
            composer.compose("plain", new Schema(), new ReflectContext(), walker);

            // Then
            verifyNoInteractions(walker);
        }
    }
}
