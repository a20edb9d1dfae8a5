package de.mirkosertic.jsonschema;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.jsonschema.annotation.Nullability;
import de.mirkosertic.jsonschema.annotation.SchemaKeywords;
import de.mirkosertic.jsonschema.model.Schema;
import de.mirkosertic.jsonschema.model.SchemaMapper;
import de.mirkosertic.jsonschema.model.SimpleType;
import de.mirkosertic.jsonschema.util.FieldTags;
import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the null variant of property schemas.
 */
@DisplayName("NullabilityResolver Tests")
class NullabilityResolverTest {

    record Address(@JsonProperty("street") String street) {
    }

    record Profile(@JsonProperty("nickname") @Nullable String nickname,
                   @JsonProperty("alias") @JsonInclude(JsonInclude.Include.NON_NULL) @Nullable String alias,
                   @JsonProperty("emails") @SchemaKeywords(nullable = Nullability.NOT_NULL) List<String> emails,
                   @JsonProperty("age") @SchemaKeywords(nullable = Nullability.NULLABLE) int age,
                   @JsonProperty("address") @Nullable Address address,
                   @JsonProperty("plain") Address plain,
                   @JsonProperty("forced") @SchemaKeywords(nullable = Nullability.NULLABLE) Address forced,
                   @JsonProperty("attributes") Map<String, String> attributes,
                   @JsonProperty("anything") @SchemaKeywords(nullable = Nullability.NULLABLE) Object anything,
                   @JsonProperty("count") int count) {
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
    @DisplayName("Default Policy")
    class DefaultPolicyTests {

        @Test
        @DisplayName("Should derive the null variant from declarations and overrides")
        void shouldDeriveNullVariant() throws Exception {
            // When
            final Schema schema = reflector.reflect(Profile.class);

            // Then
            assertJson(schema.getProperties().get("nickname").schema(), """
                    {"type": ["string", "null"]}
                    """);
            assertJson(schema.getProperties().get("alias").schema(), """
                    {"type": "string"}
                    """);
            assertJson(schema.getProperties().get("emails").schema(), """
                    {"items": {"type": "string"}, "type": "array"}
                    """);
            assertJson(schema.getProperties().get("age").schema(), """
                    {"type": ["integer", "null"]}
                    """);
            assertJson(schema.getProperties().get("address").schema(), """
                    {"$ref": "#/definitions/JsonschemaAddress"}
                    """);
            assertJson(schema.getProperties().get("plain").schema(), """
                    {"$ref": "#/definitions/JsonschemaAddress"}
                    """);
            assertJson(schema.getProperties().get("forced").schema(), """
                    {"anyOf": [{"type": "null"}, {"$ref": "#/definitions/JsonschemaAddress"}]}
                    """);
            assertJson(schema.getProperties().get("attributes").schema(), """
                    {"additionalProperties": {"type": "string"}, "type": ["object", "null"]}
                    """);
            assertJson(schema.getProperties().get("anything").schema(), "{}");
            assertJson(schema.getProperties().get("count").schema(), """
                    {"type": "integer"}
                    """);
        }

        @Test
        @DisplayName("Should never make a shared definition nullable")
        void shouldKeepDefinitionsUntouched() throws Exception {
            // When
            final Schema schema = reflector.reflect(Profile.class);

            // Then
            assertThat(schema.getDefinitions().get("JsonschemaAddress").schema().getType())
                    .containsExactly(SimpleType.OBJECT);
        }
    }

    @Nested
    @DisplayName("Envelope Policy")
    class EnvelopePolicyTests {

        @Test
        @DisplayName("Should envelop nullable references in anyOf")
        void shouldEnvelopNullableReferences() throws Exception {
            // When
            final Schema schema = reflector.reflect(Profile.class, ReflectOptions.envelopNullability());

            // Then
            assertJson(schema.getProperties().get("address").schema(), """
                    {"anyOf": [{"type": "null"}, {"$ref": "#/definitions/JsonschemaAddress"}]}
                    """);
            assertJson(schema.getProperties().get("plain").schema(), """
                    {"$ref": "#/definitions/JsonschemaAddress"}
                    """);
        }
    }

    @Nested
    @DisplayName("Direct Resolution")
    class DirectTests {

        private final NullabilityResolver resolver = new NullabilityResolver();

        private PropertyField field(final Class<?> type, final boolean nullable) {
            return new PropertyField("field", type, null, FieldTags.empty(),
                    nullable, false, null);
        }

        @Test
        @DisplayName("Should let an explicit override win over omit empty")
        void shouldLetOverrideWin() throws Exception {
            // Given
            final Schema property = new Schema().withType(SimpleType.STRING);

            // When
            resolver.apply(property, field(String.class, false), true, Boolean.TRUE, new ReflectContext());

            // Then
            assertThat(property.getType()).containsExactly(SimpleType.STRING, SimpleType.NULL);
        }

        @Test
        @DisplayName("Should leave omit empty pointers alone")
        void shouldLeaveOmitEmptyPointersAlone() throws Exception {
            // Given
            final Schema property = new Schema().withType(SimpleType.STRING);

            // When
            resolver.apply(property, field(String.class, true), true, null, new ReflectContext());

            // Then
            assertThat(property.getType()).containsExactly(SimpleType.STRING);
        }

        @Test
        @DisplayName("Should remove the null variant when forced not null")
        void shouldRemoveNullVariant() throws Exception {
            // Given
            final Schema property = new Schema().withType(SimpleType.ARRAY, SimpleType.NULL);

            // When
            resolver.apply(property, field(List.class, false), false, Boolean.FALSE, new ReflectContext());

            // Then
            assertThat(property.getType()).containsExactly(SimpleType.ARRAY);
        }

        @Test
        @DisplayName("Should make nullable scalar elements nullable but keep objects")
        void shouldApplyToElements() {
            // Given
            final Schema scalar = new Schema().withType(SimpleType.INTEGER);
            final Schema object = new Schema().withType(SimpleType.OBJECT);
            final Schema reference = new Schema().withRef("#/definitions/Any");

            // When
            resolver.applyToElement(scalar, true);
            resolver.applyToElement(object, true);
            resolver.applyToElement(reference, true);

            // Then
            assertThat(scalar.getType()).containsExactly(SimpleType.INTEGER, SimpleType.NULL);
            assertThat(object.getType()).containsExactly(SimpleType.OBJECT);
            assertThat(reference.getType()).isNull();
        }
    }
}
