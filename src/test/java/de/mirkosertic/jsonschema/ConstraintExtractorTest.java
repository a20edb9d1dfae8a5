package de.mirkosertic.jsonschema;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.jsonschema.annotation.SchemaKeywords;
import de.mirkosertic.jsonschema.model.Schema;
import de.mirkosertic.jsonschema.model.SchemaMapper;
import de.mirkosertic.jsonschema.model.SimpleType;
import de.mirkosertic.jsonschema.util.FieldTags;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for keyword extraction from field and type metadata.
 */
@DisplayName("ConstraintExtractor Tests")
class ConstraintExtractorTest {

    enum Level {
        LOW,
        HIGH
    }

    record Product(
            @JsonProperty("sku") @SchemaKeywords(pattern = "^[A-Z]+$", minLength = "3", maxLength = "12") String sku,
            @JsonProperty("price") @SchemaKeywords(minimum = "0", exclusiveMaximum = "1000", multipleOf = "0.5",
                    defaultValue = "9.5") double price,
            @JsonProperty("quantity") @SchemaKeywords(maximum = "100", example = "5") int quantity,
            @JsonProperty("size") @SchemaKeywords(enumValues = "S, M, L") String size,
            @JsonProperty("legacy") @SchemaKeywords(deprecated = true, readOnly = true) boolean legacy,
            @JsonProperty("tags") @SchemaKeywords(minItems = "1", uniqueItems = true, defaultValue = "[a,b]")
            List<String> tags,
            @JsonProperty("color") @SchemaKeywords(enumValues = "[\"red\", \"green\"]", constValue = "red") String color) {
    }

    record Signal(@JsonProperty("level") @SchemaKeywords(defaultValue = "HIGH") Level level,
                  @JsonProperty("retries") @SchemaKeywords(examples = "[1, 2]") int retries,
                  @JsonProperty("enabled") @SchemaKeywords(defaultValue = "t") boolean enabled) {
    }

    record Fraction(@JsonProperty("ratio") @SchemaKeywords(defaultValue = ".5", example = "1.") double ratio,
                    @JsonProperty("offset") @SchemaKeywords(constValue = "+1") int offset,
                    @JsonProperty("labels") @SchemaKeywords(defaultValue = "[a, b]") List<String> labels) {
    }

    record BrokenBound(@JsonProperty("amount") @SchemaKeywords(minimum = "abc") int amount) {
    }

    record BrokenDefault(@JsonProperty("count") @SchemaKeywords(defaultValue = "{broken") int count) {
    }

    private Reflector reflector;
    private ConstraintExtractor extractor;

    @BeforeEach
    void setUp() {
        reflector = new Reflector();
        extractor = new ConstraintExtractor();
    }

    private static void assertJson(final Schema schema, final String expected) throws Exception {
        final ObjectMapper mapper = SchemaMapper.objectMapper();
        assertThat(mapper.readTree(SchemaMapper.toJson(schema)))
                .as("Reflected schema %s", SchemaMapper.toJson(schema))
                .isEqualTo(mapper.readTree(expected));
    }

    @Nested
    @DisplayName("Property Keywords")
    class PropertyKeywordTests {

        @Test
        @DisplayName("Should apply bounds, patterns, enumerations and literals")
        void shouldApplyPropertyKeywords() throws Exception {
            // When
            final Schema schema = reflector.reflect(Product.class);

            // Then
            assertJson(schema, """
                    {
                      "properties": {
                        "sku": {"maxLength": 12, "minLength": 3, "pattern": "^[A-Z]+$", "type": "string"},
                        "price": {
                          "default": 9.5, "multipleOf": 0.5, "exclusiveMaximum": 1000, "minimum": 0,
                          "type": "number"
                        },
                        "quantity": {"examples": [5], "maximum": 100, "type": "integer"},
                        "size": {"enum": ["S", "M", "L"], "type": "string"},
                        "legacy": {"readOnly": true, "type": "boolean", "deprecated": true},
                        "tags": {
                          "default": ["a", "b"], "items": {"type": "string"}, "minItems": 1, "uniqueItems": true,
                          "type": ["array", "null"]
                        },
                        "color": {"const": "red", "enum": ["red", "green"], "type": "string"}
                      },
                      "type": "object"
                    }
                    """);
        }

        @Test
        @DisplayName("Should type literals of references by their definition")
        void shouldTypeLiteralsByDefinition() throws Exception {
            // When
            final Schema schema = reflector.reflect(Signal.class);

            // Then
            assertJson(schema, """
                    {
                      "definitions": {
                        "JsonschemaLevel": {"enum": ["LOW", "HIGH"], "type": "string"}
                      },
                      "properties": {
                        "level": {"$ref": "#/definitions/JsonschemaLevel", "default": "HIGH"},
                        "retries": {"examples": [1, 2], "type": "integer"},
                        "enabled": {"default": true, "type": "boolean"}
                      },
                      "type": "object"
                    }
                    """);
        }

        @Test
        @DisplayName("Should accept number literals without leading digit or with sign")
        void shouldDecodeLenientNumbers() throws Exception {
            // When
            final Schema schema = reflector.reflect(Fraction.class);

            // Then
            assertJson(schema, """
                    {
                      "properties": {
                        "ratio": {"default": 0.5, "examples": [1], "type": "number"},
                        "offset": {"const": 1, "type": "integer"},
                        "labels": {"default": ["a", " b"], "items": {"type": "string"}, "type": ["array", "null"]}
                      },
                      "type": "object"
                    }
                    """);
        }

        @Test
        @DisplayName("Should skip defaults and examples when only constraints are wanted")
        void shouldSkipNonConstraints() throws Exception {
            // When
            final Schema schema = reflector.reflect(Signal.class, ReflectOptions.skipNonConstraints());

            // Then
            assertThat(schema.getProperties().get("level").schema().getDefault()).isNull();
            assertThat(schema.getProperties().get("retries").schema().getExamples()).isNull();
            assertThat(schema.getProperties().get("enabled").schema().getDefault()).isNull();
        }
    }

    @Nested
    @DisplayName("Malformed Keywords")
    class MalformedKeywordTests {

        @Test
        @DisplayName("Should report the path and keyword of a malformed bound")
        void shouldReportMalformedBound() {
            assertThatThrownBy(() -> reflector.reflect(BrokenBound.class))
                    .isInstanceOfSatisfying(TagParseException.class, e -> {
                        assertThat(e.getPath()).isEqualTo("amount");
                        assertThat(e.getKeyword()).isEqualTo("minimum");
                        assertThat(e.getValue()).isEqualTo("abc");
                    });
        }

        @Test
        @DisplayName("Should report a malformed default literal")
        void shouldReportMalformedDefault() {
            assertThatThrownBy(() -> reflector.reflect(BrokenDefault.class))
                    .isInstanceOf(TagParseException.class)
                    .hasMessageStartingWith("count: parsing default value '{broken' failed");
        }

        @Test
        @DisplayName("Should reject examples that are not a JSON array")
        void shouldRejectNonArrayExamples() {
            // Given
            final ReflectContext context = new ReflectContext();
            final FieldTags tags = FieldTags.builder().keyword("examples", "42").build();

            // When / Then
            assertThatThrownBy(() -> extractor.applyToProperty(new Schema().withType(SimpleType.INTEGER), tags, context))
                    .isInstanceOf(TagParseException.class)
                    .hasMessageContaining("not a JSON array");
        }
    }

    @Nested
    @DisplayName("Direct Population")
    class PopulateTests {

        @Test
        @DisplayName("Should clear keywords set to '-'")
        void shouldClearDashKeywords() throws Exception {
            // Given
            final Schema schema = new Schema().withTitle("Inherited").withDescription("Kept");
            final FieldTags tags = FieldTags.builder().keyword("title", "-").keyword("format", "email").build();

            // When
            extractor.populate(schema, tags, "field");

            // Then
            assertThat(schema.getTitle()).isNull();
            assertThat(schema.getDescription()).isEqualTo("Kept");
            assertThat(schema.getFormat()).isEqualTo("email");
        }

        @Test
        @DisplayName("Should parse numeric bounds as decimals")
        void shouldParseBoundsAsDecimals() throws Exception {
            // Given
            final Schema schema = new Schema().withType(SimpleType.NUMBER);
            final FieldTags tags = FieldTags.builder().keyword("minimum", "-1.25").keyword("maxProperties", "4").build();

            // When
            extractor.populate(schema, tags, "field");

            // Then
            assertThat(schema.getMinimum()).isEqualByComparingTo(new BigDecimal("-1.25"));
            assertThat(schema.getMaxProperties()).isEqualTo(4L);
        }

        @Test
        @DisplayName("Should split comma separated enumerations and trim items")
        void shouldSplitCommaSeparatedEnum() throws Exception {
            // Given
            final Schema schema = new Schema().withType(SimpleType.STRING);
            final FieldTags tags = FieldTags.builder().keyword("enum", " a , b,c ").build();

            // When
            extractor.applyToProperty(schema, tags, new ReflectContext());

            // Then
            assertThat(schema.getEnum()).containsExactly("a", "b", "c");
        }
    }

    @Nested
    @DisplayName("Boolean Values")
    class BooleanTests {

        @ParameterizedTest
        @ValueSource(strings = {"1", "t", "T", "true", "TRUE", "True"})
        @DisplayName("Should accept true spellings")
        void shouldAcceptTrueSpellings(final String value) throws Exception {
            final FieldTags tags = FieldTags.builder().keyword("required", value).build();
            assertThat(ConstraintExtractor.readBool(tags, "required", "field")).isTrue();
        }

        @ParameterizedTest
        @ValueSource(strings = {"0", "f", "F", "false", "FALSE", "False"})
        @DisplayName("Should accept false spellings")
        void shouldAcceptFalseSpellings(final String value) throws Exception {
            final FieldTags tags = FieldTags.builder().keyword("required", value).build();
            assertThat(ConstraintExtractor.readOptionalBool(tags, "required", "field")).isFalse();
        }

        @Test
        @DisplayName("Should return null for absent flags")
        void shouldReturnNullForAbsentFlags() throws Exception {
            assertThat(ConstraintExtractor.readOptionalBool(FieldTags.empty(), "required", "field")).isNull();
            assertThat(ConstraintExtractor.readBool(FieldTags.empty(), "required", "field")).isFalse();
        }

        @Test
        @DisplayName("Should reject other spellings")
        void shouldRejectOtherSpellings() {
            final FieldTags tags = FieldTags.builder().keyword("required", "yes").build();
            assertThatThrownBy(() -> ConstraintExtractor.readBool(tags, "required", "field"))
                    .isInstanceOfSatisfying(TagParseException.class,
                            e -> assertThat(e.getKeyword()).isEqualTo("required"));
        }
    }
}
