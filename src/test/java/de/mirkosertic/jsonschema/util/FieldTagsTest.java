package de.mirkosertic.jsonschema.util;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import de.mirkosertic.jsonschema.annotation.Description;
import de.mirkosertic.jsonschema.annotation.Nullability;
import de.mirkosertic.jsonschema.annotation.PropertyName;
import de.mirkosertic.jsonschema.annotation.SchemaKeywords;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FieldTags Tests")
class FieldTagsTest {

    @Description("Annotated sample")
    @SchemaKeywords(title = "Sample", additionalProperties = "false")
    static class Annotated {

        @JsonProperty(value = "id", required = true)
        String id;

        @JsonProperty("tags")
        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        List<String> tags;

        @JsonIgnore
        String secret;

        @JsonInclude(JsonInclude.Include.NON_NULL)
        String note;

        @PropertyName(tag = "query", value = "q")
        @PropertyName(tag = "xml", value = "n", omitEmpty = true)
        String name;

        @Description("Counter")
        @SchemaKeywords(minimum = "1", uniqueItems = true, nullable = Nullability.NOT_NULL)
        int count;

        @SchemaKeywords(description = "Overrides", nullable = Nullability.NULLABLE)
        @Description("Ignored")
        String described;

        String plain;
    }

    private static FieldTags tagsOf(final String field) throws Exception {
        return FieldTags.of(Annotated.class.getDeclaredField(field));
    }

    @Nested
    @DisplayName("Names")
    class NameTests {

        @Test
        @DisplayName("Should read Jackson property names as the json tag")
        void shouldReadJacksonNames() throws Exception {
            final FieldTags tags = tagsOf("id");

            assertThat(tags.name(FieldTags.JSON_TAG)).isEqualTo(new FieldTags.NameTag("id", false));
            assertThat(tags.keyword("required")).isEqualTo("true");
        }

        @Test
        @DisplayName("Should derive omit empty from Jackson inclusion")
        void shouldDeriveOmitEmpty() throws Exception {
            assertThat(tagsOf("tags").name(FieldTags.JSON_TAG)).isEqualTo(new FieldTags.NameTag("tags", true));
            assertThat(tagsOf("note").name(FieldTags.JSON_TAG))
                    .as("Inclusion without a property name keeps the declared name")
                    .isEqualTo(new FieldTags.NameTag("", true));
        }

        @Test
        @DisplayName("Should exclude ignored fields")
        void shouldExcludeIgnoredFields() throws Exception {
            assertThat(tagsOf("secret").name(FieldTags.JSON_TAG).name()).isEqualTo("-");
        }

        @Test
        @DisplayName("Should read names under custom tags")
        void shouldReadCustomTags() throws Exception {
            final FieldTags tags = tagsOf("name");

            assertThat(tags.name("query")).isEqualTo(new FieldTags.NameTag("q", false));
            assertThat(tags.name("xml")).isEqualTo(new FieldTags.NameTag("n", true));
            assertThat(tags.name(FieldTags.JSON_TAG)).isNull();
        }

        @Test
        @DisplayName("Should return the shared empty instance for plain fields")
        void shouldReturnEmptyForPlainFields() throws Exception {
            assertThat(tagsOf("plain")).isSameAs(FieldTags.empty());
            assertThat(tagsOf("plain").isEmpty()).isTrue();
        }
    }

    @Nested
    @DisplayName("Keywords")
    class KeywordTests {

        @Test
        @DisplayName("Should read schema keywords and descriptions")
        void shouldReadKeywords() throws Exception {
            final FieldTags tags = tagsOf("count");

            assertThat(tags.keyword("description")).isEqualTo("Counter");
            assertThat(tags.keyword("minimum")).isEqualTo("1");
            assertThat(tags.keyword("uniqueItems")).isEqualTo("true");
            assertThat(tags.keyword("nullable")).isEqualTo("false");
            assertThat(tags.keyword("maximum")).as("Unset keywords are absent").isNull();
        }

        @Test
        @DisplayName("Should prefer the keyword annotation over the description annotation")
        void shouldPreferKeywordDescription() throws Exception {
            final FieldTags tags = tagsOf("described");

            assertThat(tags.keyword("description")).isEqualTo("Overrides");
            assertThat(tags.keyword("nullable")).isEqualTo("true");
        }

        @Test
        @DisplayName("Should read type level keywords")
        void shouldReadTypeKeywords() {
            final FieldTags tags = FieldTags.of(Annotated.class);

            assertThat(tags.keyword("title")).isEqualTo("Sample");
            assertThat(tags.keyword("description")).isEqualTo("Annotated sample");
            assertThat(tags.keyword("additionalProperties")).isEqualTo("false");
        }
    }

    @Nested
    @DisplayName("Copies")
    class CopyTests {

        @Test
        @DisplayName("Should drop keywords but keep names")
        void shouldDropKeywords() {
            // Given
            final FieldTags tags = FieldTags.builder()
                    .name(FieldTags.JSON_TAG, "value")
                    .keyword("title", "Title")
                    .keyword("minimum", "0")
                    .build();

            // When
            final FieldTags remaining = tags.without("title");

            // Then
            assertThat(remaining.keyword("title")).isNull();
            assertThat(remaining.keyword("minimum")).isEqualTo("0");
            assertThat(remaining.name(FieldTags.JSON_TAG)).isEqualTo(new FieldTags.NameTag("value", false));
            assertThat(tags.keyword("title")).as("The original is unchanged").isEqualTo("Title");
        }

        @Test
        @DisplayName("Should select keywords without names")
        void shouldSelectKeywords() {
            // Given
            final FieldTags tags = FieldTags.builder()
                    .name(FieldTags.JSON_TAG, "value")
                    .keyword("title", "Title")
                    .keyword("minimum", "0")
                    .build();

            // When
            final FieldTags selected = tags.only("title", "description");

            // Then
            assertThat(selected.keyword("title")).isEqualTo("Title");
            assertThat(selected.keyword("minimum")).isNull();
            assertThat(selected.name(FieldTags.JSON_TAG)).isNull();
        }
    }
}
