package de.mirkosertic.jsonschema.util;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import de.mirkosertic.jsonschema.annotation.Description;
import de.mirkosertic.jsonschema.annotation.Nullability;
import de.mirkosertic.jsonschema.annotation.PropertyName;
import de.mirkosertic.jsonschema.annotation.SchemaKeywords;
import org.jspecify.annotations.Nullable;

import java.lang.reflect.AnnotatedElement;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Schema related metadata of a field or type: property names keyed by name tag and keyword values
 * keyed by keyword name.
 *
 * <p>Instances are read from annotations ({@link #of(AnnotatedElement...)}) or built explicitly for
 * virtual fields ({@link #builder()}).</p>
 */
public final class FieldTags {

    public static final String JSON_TAG = "json";

    private static final FieldTags EMPTY = new FieldTags(Map.of(), Map.of());

    private static final Set<JsonInclude.Include> OMIT_EMPTY_INCLUDES = Set.of(
            JsonInclude.Include.NON_NULL,
            JsonInclude.Include.NON_ABSENT,
            JsonInclude.Include.NON_EMPTY,
            JsonInclude.Include.NON_DEFAULT);

    /**
     * Property name under one name tag.
     *
     * @param name      property name, {@code "-"} to exclude, empty to keep the declared name
     * @param omitEmpty whether the property is left out of serialized documents when empty
     */
    public record NameTag(String name, boolean omitEmpty) {
    }

    private final Map<String, NameTag> names;
    private final Map<String, String> keywords;

    private FieldTags(final Map<String, NameTag> names, final Map<String, String> keywords) {
        this.names = Collections.unmodifiableMap(names);
        this.keywords = Collections.unmodifiableMap(keywords);
    }

    public static FieldTags empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads the tags of the given annotated elements. Later elements add to and override earlier ones,
     * so a record component and its backing field can be passed together.
     */
    public static FieldTags of(final AnnotatedElement... elements) {
        final Builder builder = new Builder();
        for (final AnnotatedElement element : elements) {
            readJackson(element, builder);

            for (final PropertyName propertyName : element.getAnnotationsByType(PropertyName.class)) {
                builder.name(propertyName.tag(), propertyName.value(), propertyName.omitEmpty());
            }

            final Description description = element.getAnnotation(Description.class);
            if (description != null) {
                builder.keyword("description", description.value());
            }

            final SchemaKeywords schemaKeywords = element.getAnnotation(SchemaKeywords.class);
            if (schemaKeywords != null) {
                readKeywords(schemaKeywords, builder);
            }
        }
        return builder.build();
    }

    private static void readJackson(final AnnotatedElement element, final Builder builder) {
        final JsonIgnore ignore = element.getAnnotation(JsonIgnore.class);
        if (ignore != null && ignore.value()) {
            builder.name(JSON_TAG, "-", false);
            return;
        }

        final JsonInclude include = element.getAnnotation(JsonInclude.class);
        final boolean omitEmpty = include != null && OMIT_EMPTY_INCLUDES.contains(include.value());

        final JsonProperty property = element.getAnnotation(JsonProperty.class);
        if (property != null) {
            builder.name(JSON_TAG, property.value(), omitEmpty);
            if (property.required()) {
                builder.keyword("required", "true");
            }
        } else if (omitEmpty) {
            builder.name(JSON_TAG, "", true);
        }
    }

    private static void readKeywords(final SchemaKeywords annotation, final Builder builder) {
        builder.keywordIfSet("title", annotation.title())
                .keywordIfSet("description", annotation.description())
                .keywordIfSet("$comment", annotation.comment())
                .keywordIfSet("format", annotation.format())
                .keywordIfSet("pattern", annotation.pattern())
                .keywordIfSet("contentMediaType", annotation.contentMediaType())
                .keywordIfSet("contentEncoding", annotation.contentEncoding())
                .keywordIfSet("multipleOf", annotation.multipleOf())
                .keywordIfSet("minimum", annotation.minimum())
                .keywordIfSet("maximum", annotation.maximum())
                .keywordIfSet("exclusiveMinimum", annotation.exclusiveMinimum())
                .keywordIfSet("exclusiveMaximum", annotation.exclusiveMaximum())
                .keywordIfSet("minLength", annotation.minLength())
                .keywordIfSet("maxLength", annotation.maxLength())
                .keywordIfSet("minItems", annotation.minItems())
                .keywordIfSet("maxItems", annotation.maxItems())
                .keywordIfSet("minProperties", annotation.minProperties())
                .keywordIfSet("maxProperties", annotation.maxProperties())
                .keywordIfSet("enum", annotation.enumValues())
                .keywordIfSet("default", annotation.defaultValue())
                .keywordIfSet("const", annotation.constValue())
                .keywordIfSet("example", annotation.example())
                .keywordIfSet("examples", annotation.examples())
                .keywordIfSet("additionalProperties", annotation.additionalProperties());
        if (annotation.uniqueItems()) {
            builder.keyword("uniqueItems", "true");
        }
        if (annotation.readOnly()) {
            builder.keyword("readOnly", "true");
        }
        if (annotation.writeOnly()) {
            builder.keyword("writeOnly", "true");
        }
        if (annotation.required()) {
            builder.keyword("required", "true");
        }
        if (annotation.deprecated()) {
            builder.keyword("deprecated", "true");
        }
        if (annotation.nullable() != Nullability.INHERIT) {
            builder.keyword("nullable", String.valueOf(annotation.nullable() == Nullability.NULLABLE));
        }
    }

    public @Nullable NameTag name(final String tag) {
        return names.get(tag);
    }

    public @Nullable String keyword(final String keyword) {
        return keywords.get(keyword);
    }

    /**
     * Copy without the given keywords.
     */
    public FieldTags without(final String... excluded) {
        final Map<String, String> remaining = new LinkedHashMap<>(keywords);
        for (final String keyword : excluded) {
            remaining.remove(keyword);
        }
        return new FieldTags(new LinkedHashMap<>(names), remaining);
    }

    /**
     * Copy with only the given keywords and no names.
     */
    public FieldTags only(final String... included) {
        final Map<String, String> selected = new LinkedHashMap<>();
        for (final String keyword : included) {
            final String value = keywords.get(keyword);
            if (value != null) {
                selected.put(keyword, value);
            }
        }
        return new FieldTags(new LinkedHashMap<>(), selected);
    }

    public boolean isEmpty() {
        return names.isEmpty() && keywords.isEmpty();
    }

    @Override
    public String toString() {
        return "FieldTags{names=" + names + ", keywords=" + keywords + "}";
    }

    public static final class Builder {

        private final Map<String, NameTag> names = new LinkedHashMap<>();
        private final Map<String, String> keywords = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder name(final String tag, final String name) {
            return name(tag, name, false);
        }

        public Builder name(final String tag, final String name, final boolean omitEmpty) {
            names.put(tag, new NameTag(name, omitEmpty));
            return this;
        }

        public Builder keyword(final String keyword, final String value) {
            keywords.put(keyword, value);
            return this;
        }

        Builder keywordIfSet(final String keyword, final String value) {
            if (!value.isEmpty()) {
                keywords.put(keyword, value);
            }
            return this;
        }

        public FieldTags build() {
            if (names.isEmpty() && keywords.isEmpty()) {
                return EMPTY;
            }
            return new FieldTags(new LinkedHashMap<>(names), new LinkedHashMap<>(keywords));
        }
    }
}
