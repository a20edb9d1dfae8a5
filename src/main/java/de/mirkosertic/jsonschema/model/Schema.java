package de.mirkosertic.jsonschema.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import de.mirkosertic.jsonschema.capability.Exposer;
import de.mirkosertic.jsonschema.capability.IgnoreTypeName;
import org.jspecify.annotations.Nullable;

import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Mutable JSON Schema (draft-07) node.
 *
 * <p>Serialization is driven by the fields, unset keywords are omitted. The {@code type} keyword is
 * written as a single string when it holds one kind and as an array otherwise. Keywords without a
 * dedicated field (for example {@code x-enum-names} or {@code deprecated}) live in the extra
 * properties.</p>
 *
 * <p>A {@code Schema} can be used as a type mapping target: as an {@link Exposer} it provides a copy of
 * itself, and as {@link IgnoreTypeName} it keeps the definition name of the mapped type.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility = JsonAutoDetect.Visibility.NONE)
@JsonPropertyOrder({"$schema", "$id", "$ref", "$comment", "title", "description", "default", "const",
        "readOnly", "writeOnly", "examples", "multipleOf", "maximum", "exclusiveMaximum", "minimum",
        "exclusiveMinimum", "maxLength", "minLength", "pattern", "items", "maxItems", "minItems",
        "uniqueItems", "maxProperties", "minProperties", "required", "additionalProperties", "definitions",
        "properties", "patternProperties", "enum", "type", "format", "contentMediaType", "contentEncoding",
        "if", "then", "else", "allOf", "anyOf", "oneOf", "not"})
public class Schema implements Exposer, IgnoreTypeName {

    @JsonProperty("$schema")
    private @Nullable String schemaUri;
    @JsonProperty("$id")
    private @Nullable String id;
    @JsonProperty("$ref")
    private @Nullable String ref;
    @JsonProperty("$comment")
    private @Nullable String comment;
    private @Nullable String title;
    private @Nullable String description;
    @JsonProperty("default")
    private @Nullable Object defaultValue;
    @JsonProperty("const")
    private @Nullable Object constValue;
    private @Nullable Boolean readOnly;
    private @Nullable Boolean writeOnly;
    private @Nullable List<Object> examples;
    private @Nullable BigDecimal multipleOf;
    private @Nullable BigDecimal maximum;
    private @Nullable BigDecimal exclusiveMaximum;
    private @Nullable BigDecimal minimum;
    private @Nullable BigDecimal exclusiveMinimum;
    private @Nullable Long maxLength;
    private @Nullable Long minLength;
    private @Nullable String pattern;
    private @Nullable SchemaOrBool items;
    private @Nullable Long maxItems;
    private @Nullable Long minItems;
    private @Nullable Boolean uniqueItems;
    private @Nullable Long maxProperties;
    private @Nullable Long minProperties;
    private @Nullable List<String> required;
    private @Nullable SchemaOrBool additionalProperties;
    private @Nullable Map<String, SchemaOrBool> definitions;
    private @Nullable Map<String, SchemaOrBool> properties;
    private @Nullable Map<String, SchemaOrBool> patternProperties;
    @JsonProperty("enum")
    private @Nullable List<Object> enumValues;
    @JsonFormat(with = {JsonFormat.Feature.WRITE_SINGLE_ELEM_ARRAYS_UNWRAPPED,
            JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY})
    private @Nullable List<SimpleType> type;
    private @Nullable String format;
    private @Nullable String contentMediaType;
    private @Nullable String contentEncoding;
    @JsonProperty("if")
    private @Nullable SchemaOrBool ifSchema;
    @JsonProperty("then")
    private @Nullable SchemaOrBool thenSchema;
    @JsonProperty("else")
    private @Nullable SchemaOrBool elseSchema;
    private @Nullable List<SchemaOrBool> allOf;
    private @Nullable List<SchemaOrBool> anyOf;
    private @Nullable List<SchemaOrBool> oneOf;
    private @Nullable SchemaOrBool not;

    @JsonIgnore
    private final Map<String, Object> extra = new LinkedHashMap<>();
    @JsonIgnore
    private @Nullable Schema parent;
    @JsonIgnore
    private @Nullable Type reflectType;

    public Schema() {
    }

    // ---- type keyword ----

    public @Nullable List<SimpleType> getType() {
        return type;
    }

    public Schema withType(final SimpleType... types) {
        this.type = types.length == 0 ? null : new ArrayList<>(List.of(types));
        return this;
    }

    public Schema withTypes(@Nullable final Collection<SimpleType> types) {
        this.type = types == null || types.isEmpty() ? null : new ArrayList<>(types);
        return this;
    }

    /**
     * Adds a type to the {@code type} keyword, keeping {@code null} as the last entry.
     */
    public Schema addType(final SimpleType simpleType) {
        if (type == null) {
            type = new ArrayList<>();
        }
        if (type.contains(simpleType)) {
            return this;
        }
        if (simpleType != SimpleType.NULL && type.contains(SimpleType.NULL)) {
            type.add(type.indexOf(SimpleType.NULL), simpleType);
        } else {
            type.add(simpleType);
        }
        return this;
    }

    public Schema removeType(final SimpleType simpleType) {
        if (type != null) {
            type.remove(simpleType);
            if (type.isEmpty()) {
                type = null;
            }
        }
        return this;
    }

    public boolean hasType(final SimpleType simpleType) {
        return type != null && type.contains(simpleType);
    }

    // ---- annotations ----

    public @Nullable String getSchemaUri() {
        return schemaUri;
    }

    public Schema withSchemaUri(@Nullable final String schemaUri) {
        this.schemaUri = schemaUri;
        return this;
    }

    public @Nullable String getId() {
        return id;
    }

    public Schema withId(@Nullable final String id) {
        this.id = id;
        return this;
    }

    public @Nullable String getRef() {
        return ref;
    }

    public Schema withRef(@Nullable final String ref) {
        this.ref = ref;
        return this;
    }

    public @Nullable String getComment() {
        return comment;
    }

    public Schema withComment(@Nullable final String comment) {
        this.comment = comment;
        return this;
    }

    public @Nullable String getTitle() {
        return title;
    }

    public Schema withTitle(@Nullable final String title) {
        this.title = title;
        return this;
    }

    public @Nullable String getDescription() {
        return description;
    }

    public Schema withDescription(@Nullable final String description) {
        this.description = description;
        return this;
    }

    public @Nullable Object getDefault() {
        return defaultValue;
    }

    public Schema withDefault(@Nullable final Object defaultValue) {
        this.defaultValue = defaultValue;
        return this;
    }

    public @Nullable Object getConst() {
        return constValue;
    }

    public Schema withConst(@Nullable final Object constValue) {
        this.constValue = constValue;
        return this;
    }

    public @Nullable Boolean getReadOnly() {
        return readOnly;
    }

    public Schema withReadOnly(@Nullable final Boolean readOnly) {
        this.readOnly = readOnly;
        return this;
    }

    public @Nullable Boolean getWriteOnly() {
        return writeOnly;
    }

    public Schema withWriteOnly(@Nullable final Boolean writeOnly) {
        this.writeOnly = writeOnly;
        return this;
    }

    public @Nullable List<Object> getExamples() {
        return examples;
    }

    public Schema withExamples(@Nullable final List<Object> examples) {
        this.examples = examples == null ? null : new ArrayList<>(examples);
        return this;
    }

    public Schema addExample(@Nullable final Object example) {
        if (examples == null) {
            examples = new ArrayList<>();
        }
        examples.add(example);
        return this;
    }

    // ---- numeric constraints ----

    public @Nullable BigDecimal getMultipleOf() {
        return multipleOf;
    }

    public Schema withMultipleOf(@Nullable final BigDecimal multipleOf) {
        this.multipleOf = multipleOf;
        return this;
    }

    public @Nullable BigDecimal getMaximum() {
        return maximum;
    }

    public Schema withMaximum(@Nullable final BigDecimal maximum) {
        this.maximum = maximum;
        return this;
    }

    public @Nullable BigDecimal getExclusiveMaximum() {
        return exclusiveMaximum;
    }

    public Schema withExclusiveMaximum(@Nullable final BigDecimal exclusiveMaximum) {
        this.exclusiveMaximum = exclusiveMaximum;
        return this;
    }

    public @Nullable BigDecimal getMinimum() {
        return minimum;
    }

    public Schema withMinimum(@Nullable final BigDecimal minimum) {
        this.minimum = minimum;
        return this;
    }

    public @Nullable BigDecimal getExclusiveMinimum() {
        return exclusiveMinimum;
    }

    public Schema withExclusiveMinimum(@Nullable final BigDecimal exclusiveMinimum) {
        this.exclusiveMinimum = exclusiveMinimum;
        return this;
    }

    // ---- string constraints ----

    public @Nullable Long getMaxLength() {
        return maxLength;
    }

    public Schema withMaxLength(@Nullable final Long maxLength) {
        this.maxLength = maxLength;
        return this;
    }

    public @Nullable Long getMinLength() {
        return minLength;
    }

    public Schema withMinLength(@Nullable final Long minLength) {
        this.minLength = minLength;
        return this;
    }

    public @Nullable String getPattern() {
        return pattern;
    }

    public Schema withPattern(@Nullable final String pattern) {
        this.pattern = pattern;
        return this;
    }

    public @Nullable String getFormat() {
        return format;
    }

    public Schema withFormat(@Nullable final String format) {
        this.format = format;
        return this;
    }

    public @Nullable String getContentMediaType() {
        return contentMediaType;
    }

    public Schema withContentMediaType(@Nullable final String contentMediaType) {
        this.contentMediaType = contentMediaType;
        return this;
    }

    public @Nullable String getContentEncoding() {
        return contentEncoding;
    }

    public Schema withContentEncoding(@Nullable final String contentEncoding) {
        this.contentEncoding = contentEncoding;
        return this;
    }

    // ---- array constraints ----

    public @Nullable SchemaOrBool getItems() {
        return items;
    }

    public Schema withItems(@Nullable final SchemaOrBool items) {
        this.items = items;
        return this;
    }

    public @Nullable Long getMaxItems() {
        return maxItems;
    }

    public Schema withMaxItems(@Nullable final Long maxItems) {
        this.maxItems = maxItems;
        return this;
    }

    public @Nullable Long getMinItems() {
        return minItems;
    }

    public Schema withMinItems(@Nullable final Long minItems) {
        this.minItems = minItems;
        return this;
    }

    public @Nullable Boolean getUniqueItems() {
        return uniqueItems;
    }

    public Schema withUniqueItems(@Nullable final Boolean uniqueItems) {
        this.uniqueItems = uniqueItems;
        return this;
    }

    // ---- object constraints ----

    public @Nullable Long getMaxProperties() {
        return maxProperties;
    }

    public Schema withMaxProperties(@Nullable final Long maxProperties) {
        this.maxProperties = maxProperties;
        return this;
    }

    public @Nullable Long getMinProperties() {
        return minProperties;
    }

    public Schema withMinProperties(@Nullable final Long minProperties) {
        this.minProperties = minProperties;
        return this;
    }

    public @Nullable List<String> getRequired() {
        return required;
    }

    public Schema withRequired(final String... names) {
        this.required = names.length == 0 ? null : new ArrayList<>(List.of(names));
        return this;
    }

    public Schema addRequired(final String name) {
        if (required == null) {
            required = new ArrayList<>();
        }
        if (!required.contains(name)) {
            required.add(name);
        }
        return this;
    }

    public @Nullable SchemaOrBool getAdditionalProperties() {
        return additionalProperties;
    }

    public Schema withAdditionalProperties(@Nullable final SchemaOrBool additionalProperties) {
        this.additionalProperties = additionalProperties;
        return this;
    }

    public @Nullable Map<String, SchemaOrBool> getDefinitions() {
        return definitions;
    }

    public Schema withDefinitions(@Nullable final Map<String, SchemaOrBool> definitions) {
        this.definitions = definitions == null ? null : new TreeMap<>(definitions);
        return this;
    }

    public @Nullable Map<String, SchemaOrBool> getProperties() {
        return properties;
    }

    public Schema withProperties(@Nullable final Map<String, SchemaOrBool> properties) {
        this.properties = properties == null ? null : new LinkedHashMap<>(properties);
        return this;
    }

    public Schema withProperty(final String name, final SchemaOrBool schema) {
        if (properties == null) {
            properties = new LinkedHashMap<>();
        }
        properties.put(name, schema);
        return this;
    }

    public @Nullable Map<String, SchemaOrBool> getPatternProperties() {
        return patternProperties;
    }

    public Schema withPatternProperties(@Nullable final Map<String, SchemaOrBool> patternProperties) {
        this.patternProperties = patternProperties == null ? null : new LinkedHashMap<>(patternProperties);
        return this;
    }

    public @Nullable List<Object> getEnum() {
        return enumValues;
    }

    public Schema withEnum(@Nullable final List<?> values) {
        this.enumValues = values == null ? null : new ArrayList<>(values);
        return this;
    }

    // ---- composition ----

    public @Nullable SchemaOrBool getIf() {
        return ifSchema;
    }

    public Schema withIf(@Nullable final SchemaOrBool ifSchema) {
        this.ifSchema = ifSchema;
        return this;
    }

    public @Nullable SchemaOrBool getThen() {
        return thenSchema;
    }

    public Schema withThen(@Nullable final SchemaOrBool thenSchema) {
        this.thenSchema = thenSchema;
        return this;
    }

    public @Nullable SchemaOrBool getElse() {
        return elseSchema;
    }

    public Schema withElse(@Nullable final SchemaOrBool elseSchema) {
        this.elseSchema = elseSchema;
        return this;
    }

    public @Nullable List<SchemaOrBool> getAllOf() {
        return allOf;
    }

    public Schema withAllOf(@Nullable final List<SchemaOrBool> allOf) {
        this.allOf = allOf == null ? null : new ArrayList<>(allOf);
        return this;
    }

    public Schema addAllOf(final SchemaOrBool schema) {
        if (allOf == null) {
            allOf = new ArrayList<>();
        }
        allOf.add(schema);
        return this;
    }

    public @Nullable List<SchemaOrBool> getAnyOf() {
        return anyOf;
    }

    public Schema withAnyOf(@Nullable final List<SchemaOrBool> anyOf) {
        this.anyOf = anyOf == null ? null : new ArrayList<>(anyOf);
        return this;
    }

    public @Nullable List<SchemaOrBool> getOneOf() {
        return oneOf;
    }

    public Schema withOneOf(@Nullable final List<SchemaOrBool> oneOf) {
        this.oneOf = oneOf == null ? null : new ArrayList<>(oneOf);
        return this;
    }

    public @Nullable SchemaOrBool getNot() {
        return not;
    }

    public Schema withNot(@Nullable final SchemaOrBool not) {
        this.not = not;
        return this;
    }

    // ---- extra properties and reflection metadata ----

    @JsonAnyGetter
    public Map<String, Object> getExtraProperties() {
        return extra;
    }

    public Schema withExtraProperty(final String name, @Nullable final Object value) {
        if (value == null) {
            extra.remove(name);
        } else {
            extra.put(name, value);
        }
        return this;
    }

    @JsonAnySetter
    void setExtraProperty(final String name, @Nullable final Object value) {
        withExtraProperty(name, value);
    }

    /**
     * Schema that contains this node during reflection, {@code null} for the root.
     */
    public @Nullable Schema getParent() {
        return parent;
    }

    public Schema withParent(@Nullable final Schema parent) {
        this.parent = parent;
        return this;
    }

    /**
     * Java type this node was reflected from.
     */
    public @Nullable Type getReflectType() {
        return reflectType;
    }

    public Schema withReflectType(@Nullable final Type reflectType) {
        this.reflectType = reflectType;
        return this;
    }

    // ---- helpers ----

    public SchemaOrBool toSchemaOrBool() {
        return SchemaOrBool.of(this);
    }

    /**
     * Tells whether the schema carries no validation constraint besides a single (optionally
     * nullable) type. Annotations such as title, description, default or examples are ignored.
     */
    public boolean isTrivial() {
        if (type != null) {
            final long nonNull = type.stream().filter(t -> t != SimpleType.NULL).count();
            if (nonNull > 1) {
                return false;
            }
        }
        if (ref != null || constValue != null || enumValues != null || not != null
                || allOf != null || anyOf != null || oneOf != null
                || ifSchema != null || thenSchema != null || elseSchema != null) {
            return false;
        }
        if (multipleOf != null || maximum != null || exclusiveMaximum != null || minimum != null
                || exclusiveMinimum != null) {
            return false;
        }
        if (maxLength != null || minLength != null || pattern != null || format != null) {
            return false;
        }
        if (maxItems != null || minItems != null || Boolean.TRUE.equals(uniqueItems)) {
            return false;
        }
        if (maxProperties != null || minProperties != null || patternProperties != null
                || (required != null && !required.isEmpty())) {
            return false;
        }
        return isTrivial(items) && isTrivial(additionalProperties)
                && (properties == null || properties.values().stream().allMatch(Schema::isTrivial));
    }

    private static boolean isTrivial(@Nullable final SchemaOrBool value) {
        if (value == null) {
            return true;
        }
        final Schema nested = value.schema();
        return nested != null ? nested.isTrivial() : Boolean.TRUE.equals(value.bool());
    }

    /**
     * Shallow copy: collections are duplicated, nested schemas are shared.
     */
    public Schema copy() {
        return new Schema().copyFrom(this);
    }

    /**
     * Replaces all keywords of this schema with the keywords of the given one. Parent and reflected
     * type are kept.
     */
    public Schema copyFrom(final Schema other) {
        schemaUri = other.schemaUri;
        id = other.id;
        ref = other.ref;
        comment = other.comment;
        title = other.title;
        description = other.description;
        defaultValue = other.defaultValue;
        constValue = other.constValue;
        readOnly = other.readOnly;
        writeOnly = other.writeOnly;
        examples = other.examples == null ? null : new ArrayList<>(other.examples);
        multipleOf = other.multipleOf;
        maximum = other.maximum;
        exclusiveMaximum = other.exclusiveMaximum;
        minimum = other.minimum;
        exclusiveMinimum = other.exclusiveMinimum;
        maxLength = other.maxLength;
        minLength = other.minLength;
        pattern = other.pattern;
        items = other.items;
        maxItems = other.maxItems;
        minItems = other.minItems;
        uniqueItems = other.uniqueItems;
        maxProperties = other.maxProperties;
        minProperties = other.minProperties;
        required = other.required == null ? null : new ArrayList<>(other.required);
        additionalProperties = other.additionalProperties;
        definitions = other.definitions == null ? null : new TreeMap<>(other.definitions);
        properties = other.properties == null ? null : new LinkedHashMap<>(other.properties);
        patternProperties = other.patternProperties == null ? null : new LinkedHashMap<>(other.patternProperties);
        enumValues = other.enumValues == null ? null : new ArrayList<>(other.enumValues);
        type = other.type == null ? null : new ArrayList<>(other.type);
        format = other.format;
        contentMediaType = other.contentMediaType;
        contentEncoding = other.contentEncoding;
        ifSchema = other.ifSchema;
        thenSchema = other.thenSchema;
        elseSchema = other.elseSchema;
        allOf = other.allOf == null ? null : new ArrayList<>(other.allOf);
        anyOf = other.anyOf == null ? null : new ArrayList<>(other.anyOf);
        oneOf = other.oneOf == null ? null : new ArrayList<>(other.oneOf);
        not = other.not;
        extra.clear();
        extra.putAll(other.extra);
        return this;
    }

    @Override
    public Schema jsonSchema() {
        return copy();
    }

    @Override
    public String toString() {
        return SchemaMapper.toJson(this);
    }
}
