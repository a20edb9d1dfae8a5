package de.mirkosertic.jsonschema;

import com.fasterxml.jackson.core.JsonProcessingException;
import de.mirkosertic.jsonschema.model.Schema;
import de.mirkosertic.jsonschema.model.SchemaMapper;
import de.mirkosertic.jsonschema.model.SchemaOrBool;
import de.mirkosertic.jsonschema.model.SimpleType;
import de.mirkosertic.jsonschema.util.FieldTags;
import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Applies keyword values from {@link FieldTags} to property and object schemas.
 *
 * <p>Literal keywords ({@code default}, {@code const}, {@code example}) are decoded according to the
 * type of the property: numbers, integers, booleans and strings are parsed as such, anything else is
 * decoded as JSON. Malformed values fail with {@link TagParseException}.</p>
 */
final class ConstraintExtractor {

    private static final Set<String> TRUE_VALUES = Set.of("1", "t", "T", "true", "TRUE", "True");
    private static final Set<String> FALSE_VALUES = Set.of("0", "f", "F", "false", "FALSE", "False");

    /**
     * Applies plain keywords: annotations, numeric and length bounds, pattern and format.
     */
    void populate(final Schema schema, final FieldTags tags, final String path) throws TagParseException {
        final String title = tags.keyword("title");
        if (title != null) {
            schema.withTitle(clearable(title));
        }
        final String description = tags.keyword("description");
        if (description != null) {
            schema.withDescription(clearable(description));
        }
        final String comment = tags.keyword("$comment");
        if (comment != null) {
            schema.withComment(clearable(comment));
        }
        final String format = tags.keyword("format");
        if (format != null) {
            schema.withFormat(clearable(format));
        }
        final String pattern = tags.keyword("pattern");
        if (pattern != null) {
            schema.withPattern(clearable(pattern));
        }
        final String contentMediaType = tags.keyword("contentMediaType");
        if (contentMediaType != null) {
            schema.withContentMediaType(clearable(contentMediaType));
        }
        final String contentEncoding = tags.keyword("contentEncoding");
        if (contentEncoding != null) {
            schema.withContentEncoding(clearable(contentEncoding));
        }

        final BigDecimal multipleOf = readNumber(tags, "multipleOf", path);
        if (multipleOf != null) {
            schema.withMultipleOf(multipleOf);
        }
        final BigDecimal minimum = readNumber(tags, "minimum", path);
        if (minimum != null) {
            schema.withMinimum(minimum);
        }
        final BigDecimal maximum = readNumber(tags, "maximum", path);
        if (maximum != null) {
            schema.withMaximum(maximum);
        }
        final BigDecimal exclusiveMinimum = readNumber(tags, "exclusiveMinimum", path);
        if (exclusiveMinimum != null) {
            schema.withExclusiveMinimum(exclusiveMinimum);
        }
        final BigDecimal exclusiveMaximum = readNumber(tags, "exclusiveMaximum", path);
        if (exclusiveMaximum != null) {
            schema.withExclusiveMaximum(exclusiveMaximum);
        }

        final Long minLength = readInteger(tags, "minLength", path);
        if (minLength != null) {
            schema.withMinLength(minLength);
        }
        final Long maxLength = readInteger(tags, "maxLength", path);
        if (maxLength != null) {
            schema.withMaxLength(maxLength);
        }
        final Long minItems = readInteger(tags, "minItems", path);
        if (minItems != null) {
            schema.withMinItems(minItems);
        }
        final Long maxItems = readInteger(tags, "maxItems", path);
        if (maxItems != null) {
            schema.withMaxItems(maxItems);
        }
        final Long minProperties = readInteger(tags, "minProperties", path);
        if (minProperties != null) {
            schema.withMinProperties(minProperties);
        }
        final Long maxProperties = readInteger(tags, "maxProperties", path);
        if (maxProperties != null) {
            schema.withMaxProperties(maxProperties);
        }

        final Boolean uniqueItems = readOptionalBool(tags, "uniqueItems", path);
        if (uniqueItems != null) {
            schema.withUniqueItems(uniqueItems);
        }
        final Boolean readOnly = readOptionalBool(tags, "readOnly", path);
        if (readOnly != null) {
            schema.withReadOnly(readOnly);
        }
        final Boolean writeOnly = readOptionalBool(tags, "writeOnly", path);
        if (writeOnly != null) {
            schema.withWriteOnly(writeOnly);
        }
    }

    /**
     * Applies all keywords of a field to its property schema.
     */
    void applyToProperty(final Schema property, final FieldTags tags, final ReflectContext context)
            throws TagParseException {
        final String path = context.dottedPath();

        if (!context.isSkipNonConstraints()) {
            final String defaultValue = tags.keyword("default");
            if (defaultValue != null) {
                property.withDefault(decodeLiteral(property, "default", defaultValue, context));
            }
        }
        final String constValue = tags.keyword("const");
        if (constValue != null) {
            property.withConst(decodeLiteral(property, "const", constValue, context));
        }

        populate(property, tags, path);

        if (readBool(tags, "deprecated", path)) {
            property.withExtraProperty("deprecated", true);
        }

        if (!context.isSkipNonConstraints()) {
            final String example = tags.keyword("example");
            if (example != null) {
                property.addExample(decodeLiteral(property, "example", example, context));
            }
            final String examples = tags.keyword("examples");
            if (examples != null) {
                for (final Object item : decodeArray("examples", examples, path)) {
                    property.addExample(item);
                }
            }
        }

        final String enumeration = tags.keyword("enum");
        if (enumeration != null) {
            property.withEnum(decodeEnum(enumeration));
        }
    }

    /**
     * Applies the keywords declared on a type to its object schema.
     */
    void applyToObject(final Schema object, final FieldTags tags, final ReflectContext context)
            throws TagParseException {
        final String path = context.dottedPath();
        populate(object, tags, path);

        final Boolean additionalProperties = readOptionalBool(tags, "additionalProperties", path);
        if (additionalProperties != null) {
            object.withAdditionalProperties(SchemaOrBool.of(additionalProperties));
        }

        if (!context.isSkipNonConstraints()) {
            final String examples = tags.keyword("examples");
            if (examples != null) {
                for (final Object item : decodeArray("examples", examples, path)) {
                    object.addExample(item);
                }
            }
        }
    }

    static boolean readBool(final FieldTags tags, final String keyword, final String path) throws TagParseException {
        return Boolean.TRUE.equals(readOptionalBool(tags, keyword, path));
    }

    static @Nullable Boolean readOptionalBool(final FieldTags tags, final String keyword, final String path)
            throws TagParseException {
        final String value = tags.keyword(keyword);
        if (value == null) {
            return null;
        }
        final Boolean parsed = parseBool(value);
        if (parsed == null) {
            throw new TagParseException(path, keyword, value, new IllegalArgumentException("not a boolean"));
        }
        return parsed;
    }

    private static @Nullable Boolean parseBool(final String value) {
        if (TRUE_VALUES.contains(value)) {
            return Boolean.TRUE;
        }
        if (FALSE_VALUES.contains(value)) {
            return Boolean.FALSE;
        }
        return null;
    }

    private static @Nullable String clearable(final String value) {
        return "-".equals(value) ? null : value;
    }

    private static @Nullable BigDecimal readNumber(final FieldTags tags, final String keyword, final String path)
            throws TagParseException {
        final String value = tags.keyword(keyword);
        if (value == null) {
            return null;
        }
        try {
            return new BigDecimal(value.trim());
        } catch (final NumberFormatException e) {
            throw new TagParseException(path, keyword, value, e);
        }
    }

    private static @Nullable Long readInteger(final FieldTags tags, final String keyword, final String path)
            throws TagParseException {
        final String value = tags.keyword(keyword);
        if (value == null) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (final NumberFormatException e) {
            throw new TagParseException(path, keyword, value, e);
        }
    }

    /**
     * Decodes a literal according to the type of the property. A referenced property is typed by its
     * definition.
     */
    private @Nullable Object decodeLiteral(final Schema property, final String keyword, final String value,
                                           final ReflectContext context) throws TagParseException {
        final Schema typed = typedSchema(property, context);

        if (typed.hasType(SimpleType.NUMBER)) {
            final BigDecimal number = parseNumber(value);
            if (number != null) {
                return number;
            }
        }
        if (typed.hasType(SimpleType.INTEGER)) {
            final BigInteger integer = parseInteger(value);
            if (integer != null) {
                return integer;
            }
        }
        if (typed.hasType(SimpleType.BOOLEAN)) {
            final Boolean parsed = parseBool(value);
            if (parsed != null) {
                return parsed;
            }
        }
        if (typed.hasType(SimpleType.STRING)) {
            return value;
        }

        try {
            return SchemaMapper.readLiteral(value);
        } catch (final JsonProcessingException e) {
            if (value.startsWith("[") && value.endsWith("]") && isArrayOfStrings(typed, context)) {
                return new ArrayList<>(List.of(value.substring(1, value.length() - 1).split(",", -1)));
            }
            throw new TagParseException(context.dottedPath(), keyword, value, e);
        }
    }

    /**
     * @return the decimal value, or {@code null} if the text is no plain number and should be decoded as JSON
     */
    private static @Nullable BigDecimal parseNumber(final String value) {
        try {
            return new BigDecimal(value.trim());
        } catch (final NumberFormatException e) {
            return null;
        }
    }

    private static @Nullable BigInteger parseInteger(final String value) {
        try {
            return new BigInteger(value.trim());
        } catch (final NumberFormatException e) {
            return null;
        }
    }

    private static Schema typedSchema(final Schema property, final ReflectContext context) {
        if (property.getRef() != null) {
            return context.definitionFor(property.getRef());
        }
        if (property.getAnyOf() != null) {
            for (final SchemaOrBool alternative : property.getAnyOf()) {
                final Schema schema = alternative.schema();
                if (schema != null && schema.getRef() != null) {
                    return context.definitionFor(schema.getRef());
                }
            }
        }
        return property;
    }

    private static boolean isArrayOfStrings(final Schema typed, final ReflectContext context) {
        if (!typed.hasType(SimpleType.ARRAY) || typed.getItems() == null || typed.getItems().schema() == null) {
            return false;
        }
        return typedSchema(typed.getItems().schema(), context).hasType(SimpleType.STRING);
    }

    private static List<Object> decodeArray(final String keyword, final String value, final String path)
            throws TagParseException {
        final Object decoded;
        try {
            decoded = SchemaMapper.readLiteral(value);
        } catch (final JsonProcessingException e) {
            throw new TagParseException(path, keyword, value, e);
        }
        if (!(decoded instanceof List<?> list)) {
            throw new TagParseException(path, keyword, value, new IllegalArgumentException("not a JSON array"));
        }
        return new ArrayList<>(list);
    }

    private static List<Object> decodeEnum(final String value) {
        final String trimmed = value.trim();
        if (!trimmed.startsWith("[")) {
            return splitList(value);
        }
        try {
            final Object decoded = SchemaMapper.readLiteral(trimmed);
            return decoded instanceof List<?> list ? new ArrayList<>(list) : splitList(value);
        } catch (final JsonProcessingException e) {
            return splitList(trimmed.substring(1, trimmed.length() - (trimmed.endsWith("]") ? 1 : 0)));
        }
    }

    private static List<Object> splitList(final String value) {
        final List<Object> result = new ArrayList<>();
        for (final String item : value.split(",")) {
            result.add(item.trim());
        }
        return result;
    }
}
