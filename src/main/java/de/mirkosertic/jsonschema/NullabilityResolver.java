package de.mirkosertic.jsonschema;

import de.mirkosertic.jsonschema.model.Schema;
import de.mirkosertic.jsonschema.model.SimpleType;
import de.mirkosertic.jsonschema.util.Types;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Decides whether a property schema admits {@code null}.
 *
 * <p>An explicit per-field override wins. Otherwise omit-empty properties are left alone, arrays and
 * objects without declared properties admit null, and so do properties declared {@code @Nullable} or
 * as {@code Optional}. References are only made nullable by enveloping them in
 * {@code anyOf: [{"type":"null"}, {"$ref": ...}]}, which happens for nullable overrides and, if enabled,
 * for nullable or container typed references whose definition does not already admit null.</p>
 */
final class NullabilityResolver {

    void apply(final Schema property, final PropertyField field, final boolean omitEmpty,
               @Nullable final Boolean override, final ReflectContext context) throws SchemaException {
        final Schema original = property.copy();
        final Schema refDefinition = property.getRef() != null ? context.definitionFor(property.getRef()) : null;
        final boolean pointer = isPointer(field);
        boolean nullAdded = false;

        if (override != null) {
            if (!override) {
                if (property.getRef() == null) {
                    property.removeType(SimpleType.NULL);
                }
            } else if (property.getRef() != null) {
                envelop(property);
                nullAdded = true;
            } else if (property.getType() != null) {
                property.addType(SimpleType.NULL);
                nullAdded = true;
            }
        } else if (!omitEmpty) {
            if (refDefinition == null) {
                if (property.hasType(SimpleType.ARRAY)
                        || (property.hasType(SimpleType.OBJECT) && property.getProperties() == null)
                        || (pointer && property.getType() != null)) {
                    property.addType(SimpleType.NULL);
                    nullAdded = true;
                }
            } else if (context.isEnvelopNullability()
                    && (pointer || Types.kindOf(field.type()) != Types.Kind.OBJECT)
                    && (refDefinition.hasType(SimpleType.ARRAY) || refDefinition.hasType(SimpleType.OBJECT) || pointer)
                    && !refDefinition.hasType(SimpleType.NULL)) {
                envelop(property);
                nullAdded = true;
            }
        }

        context.hooks().interceptNullability(new InterceptNullabilityParams(
                context, field, original, property, omitEmpty, nullAdded, refDefinition));
    }

    /**
     * Container elements declared {@code @Nullable} or as {@code Optional} admit null, unless they are
     * objects or references.
     */
    void applyToElement(final Schema element, final boolean nullable) {
        if (nullable && element.getRef() == null && element.getType() != null && !element.hasType(SimpleType.OBJECT)) {
            element.addType(SimpleType.NULL);
        }
    }

    private static boolean isPointer(final PropertyField field) {
        return field.nullable() || Types.isOptional(Types.rawType(field.type()));
    }

    private static void envelop(final Schema property) {
        final Schema reference = new Schema().withRef(property.getRef());
        property.withRef(null);
        property.withAnyOf(List.of(
                new Schema().withType(SimpleType.NULL).toSchemaOrBool(),
                reference.toSchemaOrBool()));
    }
}
