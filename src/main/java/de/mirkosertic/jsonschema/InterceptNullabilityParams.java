package de.mirkosertic.jsonschema;

import de.mirkosertic.jsonschema.model.Schema;
import org.jspecify.annotations.Nullable;

/**
 * @param context       invocation context
 * @param field         the reflected field
 * @param originalSchema copy of the property schema before nullability was applied
 * @param schema        property schema, may be modified
 * @param omitEmpty     whether the property is omitted when empty
 * @param nullAdded     whether a null variant was added
 * @param refDefinition definition the property refers to, {@code null} for inline schemas
 */
public record InterceptNullabilityParams(ReflectContext context, PropertyField field, Schema originalSchema,
                                         Schema schema, boolean omitEmpty, boolean nullAdded,
                                         @Nullable Schema refDefinition) {
}
