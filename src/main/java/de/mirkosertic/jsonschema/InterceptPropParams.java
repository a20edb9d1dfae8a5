package de.mirkosertic.jsonschema;

import de.mirkosertic.jsonschema.model.Schema;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * @param context        invocation context
 * @param path           property path, starting with {@code #}
 * @param name           property name
 * @param field          the reflected field
 * @param propertySchema property schema, {@code null} before it was built
 * @param parentSchema   object schema receiving the property
 * @param processed      {@code false} before the property schema was built, {@code true} after
 */
public record InterceptPropParams(ReflectContext context, List<String> path, String name, PropertyField field,
                                  @Nullable Schema propertySchema, Schema parentSchema, boolean processed) {
}
