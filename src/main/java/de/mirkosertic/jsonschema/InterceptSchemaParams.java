package de.mirkosertic.jsonschema;

import de.mirkosertic.jsonschema.model.Schema;
import org.jspecify.annotations.Nullable;

import java.lang.reflect.Type;

/**
 * @param context   invocation context
 * @param value     sample value, may be a default instance created for the type
 * @param type      reflected type
 * @param schema    schema under construction
 * @param processed {@code false} before expansion, {@code true} after
 */
public record InterceptSchemaParams(ReflectContext context, @Nullable Object value, Type type, Schema schema,
                                    boolean processed) {
}
