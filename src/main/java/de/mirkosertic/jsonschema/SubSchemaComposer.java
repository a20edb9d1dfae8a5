package de.mirkosertic.jsonschema;

import de.mirkosertic.jsonschema.capability.AllOfExposer;
import de.mirkosertic.jsonschema.capability.AnyOfExposer;
import de.mirkosertic.jsonschema.capability.ElseExposer;
import de.mirkosertic.jsonschema.capability.IfExposer;
import de.mirkosertic.jsonschema.capability.NotExposer;
import de.mirkosertic.jsonschema.capability.OneOfExposer;
import de.mirkosertic.jsonschema.capability.ThenExposer;
import de.mirkosertic.jsonschema.model.Schema;
import de.mirkosertic.jsonschema.model.SchemaOrBool;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Fills composition keywords from the composition capabilities of a value. Every alternative is
 * reflected with the shared context, so alternatives referring to named types become references.
 */
final class SubSchemaComposer {

    /**
     * Reflects one alternative below the schema being composed.
     */
    @FunctionalInterface
    interface AlternativeWalker {
        Schema walk(@Nullable Object alternative, String keyword, Schema parent) throws SchemaException;
    }

    void compose(@Nullable final Object value, final Schema schema, final ReflectContext context,
                 final AlternativeWalker walker) throws SchemaException {
        if (value == null) {
            return;
        }
        final String path = context.dottedPath();

        if (value instanceof OneOfExposer exposer) {
            schema.withOneOf(walkAll(HookPipeline.call(path, "oneOf", exposer::jsonSchemaOneOf), "oneOf", schema, walker));
        }
        if (value instanceof AnyOfExposer exposer) {
            schema.withAnyOf(walkAll(HookPipeline.call(path, "anyOf", exposer::jsonSchemaAnyOf), "anyOf", schema, walker));
        }
        if (value instanceof AllOfExposer exposer) {
            schema.withAllOf(walkAll(HookPipeline.call(path, "allOf", exposer::jsonSchemaAllOf), "allOf", schema, walker));
        }
        if (value instanceof NotExposer exposer) {
            schema.withNot(walker.walk(HookPipeline.call(path, "not", exposer::jsonSchemaNot), "not", schema)
                    .toSchemaOrBool());
        }
        if (value instanceof IfExposer exposer) {
            schema.withIf(walker.walk(HookPipeline.call(path, "if", exposer::jsonSchemaIf), "if", schema)
                    .toSchemaOrBool());
        }
        if (value instanceof ThenExposer exposer) {
            schema.withThen(walker.walk(HookPipeline.call(path, "then", exposer::jsonSchemaThen), "then", schema)
                    .toSchemaOrBool());
        }
        if (value instanceof ElseExposer exposer) {
            schema.withElse(walker.walk(HookPipeline.call(path, "else", exposer::jsonSchemaElse), "else", schema)
                    .toSchemaOrBool());
        }
    }

    private static List<SchemaOrBool> walkAll(final List<Object> alternatives, final String keyword,
                                              final Schema parent, final AlternativeWalker walker)
            throws SchemaException {
        final List<SchemaOrBool> result = new ArrayList<>(alternatives.size());
        for (final Object alternative : alternatives) {
            result.add(walker.walk(alternative, keyword, parent).toSchemaOrBool());
        }
        return result;
    }
}
