package de.mirkosertic.jsonschema;

import de.mirkosertic.jsonschema.model.Schema;

import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Factories for {@link ReflectOption}s.
 */
public final class ReflectOptions {

    private ReflectOptions() {
    }

    /**
     * Reads property names from the given tag, then from the additional tags in order.
     */
    public static ReflectOption propertyNameTag(final String tag, final String... additional) {
        return context -> {
            context.setPropertyNameTag(tag);
            context.setAdditionalNameTags(List.of(additional));
        };
    }

    public static ReflectOption propertyNameMapping(final Map<String, String> mapping) {
        return context -> context.setPropertyNameMapping(mapping);
    }

    public static ReflectOption definitionsPrefix(final String prefix) {
        return context -> context.setDefinitionsPrefix(prefix);
    }

    /**
     * Inlines all definitions instead of referencing them. Recursive types stay referenced.
     */
    public static ReflectOption inlineRefs() {
        return context -> context.setInlineRefs(true);
    }

    /**
     * Registers the root type as a definition and returns a reference to it.
     */
    public static ReflectOption rootRef() {
        return context -> context.setRootRef(true);
    }

    public static ReflectOption rootNullable() {
        return context -> context.setRootNullable(true);
    }

    public static ReflectOption requireNameTags() {
        return context -> context.setRequireNameTags(true);
    }

    public static ReflectOption skipUnsupportedProperties() {
        return context -> context.setSkipUnsupportedProperties(true);
    }

    public static ReflectOption skipNonConstraints() {
        return context -> context.setSkipNonConstraints(true);
    }

    /**
     * Expresses nullable references as {@code anyOf: [{"type":"null"}, {"$ref": ...}]}.
     */
    public static ReflectOption envelopNullability() {
        return context -> context.setEnvelopNullability(true);
    }

    public static ReflectOption collectDefinitions(final BiConsumer<String, Schema> collector) {
        return context -> context.setDefinitionCollector(collector);
    }

    public static ReflectOption interceptSchema(final SchemaInterceptor interceptor) {
        return context -> context.hooks().addSchemaInterceptor(interceptor);
    }

    public static ReflectOption interceptProp(final PropertyInterceptor interceptor) {
        return context -> context.hooks().addPropertyInterceptor(interceptor);
    }

    public static ReflectOption interceptNullability(final NullabilityInterceptor interceptor) {
        return context -> context.hooks().addNullabilityInterceptor(interceptor);
    }

    public static ReflectOption interceptDefName(final DefinitionNameInterceptor interceptor) {
        return context -> context.hooks().addDefinitionNameInterceptor(interceptor);
    }

    /**
     * Removes the given prefixes from definition names, including names nested in generic arguments.
     */
    public static ReflectOption stripDefinitionNamePrefix(final String... prefixes) {
        return interceptDefName((type, defaultName) -> {
            String name = defaultName;
            for (final String prefix : prefixes) {
                if (name.startsWith(prefix)) {
                    name = name.substring(prefix.length());
                }
                name = name.replace("[" + prefix, "[").replace("," + prefix, ",");
            }
            return name;
        });
    }
}
