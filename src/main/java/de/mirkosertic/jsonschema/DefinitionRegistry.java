package de.mirkosertic.jsonschema;

import de.mirkosertic.jsonschema.capability.SchemaInliner;
import de.mirkosertic.jsonschema.model.Schema;
import de.mirkosertic.jsonschema.util.NameFormatter;
import de.mirkosertic.jsonschema.util.Types;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Definition names and completed definitions of one invocation.
 *
 * <p>A name is bound to exactly one type identity. When the derived name is already bound to another
 * identity, the suffix {@code Type2}, {@code Type3}, ... is appended until a free name is found.</p>
 */
final class DefinitionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(DefinitionRegistry.class);

    private final Map<String, String> namesByType = new HashMap<>();
    private final Map<String, String> typesByName = new HashMap<>();
    private final Map<String, Ref> refsByType = new HashMap<>();
    private final Map<String, Schema> definitionsByReference = new HashMap<>();
    private final Map<String, Schema> definitionsByName = new TreeMap<>();

    /**
     * Returns the definition name of a type, reserving it on first use.
     *
     * @return the name, or {@code null} if the type has no definition name
     */
    @Nullable String nameFor(final Type type, final String typeName, final ReflectContext context) throws SchemaException {
        final String known = namesByType.get(typeName);
        if (known != null) {
            return known;
        }
        final String derived = deriveName(type);
        if (derived == null) {
            return null;
        }
        final String intercepted = context.hooks().interceptDefinitionName(context.dottedPath(), type, derived);
        return reserve(intercepted, typeName);
    }

    /**
     * Reserves an explicit name, resolving collisions with other identities.
     */
    String reserve(final String baseName, final String typeName) {
        final String known = namesByType.get(typeName);
        if (known != null) {
            return known;
        }
        for (int attempt = 1; ; attempt++) {
            final String name = attempt > 1 ? baseName + "Type" + attempt : baseName;
            final String owner = typesByName.get(name);
            if (owner == null) {
                typesByName.put(name, typeName);
                namesByType.put(typeName, name);
                return name;
            }
            logger.debug("Definition name {} is already bound to {}, retrying for {}", name, owner, typeName);
        }
    }

    @Nullable Ref refFor(final String typeName) {
        return refsByType.get(typeName);
    }

    void register(final String typeName, final Ref ref, final Schema schema) {
        logger.debug("Registering definition {} for {}", ref.name(), typeName);
        refsByType.put(typeName, ref);
        definitionsByReference.put(ref.reference(), schema);
        definitionsByName.put(ref.name(), schema);
    }

    @Nullable Schema definition(final String reference) {
        return definitionsByReference.get(reference);
    }

    /**
     * Completed definitions sorted by name.
     */
    Map<String, Schema> definitions() {
        return Collections.unmodifiableMap(definitionsByName);
    }

    /**
     * Derives the default name of a type from the last segment of its package and its simple name, for
     * example {@code de.mirkosertic.jsonschema.Person} becomes {@code JsonschemaPerson}. Generic
     * instantiations append their argument names in brackets.
     *
     * @return the name, or {@code null} for JDK types, arrays, anonymous or synthetic classes and
     * {@link SchemaInliner} implementations
     */
    static @Nullable String deriveName(final Type type) {
        final Class<?> raw = Types.rawType(type);
        if (raw.isArray() || Types.isJdkType(raw) || raw.isAnonymousClass() || raw.isSynthetic()
                || SchemaInliner.class.isAssignableFrom(raw)) {
            return null;
        }
        final String simpleName = raw.getSimpleName();
        final String baseName = NameFormatter.toCamel(NameFormatter.packageBaseName(raw.getPackageName())
                + Character.toUpperCase(simpleName.charAt(0)) + simpleName.substring(1));
        if (type instanceof ParameterizedType parameterized) {
            final StringJoiner arguments = new StringJoiner(",", "[", "]");
            for (final Type argument : parameterized.getActualTypeArguments()) {
                arguments.add(argumentName(argument));
            }
            return baseName + arguments;
        }
        return baseName;
    }

    private static String argumentName(final Type argument) {
        final Type bounded = Types.bound(argument);
        final String named = deriveName(bounded);
        if (named != null) {
            return named;
        }
        final Class<?> raw = Types.rawType(bounded);
        if (raw.isArray()) {
            return argumentName(raw.getComponentType()) + "Array";
        }
        if (bounded instanceof ParameterizedType parameterized) {
            final StringJoiner arguments = new StringJoiner(",", "[", "]");
            for (final Type nested : parameterized.getActualTypeArguments()) {
                arguments.add(argumentName(nested));
            }
            return raw.getSimpleName() + arguments;
        }
        return NameFormatter.toCamel(raw.getSimpleName());
    }
}
