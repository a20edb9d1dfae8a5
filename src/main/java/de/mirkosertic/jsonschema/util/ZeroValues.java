package de.mirkosertic.jsonschema.util;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Array;
import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;

/**
 * Creates default instances of types, used to query capabilities of a type when no sample value is
 * available.
 */
public final class ZeroValues {

    private static final Logger logger = LoggerFactory.getLogger(ZeroValues.class);

    private ZeroValues() {
        // Utility class, no instances
    }

    /**
     * Creates a default instance: the first constant of an enum, a record built from default component
     * values, or an instance created by the no-arg constructor.
     *
     * @return the instance, or null if the type can not be instantiated
     */
    public static @Nullable Object instantiate(final Class<?> type) {
        if (type.isEnum()) {
            final Object[] constants = type.getEnumConstants();
            return constants.length > 0 ? constants[0] : null;
        }
        if (type.isInterface() || type.isArray() || type.isPrimitive() || Modifier.isAbstract(type.getModifiers())) {
            return null;
        }
        try {
            if (type.isRecord()) {
                final RecordComponent[] components = type.getRecordComponents();
                final Class<?>[] parameterTypes = new Class<?>[components.length];
                final Object[] arguments = new Object[components.length];
                for (int i = 0; i < components.length; i++) {
                    parameterTypes[i] = components[i].getType();
                    arguments[i] = defaultValue(parameterTypes[i]);
                }
                final Constructor<?> constructor = type.getDeclaredConstructor(parameterTypes);
                constructor.trySetAccessible();
                return constructor.newInstance(arguments);
            }
            final Constructor<?> constructor = type.getDeclaredConstructor();
            constructor.trySetAccessible();
            return constructor.newInstance();
        } catch (final ReflectiveOperationException | RuntimeException e) {
            logger.debug("Could not create a default instance of {}: {}", type.getName(), e.toString());
            return null;
        }
    }

    public static @Nullable Object defaultValue(final Class<?> type) {
        if (!type.isPrimitive()) {
            return null;
        }
        return Array.get(Array.newInstance(type, 1), 0);
    }
}
