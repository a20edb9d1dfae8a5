package de.mirkosertic.jsonschema.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.reflect.TypeToken;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.math.BigInteger;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Generic type helpers on top of Guava's {@link TypeToken}.
 */
public final class Types {

    /**
     * Coarse shape of a type, as far as nullability decisions are concerned.
     */
    public enum Kind {
        ANY,
        SCALAR,
        ARRAY,
        MAP,
        OBJECT
    }

    private static final Set<Class<?>> INTEGRAL_TYPES = Set.of(
            byte.class, short.class, int.class, long.class,
            Byte.class, Short.class, Integer.class, Long.class,
            BigInteger.class, AtomicInteger.class, AtomicLong.class);

    private Types() {
        // Utility class, no instances
    }

    public static Class<?> rawType(final Type type) {
        return TypeToken.of(type).getRawType();
    }

    /**
     * Canonical, fully qualified name of the type including its type arguments.
     */
    public static String typeName(final Type type) {
        return TypeToken.of(type).toString();
    }

    /**
     * Resolves a member type (for example the generic type of a field) in the context of its owner.
     */
    public static Type resolve(final Type owner, final Type member) {
        return TypeToken.of(owner).resolveType(member).getType();
    }

    public static Type supertype(final Type type, final Class<?> superclass) {
        return supertypeOf(TypeToken.of(type), superclass);
    }

    @SuppressWarnings("unchecked")
    private static <T> Type supertypeOf(final TypeToken<T> token, final Class<?> superclass) {
        return token.getSupertype((Class<? super T>) superclass).getType();
    }

    /**
     * Type argument of the given generic supertype, {@code Object} if it is not known.
     */
    public static Type typeArgument(final Type type, final Class<?> superclass, final int index) {
        final Type supertype = supertype(type, superclass);
        if (supertype instanceof ParameterizedType parameterized) {
            return bound(parameterized.getActualTypeArguments()[index]);
        }
        return Object.class;
    }

    /**
     * Replaces wildcards and type variables by their upper bound.
     */
    public static Type bound(final Type type) {
        Type current = type;
        while (true) {
            if (current instanceof WildcardType wildcard) {
                current = wildcard.getUpperBounds()[0];
            } else if (current instanceof TypeVariable<?> variable) {
                current = variable.getBounds()[0];
            } else {
                return current;
            }
        }
    }

    public static boolean isJdkType(final Class<?> type) {
        if (type.isPrimitive()) {
            return true;
        }
        final String name = type.getName();
        return name.startsWith("java.") || name.startsWith("javax.") || name.startsWith("jdk.")
                || name.startsWith("sun.") || name.startsWith("com.sun.");
    }

    public static boolean isIntegral(final Class<?> type) {
        return INTEGRAL_TYPES.contains(type);
    }

    public static boolean isOptional(final Class<?> type) {
        return type == Optional.class || type == OptionalInt.class || type == OptionalLong.class
                || type == OptionalDouble.class;
    }

    /**
     * Element type of an {@code Optional} like container.
     */
    public static Type optionalElement(final Type type) {
        final Class<?> raw = rawType(type);
        if (raw == OptionalInt.class) {
            return Integer.class;
        }
        if (raw == OptionalLong.class) {
            return Long.class;
        }
        if (raw == OptionalDouble.class) {
            return Double.class;
        }
        return typeArgument(type, Optional.class, 0);
    }

    public static Kind kindOf(final Type type) {
        final Type bounded = bound(type);
        final Class<?> raw = rawType(bounded);
        if (isOptional(raw)) {
            return kindOf(optionalElement(bounded));
        }
        if (raw == Object.class || JsonNode.class.isAssignableFrom(raw)) {
            return Kind.ANY;
        }
        if (raw == byte[].class) {
            return Kind.SCALAR;
        }
        if (raw.isArray() || Iterable.class.isAssignableFrom(raw)) {
            return Kind.ARRAY;
        }
        if (Map.class.isAssignableFrom(raw)) {
            return Kind.MAP;
        }
        if (raw.isInterface() && !isJdkType(raw)) {
            return Kind.ANY;
        }
        if (isJdkType(raw) || raw.isEnum()) {
            return Kind.SCALAR;
        }
        return Kind.OBJECT;
    }
}
