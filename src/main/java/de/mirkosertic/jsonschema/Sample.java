package de.mirkosertic.jsonschema;

import de.mirkosertic.jsonschema.util.Types;
import org.jspecify.annotations.Nullable;

import java.lang.reflect.AnnotatedParameterizedType;
import java.lang.reflect.AnnotatedType;
import java.lang.reflect.Modifier;
import java.lang.reflect.Type;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * Value and type being reflected.
 *
 * @param value     sample value
 * @param type      declared type, {@code null} to use the class of the value
 * @param nullable  whether the value sits behind an indirection ({@code Optional} or {@code @Nullable})
 * @param exactType whether the declared type must be used even if the value is of a subclass
 * @param annotated annotated declaration, used to find {@code @Nullable} element types
 */
record Sample(@Nullable Object value, @Nullable Type type, boolean nullable, boolean exactType,
              @Nullable AnnotatedType annotated) {

    static Sample of(@Nullable final Object value) {
        if (value instanceof Type type) {
            return new Sample(null, type, false, false, null);
        }
        return new Sample(value, null, false, false, null);
    }

    static Sample of(@Nullable final Object value, @Nullable final Type type) {
        return new Sample(value, type, false, false, null);
    }

    static Sample exact(@Nullable final Object value, final Type type) {
        return new Sample(value, type, false, true, null);
    }

    /**
     * Strips {@code Optional} layers and replaces abstract declarations by the class of the sample.
     */
    Sample resolve() {
        Object currentValue = value;
        Type currentType = type != null ? Types.bound(type) : currentValue != null ? currentValue.getClass() : null;
        boolean currentNullable = nullable;
        AnnotatedType currentAnnotated = annotated;

        while (currentType != null && Types.isOptional(Types.rawType(currentType))) {
            currentNullable = true;
            currentType = Types.bound(Types.optionalElement(currentType));
            currentValue = unwrapOptional(currentValue);
            currentAnnotated = currentAnnotated instanceof AnnotatedParameterizedType parameterized
                    && parameterized.getAnnotatedActualTypeArguments().length == 1
                    ? parameterized.getAnnotatedActualTypeArguments()[0] : null;
        }

        if (currentType != null && currentValue != null && !exactType) {
            final Class<?> raw = Types.rawType(currentType);
            final Class<?> actual = currentValue.getClass();
            if (raw != actual && raw.isAssignableFrom(actual) && isAbstract(raw)) {
                currentType = actual;
            }
        }
        return new Sample(currentValue, currentType, currentNullable, exactType, currentAnnotated);
    }

    private static boolean isAbstract(final Class<?> raw) {
        if (raw == Object.class) {
            return true;
        }
        if (raw.isEnum() || Iterable.class.isAssignableFrom(raw) || Map.class.isAssignableFrom(raw)) {
            return false;
        }
        return raw.isInterface() || Modifier.isAbstract(raw.getModifiers());
    }

    private static @Nullable Object unwrapOptional(@Nullable final Object value) {
        if (value instanceof Optional<?> optional) {
            return optional.orElse(null);
        }
        if (value instanceof OptionalInt optional) {
            return optional.isPresent() ? optional.getAsInt() : null;
        }
        if (value instanceof OptionalLong optional) {
            return optional.isPresent() ? optional.getAsLong() : null;
        }
        if (value instanceof OptionalDouble optional) {
            return optional.isPresent() ? optional.getAsDouble() : null;
        }
        return null;
    }
}
