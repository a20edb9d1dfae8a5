package de.mirkosertic.jsonschema;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import de.mirkosertic.jsonschema.util.FieldTags;
import de.mirkosertic.jsonschema.util.Types;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.annotation.Annotation;
import java.lang.reflect.AnnotatedElement;
import java.lang.reflect.AnnotatedType;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;

/**
 * Enumerates the property candidates declared by a class: record components in declaration order, or
 * instance fields that are neither static, transient nor synthetic. Inherited fields are not included.
 */
final class PropertyFields {

    private static final Logger logger = LoggerFactory.getLogger(PropertyFields.class);

    private PropertyFields() {
    }

    static List<PropertyField> declaredBy(@Nullable final Object value, final Type type) {
        final Class<?> raw = Types.rawType(type);
        final Object owner = raw.isInstance(value) ? value : null;
        final List<PropertyField> result = new ArrayList<>();

        if (raw.isRecord()) {
            for (final RecordComponent component : raw.getRecordComponents()) {
                final Field backing = backingField(raw, component.getName());
                final AnnotatedElement[] elements = backing != null
                        ? new AnnotatedElement[]{backing, component}
                        : new AnnotatedElement[]{component};
                result.add(new PropertyField(
                        component.getName(),
                        Types.resolve(type, component.getGenericType()),
                        owner != null ? readComponent(component, owner) : null,
                        FieldTags.of(elements),
                        isNullable(component.getAnnotatedType(), elements),
                        isUnwrapped(elements),
                        component.getAnnotatedType()));
            }
            return result;
        }

        for (final Field field : raw.getDeclaredFields()) {
            final int modifiers = field.getModifiers();
            if (Modifier.isStatic(modifiers) || Modifier.isTransient(modifiers) || field.isSynthetic()) {
                continue;
            }
            result.add(new PropertyField(
                    field.getName(),
                    Types.resolve(type, field.getGenericType()),
                    owner != null ? readField(field, owner) : null,
                    FieldTags.of(field),
                    isNullable(field.getAnnotatedType(), field),
                    isUnwrapped(field),
                    field.getAnnotatedType()));
        }
        return result;
    }

    /**
     * A declaration is nullable if its type use carries jspecify's {@code @Nullable}, or if the
     * declaration itself carries any annotation named {@code Nullable}.
     */
    static boolean isNullable(@Nullable final AnnotatedType annotatedType, final AnnotatedElement... declarations) {
        if (annotatedType != null && annotatedType.isAnnotationPresent(Nullable.class)) {
            return true;
        }
        for (final AnnotatedElement declaration : declarations) {
            for (final Annotation annotation : declaration.getAnnotations()) {
                if ("Nullable".equals(annotation.annotationType().getSimpleName())) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean isUnwrapped(final AnnotatedElement... elements) {
        for (final AnnotatedElement element : elements) {
            final JsonUnwrapped unwrapped = element.getAnnotation(JsonUnwrapped.class);
            if (unwrapped != null && unwrapped.enabled()) {
                return true;
            }
        }
        return false;
    }

    private static @Nullable Field backingField(final Class<?> recordClass, final String name) {
        try {
            return recordClass.getDeclaredField(name);
        } catch (final NoSuchFieldException e) {
            return null;
        }
    }

    private static @Nullable Object readComponent(final RecordComponent component, final Object owner) {
        final Method accessor = component.getAccessor();
        try {
            accessor.trySetAccessible();
            return accessor.invoke(owner);
        } catch (final ReflectiveOperationException | RuntimeException e) {
            logger.debug("Could not read record component {} of {}, reflecting its type only: {}",
                    component.getName(), owner.getClass().getName(), e.toString());
            return null;
        }
    }

    private static @Nullable Object readField(final Field field, final Object owner) {
        if (!field.trySetAccessible()) {
            logger.debug("Field {} of {} is not accessible, reflecting its type only",
                    field.getName(), owner.getClass().getName());
            return null;
        }
        try {
            return field.get(owner);
        } catch (final IllegalAccessException e) {
            logger.debug("Could not read field {} of {}, reflecting its type only: {}",
                    field.getName(), owner.getClass().getName(), e.toString());
            return null;
        }
    }
}
