package de.mirkosertic.jsonschema;

import de.mirkosertic.jsonschema.util.FieldTags;
import org.jspecify.annotations.Nullable;

import java.lang.reflect.AnnotatedType;
import java.lang.reflect.Type;

/**
 * A property candidate of an object: a record component, an instance field or a virtual field.
 *
 * @param name          declared name
 * @param type          resolved generic type
 * @param value         value read from the sample, if any
 * @param tags          names and keywords
 * @param nullable      whether the declaration is annotated {@code @Nullable}
 * @param unwrapped     whether the properties of the value are flattened into the parent
 * @param annotatedType annotated type of the declaration, used for nullable type arguments
 */
public record PropertyField(String name, Type type, @Nullable Object value, FieldTags tags, boolean nullable,
                            boolean unwrapped, @Nullable AnnotatedType annotatedType) {

    Sample toSample() {
        return new Sample(value, type, nullable, false, annotatedType);
    }
}
