package de.mirkosertic.jsonschema.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Names a property under a given name tag. The reflector reads the tag selected by its configuration
 * ({@code json} unless changed), Jackson's {@code @JsonProperty} counts as the {@code json} tag.
 * A value of {@code "-"} excludes the field, an empty value keeps the declared name.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.RECORD_COMPONENT, ElementType.FIELD})
@Repeatable(PropertyNames.class)
public @interface PropertyName {

    String value();

    String tag() default "json";

    boolean omitEmpty() default false;
}
