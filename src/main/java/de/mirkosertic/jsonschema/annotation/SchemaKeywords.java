package de.mirkosertic.jsonschema.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * JSON Schema keywords for a property, or for the object schema itself when placed on a type.
 *
 * <p>Values are kept as text and interpreted during reflection: bounds are parsed as numbers,
 * {@code defaultValue}, {@code constValue} and {@code example} are decoded according to the property
 * type, {@code examples} is a JSON array and {@code enumValues} is a JSON array or a comma separated
 * list. An empty string leaves the keyword unset.</p>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.RECORD_COMPONENT, ElementType.FIELD, ElementType.TYPE})
public @interface SchemaKeywords {

    String title() default "";

    String description() default "";

    String comment() default "";

    String format() default "";

    String pattern() default "";

    String contentMediaType() default "";

    String contentEncoding() default "";

    String multipleOf() default "";

    String minimum() default "";

    String maximum() default "";

    String exclusiveMinimum() default "";

    String exclusiveMaximum() default "";

    String minLength() default "";

    String maxLength() default "";

    String minItems() default "";

    String maxItems() default "";

    String minProperties() default "";

    String maxProperties() default "";

    boolean uniqueItems() default false;

    boolean readOnly() default false;

    boolean writeOnly() default false;

    String enumValues() default "";

    String defaultValue() default "";

    String constValue() default "";

    String example() default "";

    String examples() default "";

    boolean required() default false;

    Nullability nullable() default Nullability.INHERIT;

    boolean deprecated() default false;

    /**
     * {@code "true"} or {@code "false"}, only meaningful on types.
     */
    String additionalProperties() default "";
}
