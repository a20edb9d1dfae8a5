package de.mirkosertic.jsonschema;

/**
 * Called after the nullability of a property has been decided, may adjust the property schema.
 */
@FunctionalInterface
public interface NullabilityInterceptor {

    void intercept(InterceptNullabilityParams params) throws Exception;
}
