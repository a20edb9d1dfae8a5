package de.mirkosertic.jsonschema;

/**
 * Called before and after a property schema is built. Throwing {@link SkipPropertyException} omits the
 * property from its parent.
 */
@FunctionalInterface
public interface PropertyInterceptor {

    void intercept(InterceptPropParams params) throws Exception;
}
