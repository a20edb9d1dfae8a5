package de.mirkosertic.jsonschema;

/**
 * Called before and after a value is expanded into a schema.
 */
@FunctionalInterface
public interface SchemaInterceptor {

    /**
     * @return {@code true} to stop further processing of the value; before expansion this keeps the
     * schema exactly as left by the interceptor
     */
    boolean intercept(InterceptSchemaParams params) throws Exception;
}
