package de.mirkosertic.jsonschema;

import java.lang.reflect.Type;

/**
 * Rewrites the definition name derived for a type.
 */
@FunctionalInterface
public interface DefinitionNameInterceptor {

    String intercept(Type type, String defaultName);
}
