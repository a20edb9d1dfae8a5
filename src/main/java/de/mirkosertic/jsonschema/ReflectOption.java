package de.mirkosertic.jsonschema;

/**
 * Adjusts a {@link ReflectContext} before reflection starts. Factories live in {@link ReflectOptions}.
 */
@FunctionalInterface
public interface ReflectOption {

    void apply(ReflectContext context);
}
