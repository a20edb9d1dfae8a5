package de.mirkosertic.jsonschema.capability;

/**
 * Supplies the sample value whose schema populates the {@code if} keyword.
 */
public interface IfExposer {

    Object jsonSchemaIf();
}
