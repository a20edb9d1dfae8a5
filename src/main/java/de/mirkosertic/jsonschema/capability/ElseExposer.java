package de.mirkosertic.jsonschema.capability;

/**
 * Supplies the sample value whose schema populates the {@code else} keyword.
 */
public interface ElseExposer {

    Object jsonSchemaElse();
}
