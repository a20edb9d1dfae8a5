package de.mirkosertic.jsonschema.capability;

/**
 * Supplies the sample value whose schema populates the {@code then} keyword.
 */
public interface ThenExposer {

    Object jsonSchemaThen();
}
