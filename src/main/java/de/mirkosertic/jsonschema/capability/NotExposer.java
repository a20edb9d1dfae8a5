package de.mirkosertic.jsonschema.capability;

/**
 * Supplies the sample value whose schema populates the {@code not} keyword.
 */
public interface NotExposer {

    Object jsonSchemaNot();
}
