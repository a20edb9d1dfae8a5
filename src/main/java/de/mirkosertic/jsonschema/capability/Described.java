package de.mirkosertic.jsonschema.capability;

/**
 * Supplies the schema description of the implementing type.
 */
public interface Described {

    String description();
}
