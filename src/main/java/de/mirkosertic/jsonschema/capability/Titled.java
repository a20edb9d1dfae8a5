package de.mirkosertic.jsonschema.capability;

/**
 * Supplies the schema title of the implementing type.
 */
public interface Titled {

    String title();
}
