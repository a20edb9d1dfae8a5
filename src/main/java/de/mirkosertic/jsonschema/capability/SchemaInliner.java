package de.mirkosertic.jsonschema.capability;

/**
 * Marker for types whose schema is always inlined and never registered as a definition.
 */
public interface SchemaInliner {
}
