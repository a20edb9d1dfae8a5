package de.mirkosertic.jsonschema.capability;

/**
 * Marker for embedded types (superclasses or unwrapped fields) that are referenced through
 * {@code allOf} instead of having their properties flattened into the embedding object.
 */
public interface EmbedReferencer {
}
