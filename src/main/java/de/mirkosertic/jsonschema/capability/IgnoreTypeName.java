package de.mirkosertic.jsonschema.capability;

/**
 * Marker for type mapping targets that keep the definition name of the mapped source type.
 */
public interface IgnoreTypeName {
}
