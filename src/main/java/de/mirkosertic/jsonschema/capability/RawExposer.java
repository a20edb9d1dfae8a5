package de.mirkosertic.jsonschema.capability;

/**
 * Provides a complete custom schema as raw JSON bytes.
 */
public interface RawExposer {

    byte[] jsonSchemaBytes() throws Exception;
}
