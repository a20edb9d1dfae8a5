package de.mirkosertic.jsonschema.capability;

import java.util.List;

/**
 * Supplies sample values whose schemas populate the {@code allOf} keyword.
 */
public interface AllOfExposer {

    List<Object> jsonSchemaAllOf();
}
