package de.mirkosertic.jsonschema.capability;

import java.util.List;

/**
 * Supplies sample values whose schemas populate the {@code anyOf} keyword.
 */
public interface AnyOfExposer {

    List<Object> jsonSchemaAnyOf();
}
