package de.mirkosertic.jsonschema.capability;

import java.util.List;

/**
 * Supplies sample values whose schemas populate the {@code oneOf} keyword.
 */
public interface OneOfExposer {

    List<Object> jsonSchemaOneOf();
}
