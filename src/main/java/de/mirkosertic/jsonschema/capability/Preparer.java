package de.mirkosertic.jsonschema.capability;

import de.mirkosertic.jsonschema.model.Schema;

/**
 * Adjusts the reflected schema after it has been fully built.
 */
public interface Preparer {

    void prepareJsonSchema(Schema schema) throws Exception;
}
