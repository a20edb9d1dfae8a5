package de.mirkosertic.jsonschema.capability;

import de.mirkosertic.jsonschema.model.Schema;

/**
 * Provides a complete custom schema. Reflection of the implementing type stops and the exposed schema
 * is used instead.
 */
public interface Exposer {

    Schema jsonSchema() throws Exception;
}
