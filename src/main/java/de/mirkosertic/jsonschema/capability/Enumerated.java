package de.mirkosertic.jsonschema.capability;

import java.util.List;

/**
 * Supplies the allowed values of the implementing type.
 */
public interface Enumerated {

    List<Object> enumValues();
}
