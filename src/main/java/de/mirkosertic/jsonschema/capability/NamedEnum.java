package de.mirkosertic.jsonschema.capability;

import java.util.List;

/**
 * Supplies allowed values together with a display name for each of them. Names are written to the
 * {@code x-enum-names} keyword.
 */
public interface NamedEnum {

    /**
     * @param values allowed values
     * @param names  display names, same order as the values
     */
    record Values(List<Object> values, List<String> names) {
    }

    Values namedEnum();
}
