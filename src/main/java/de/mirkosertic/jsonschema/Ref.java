package de.mirkosertic.jsonschema;

import de.mirkosertic.jsonschema.model.Schema;

/**
 * Reference to a registered definition.
 *
 * @param path prefix of the reference, for example {@code #/definitions/}
 * @param name definition name
 */
public record Ref(String path, String name) {

    private static final Ref ROOT = new Ref("#", "");

    /**
     * Reference to the document root.
     */
    public static Ref root() {
        return ROOT;
    }

    /**
     * Reference string with the name escaped as a JSON pointer token.
     */
    public String reference() {
        return path + name.replace("~", "~0").replace("/", "~1").replace("%", "%25");
    }

    public Schema toSchema() {
        return new Schema().withRef(reference());
    }
}
