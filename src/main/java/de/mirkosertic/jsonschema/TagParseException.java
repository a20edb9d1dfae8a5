package de.mirkosertic.jsonschema;

/**
 * Thrown when a schema keyword declared on a field or type can not be parsed.
 */
public class TagParseException extends SchemaException {

    private final String keyword;
    private final String value;

    public TagParseException(final String path, final String keyword, final String value, final Throwable cause) {
        super(path, "parsing " + keyword + " value '" + value + "' failed: " + cause.getMessage(), cause);
        this.keyword = keyword;
        this.value = value;
    }

    public String getKeyword() {
        return keyword;
    }

    public String getValue() {
        return value;
    }
}
