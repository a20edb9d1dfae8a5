package de.mirkosertic.jsonschema.annotation;

public enum Nullability {
    INHERIT,
    NULLABLE,
    NOT_NULL
}
