package de.mirkosertic.jsonschema.capability;

import de.mirkosertic.jsonschema.model.Schema;
import de.mirkosertic.jsonschema.model.SimpleType;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Factories for inline values that only contribute a composition keyword. The resulting schema has
 * no type of its own, for example {@code Compositions.oneOf(1.23, "abc")} reflects to
 * {@code {"oneOf":[{"type":"number"},{"type":"string"}]}}.
 */
public final class Compositions {

    private Compositions() {
    }

    public static OneOf oneOf(final Object... alternatives) {
        return new OneOf(Arrays.asList(alternatives));
    }

    public static AnyOf anyOf(final Object... alternatives) {
        return new AnyOf(Arrays.asList(alternatives));
    }

    public static AllOf allOf(final Object... alternatives) {
        return new AllOf(Arrays.asList(alternatives));
    }

    private abstract static class Composition implements Preparer, SchemaInliner {

        private final transient List<Object> alternatives;

        Composition(final List<Object> alternatives) {
            this.alternatives = Collections.unmodifiableList(alternatives);
        }

        List<Object> alternatives() {
            return alternatives;
        }

        @Override
        public void prepareJsonSchema(final Schema schema) {
            schema.removeType(SimpleType.OBJECT);
            schema.withItems(null);
            schema.withProperties(null);
        }
    }

    public static final class OneOf extends Composition implements OneOfExposer {

        OneOf(final List<Object> alternatives) {
            super(alternatives);
        }

        @Override
        public List<Object> jsonSchemaOneOf() {
            return alternatives();
        }
    }

    public static final class AnyOf extends Composition implements AnyOfExposer {

        AnyOf(final List<Object> alternatives) {
            super(alternatives);
        }

        @Override
        public List<Object> jsonSchemaAnyOf() {
            return alternatives();
        }
    }

    public static final class AllOf extends Composition implements AllOfExposer {

        AllOf(final List<Object> alternatives) {
            super(alternatives);
        }

        @Override
        public List<Object> jsonSchemaAllOf() {
            return alternatives();
        }
    }
}
