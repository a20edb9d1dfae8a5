package de.mirkosertic.jsonschema;

import de.mirkosertic.jsonschema.capability.Enumerated;
import de.mirkosertic.jsonschema.capability.Exposer;
import de.mirkosertic.jsonschema.capability.NamedEnum;
import de.mirkosertic.jsonschema.capability.RawExposer;
import de.mirkosertic.jsonschema.model.Schema;
import de.mirkosertic.jsonschema.model.SchemaMapper;

/**
 * First schema interceptor of every invocation. Applies enumeration capabilities and replaces the
 * schema of values that expose a complete schema themselves.
 */
final class CapabilityInterceptor implements SchemaInterceptor {

    static final String ENUM_NAMES_KEYWORD = "x-enum-names";

    @Override
    public boolean intercept(final InterceptSchemaParams params) throws Exception {
        if (params.processed()) {
            return false;
        }
        final Object value = params.value();
        final Schema schema = params.schema();

        if (value instanceof NamedEnum namedEnum) {
            final NamedEnum.Values values = namedEnum.namedEnum();
            schema.withEnum(values.values());
            schema.withExtraProperty(ENUM_NAMES_KEYWORD, values.names());
        } else if (value instanceof Enumerated enumerated) {
            schema.withEnum(enumerated.enumValues());
        }

        if (value instanceof Exposer exposer) {
            schema.copyFrom(exposer.jsonSchema());
            return true;
        }
        if (value instanceof RawExposer rawExposer) {
            schema.copyFrom(SchemaMapper.fromJson(rawExposer.jsonSchemaBytes()));
            return true;
        }
        return false;
    }
}
