package de.mirkosertic.jsonschema;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;

/**
 * Ordered interceptor chains of one invocation.
 *
 * <p>Schema interceptors run in registration order until one of them asks to stop. Property and
 * nullability interceptors all run in order, the first failure ends the chain. Exceptions other than
 * {@link SchemaException} are wrapped into {@link HookException} carrying the current path.</p>
 */
public final class HookPipeline {

    @FunctionalInterface
    interface HookCall<T> {
        T call() throws Exception;
    }

    private final List<SchemaInterceptor> schemaInterceptors = new ArrayList<>();
    private final List<PropertyInterceptor> propertyInterceptors = new ArrayList<>();
    private final List<NullabilityInterceptor> nullabilityInterceptors = new ArrayList<>();
    private final List<DefinitionNameInterceptor> definitionNameInterceptors = new ArrayList<>();

    HookPipeline() {
    }

    public void addSchemaInterceptor(final SchemaInterceptor interceptor) {
        schemaInterceptors.add(interceptor);
    }

    public void addPropertyInterceptor(final PropertyInterceptor interceptor) {
        propertyInterceptors.add(interceptor);
    }

    public void addNullabilityInterceptor(final NullabilityInterceptor interceptor) {
        nullabilityInterceptors.add(interceptor);
    }

    public void addDefinitionNameInterceptor(final DefinitionNameInterceptor interceptor) {
        definitionNameInterceptors.add(interceptor);
    }

    /**
     * @return {@code true} if an interceptor stopped further processing
     */
    boolean interceptSchema(final InterceptSchemaParams params) throws SchemaException {
        final String stage = params.processed() ? "schema interceptor (after expansion)" : "schema interceptor";
        for (final SchemaInterceptor interceptor : schemaInterceptors) {
            if (call(params.context().dottedPath(), stage, () -> interceptor.intercept(params))) {
                return true;
            }
        }
        return false;
    }

    void interceptProperty(final InterceptPropParams params) throws SchemaException {
        for (final PropertyInterceptor interceptor : propertyInterceptors) {
            call(params.context().dottedPath(), "property interceptor", () -> {
                interceptor.intercept(params);
                return null;
            });
        }
    }

    void interceptNullability(final InterceptNullabilityParams params) throws SchemaException {
        for (final NullabilityInterceptor interceptor : nullabilityInterceptors) {
            call(params.context().dottedPath(), "nullability interceptor", () -> {
                interceptor.intercept(params);
                return null;
            });
        }
    }

    String interceptDefinitionName(final String path, final Type type, final String defaultName) throws SchemaException {
        String name = defaultName;
        for (final DefinitionNameInterceptor interceptor : definitionNameInterceptors) {
            final String current = name;
            name = call(path, "definition name interceptor", () -> interceptor.intercept(type, current));
        }
        return name;
    }

    /**
     * Runs a hook or capability method, translating its failure into a {@link SchemaException}.
     */
    static <T> T call(final String path, final String stage, final HookCall<T> hook) throws SchemaException {
        try {
            return hook.call();
        } catch (final SchemaException e) {
            throw e;
        } catch (final Exception e) {
            throw new HookException(path, stage, e);
        }
    }
}
