package de.mirkosertic.jsonschema;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import de.mirkosertic.jsonschema.capability.AllOfExposer;
import de.mirkosertic.jsonschema.capability.AnyOfExposer;
import de.mirkosertic.jsonschema.capability.Described;
import de.mirkosertic.jsonschema.capability.ElseExposer;
import de.mirkosertic.jsonschema.capability.EmbedReferencer;
import de.mirkosertic.jsonschema.capability.Enumerated;
import de.mirkosertic.jsonschema.capability.Exposer;
import de.mirkosertic.jsonschema.capability.IfExposer;
import de.mirkosertic.jsonschema.capability.IgnoreTypeName;
import de.mirkosertic.jsonschema.capability.NamedEnum;
import de.mirkosertic.jsonschema.capability.NotExposer;
import de.mirkosertic.jsonschema.capability.OneOfExposer;
import de.mirkosertic.jsonschema.capability.Preparer;
import de.mirkosertic.jsonschema.capability.RawExposer;
import de.mirkosertic.jsonschema.capability.ThenExposer;
import de.mirkosertic.jsonschema.capability.Titled;
import de.mirkosertic.jsonschema.config.ReflectorConfig;
import de.mirkosertic.jsonschema.model.Schema;
import de.mirkosertic.jsonschema.model.SchemaOrBool;
import de.mirkosertic.jsonschema.model.SimpleType;
import de.mirkosertic.jsonschema.util.FieldTags;
import de.mirkosertic.jsonschema.util.Types;
import de.mirkosertic.jsonschema.util.ZeroValues;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.io.OutputStream;
import java.io.Reader;
import java.io.Writer;
import java.lang.reflect.AnnotatedArrayType;
import java.lang.reflect.AnnotatedParameterizedType;
import java.lang.reflect.AnnotatedType;
import java.lang.reflect.Array;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.Method;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Future;
import java.util.stream.BaseStream;

/**
 * Builds JSON Schemas from Java values and types.
 *
 * <p>The reflector walks the structure of a sample value (or a type), registers named types as
 * definitions and returns the root schema. Definitions are written to the root schema's
 * {@code definitions} keyword, or handed to a collector configured with
 * {@link ReflectOptions#collectDefinitions}.</p>
 *
 * <p>A reflector only holds configuration (default options, type mappings, inlined types). Every
 * invocation works on its own {@link ReflectContext}, so one reflector can serve concurrent callers as
 * long as it is not reconfigured meanwhile.</p>
 */
public class Reflector {

    private static final Logger logger = LoggerFactory.getLogger(Reflector.class);

    private static final List<Class<?>> UNSUPPORTED_TYPES = List.of(
            Runnable.class, Callable.class, Future.class, BaseStream.class, Iterator.class, Thread.class,
            Class.class, ClassLoader.class, InputStream.class, OutputStream.class, Reader.class, Writer.class,
            Method.class);

    private static final List<Class<?>> CAPABILITIES = List.of(
            Exposer.class, RawExposer.class, Preparer.class, Described.class, Titled.class, Enumerated.class,
            NamedEnum.class, OneOfExposer.class, AnyOfExposer.class, AllOfExposer.class, NotExposer.class,
            IfExposer.class, ThenExposer.class, ElseExposer.class);

    private static final Set<Class<?>> BOOLEAN_TYPES = Set.of(boolean.class, Boolean.class);
    private static final Set<Class<?>> STRING_TYPES = Set.of(char.class, Character.class);

    private final List<ReflectOption> defaultOptions = new CopyOnWriteArrayList<>();
    private final Map<Type, Object> typeMappings = new ConcurrentHashMap<>();
    private final Set<String> inlineDefinitions = ConcurrentHashMap.newKeySet();

    private final ConstraintExtractor constraints = new ConstraintExtractor();
    private final NullabilityResolver nullability = new NullabilityResolver();
    private final SubSchemaComposer composer = new SubSchemaComposer();

    public Reflector() {
    }

    /**
     * Creates a reflector whose default options come from the given configuration.
     */
    public static Reflector fromConfig(final ReflectorConfig config) {
        final Reflector reflector = new Reflector();
        config.toOptions().forEach(reflector::addDefaultOption);
        return reflector;
    }

    /**
     * Adds an option applied to every invocation before the per-call options.
     */
    public void addDefaultOption(final ReflectOption option) {
        defaultOptions.add(option);
    }

    /**
     * Reflects the source type as if it was the destination. The destination can be a sample value, a
     * {@link Type} or a {@link Schema}. Unless the destination implements {@link IgnoreTypeName}, the
     * definition name follows the destination.
     */
    public void addTypeMapping(final Type source, final Object destination) {
        typeMappings.put(source, destination);
    }

    /**
     * Always inlines the schema of the given type instead of registering a definition.
     */
    public void inlineDefinition(final Type type) {
        inlineDefinitions.add(Types.typeName(type));
    }

    /**
     * Reflects a sample value. A {@link Type} passed as value is reflected as that type.
     */
    public Schema reflect(@Nullable final Object value, final ReflectOption... options) throws SchemaException {
        return reflect(Sample.of(value), options);
    }

    /**
     * Reflects a sample value using the given declared type, which keeps generic type arguments that
     * the runtime class of the value has lost.
     */
    public Schema reflect(@Nullable final Object value, final Type type, final ReflectOption... options)
            throws SchemaException {
        return reflect(Sample.of(value, type), options);
    }

    public Schema reflectType(final Type type, final ReflectOption... options) throws SchemaException {
        return reflect(Sample.of(null, type), options);
    }

    private Schema reflect(final Sample sample, final ReflectOption... options) throws SchemaException {
        final ReflectContext context = new ReflectContext();
        context.hooks().addSchemaInterceptor(new CapabilityInterceptor());
        for (final ReflectOption option : defaultOptions) {
            option.apply(context);
        }
        for (final ReflectOption option : options) {
            option.apply(context);
        }

        logger.debug("Reflecting {}", sample.type() != null ? sample.type().getTypeName()
                : sample.value() != null ? sample.value().getClass().getName() : "null");

        final Schema schema;
        try {
            schema = walk(sample, context, null);
        } catch (final SkipPropertyException e) {
            throw new UnsupportedTypeException("", sample.type() != null ? sample.type()
                    : sample.value() != null ? sample.value().getClass() : Object.class);
        }

        final Map<String, Schema> definitions = context.registry().definitions();
        if (!definitions.isEmpty()) {
            if (context.getDefinitionCollector() != null) {
                definitions.forEach(context.getDefinitionCollector());
            } else {
                final Map<String, SchemaOrBool> rootDefinitions = new TreeMap<>();
                definitions.forEach((name, definition) -> rootDefinitions.put(name, definition.toSchemaOrBool()));
                schema.withDefinitions(rootDefinitions);
            }
        }
        return schema;
    }

    // ---- walk ----

    Schema walk(final Sample sample, final ReflectContext context, @Nullable final Schema parent) throws SchemaException {
        final Sample resolved = sample.resolve();
        Type type = resolved.type();
        Object value = resolved.value();

        if (type == null || type == Object.class) {
            return new Schema().withParent(parent);
        }

        String typeName;
        String defName;
        boolean mapped = false;
        if (value instanceof VirtualObject virtual) {
            final String name = virtual.definitionName() != null
                    ? virtual.definitionName() : context.nextVirtualObjectName();
            typeName = "virtual:" + name;
            defName = context.registry().reserve(name, typeName);
        } else {
            typeName = Types.typeName(type);
            defName = context.registry().nameFor(type, typeName, context);

            final Object mapping = findMapping(type);
            if (mapping != null) {
                mapped = true;
                final Sample target = Sample.of(mapping).resolve();
                type = target.type() != null ? target.type() : Object.class;
                value = target.value();
                if (!(mapping instanceof IgnoreTypeName)) {
                    typeName = Types.typeName(type);
                    defName = context.registry().nameFor(type, typeName, context);
                }
                if (type == Object.class) {
                    return new Schema().withParent(parent);
                }
            }
        }

        final boolean root = context.isRoot();
        if (root) {
            context.rootTypeName(typeName);
        }

        final String activeKey;
        if (defName != null) {
            final Ref existing = context.registry().refFor(typeName);
            if (existing != null) {
                return existing.toSchema().withParent(parent).withReflectType(type);
            }
            if (context.cycles().isActive(typeName)) {
                context.cycles().markReferenced(typeName);
                final Ref handle = typeName.equals(context.rootTypeName()) && !context.isRootRef()
                        ? Ref.root() : new Ref(context.getDefinitionsPrefix(), defName);
                logger.trace("Recursive reference to {} at {}", typeName, context.path());
                return handle.toSchema().withParent(parent).withReflectType(type);
            }
            activeKey = typeName;
        } else if (value == null && isStructure(type)) {
            activeKey = "inline:" + typeName;
            if (context.cycles().isActive(activeKey)) {
                throw new UnsupportedTypeException(context.dottedPath(), type,
                        "recursive type without definition name");
            }
        } else {
            activeKey = null;
        }

        final Schema schema = new Schema().withParent(parent).withReflectType(type);
        boolean referenced = false;
        if (activeKey != null) {
            context.cycles().enter(activeKey);
        }
        try {
            expand(resolved.exactType(), type, value, mapped ? null : resolved.annotated(), schema, context);
        } finally {
            if (activeKey != null) {
                referenced = context.cycles().exit(activeKey);
            }
        }
        return register(schema, type, typeName, defName, root, referenced, context);
    }

    private void expand(final boolean exactType, final Type type, @Nullable final Object value,
                        @Nullable final AnnotatedType annotated, final Schema schema, final ReflectContext context)
            throws SchemaException {
        final Class<?> raw = Types.rawType(type);
        final Object capabilities = capabilitySource(value, raw, exactType);

        if (context.hooks().interceptSchema(new InterceptSchemaParams(context, capabilities, type, schema, false))) {
            return;
        }

        if (WellKnownTypes.apply(raw, schema)) {
            return;
        }

        applyTitle(capabilities, value, raw, schema, context);

        composer.compose(capabilities, schema, context,
                (alternative, keyword, parentSchema) -> walkChild(Sample.of(alternative), keyword, parentSchema, context));

        dispatch(type, raw, value, annotated, schema, context);

        if (context.hooks().interceptSchema(new InterceptSchemaParams(context, capabilities, type, schema, true))) {
            return;
        }

        if (capabilities instanceof Preparer preparer) {
            HookPipeline.call(context.dottedPath(), "preparer", () -> {
                preparer.prepareJsonSchema(schema);
                return null;
            });
        }
    }

    private Schema register(final Schema schema, final Type type, final String typeName, @Nullable final String defName,
                            final boolean root, final boolean referenced, final ReflectContext context) {
        if (root && context.isRootNullable()) {
            schema.addType(SimpleType.NULL);
        }
        if (schema.getRef() != null || defName == null) {
            return schema;
        }
        if (root && !context.isRootRef()) {
            return schema;
        }
        if (!referenced) {
            if (context.isInlineRefs() || inlineDefinitions.contains(typeName)) {
                return schema;
            }
            if (schema.isTrivial() && schema.getType() != null
                    && !schema.hasType(SimpleType.OBJECT) && !schema.hasType(SimpleType.ARRAY)) {
                return schema;
            }
        }
        final Ref ref = new Ref(context.getDefinitionsPrefix(), defName);
        context.registry().register(typeName, ref, schema);
        return ref.toSchema().withParent(schema.getParent()).withReflectType(type);
    }

    private Schema walkChild(final Sample sample, final String segment, final Schema parent,
                             final ReflectContext context) throws SchemaException {
        context.pushPath(segment);
        try {
            return walk(sample, context, parent);
        } finally {
            context.popPath();
        }
    }

    // ---- kinds ----

    private void dispatch(final Type type, final Class<?> raw, @Nullable final Object value,
                          @Nullable final AnnotatedType annotated, final Schema schema, final ReflectContext context)
            throws SchemaException {
        if (value instanceof VirtualObject virtual) {
            schema.addType(SimpleType.OBJECT);
            walkVirtualProperties(virtual, schema, context);
            if (virtual.nullable()) {
                schema.addType(SimpleType.NULL);
            }
            return;
        }
        if (isUnsupported(raw, value)) {
            if (context.isSkipUnsupportedProperties()) {
                throw new SkipPropertyException();
            }
            throw new UnsupportedTypeException(context.dottedPath(), type);
        }
        if (raw.isArray() || Iterable.class.isAssignableFrom(raw) || Map.class.isAssignableFrom(raw)) {
            if (value == null) {
                dispatchContainer(type, raw, null, annotated, schema, context);
                return;
            }
            context.cycles().enterSample(value);
            try {
                dispatchContainer(type, raw, value, annotated, schema, context);
            } finally {
                context.cycles().exitSample(value);
            }
            return;
        }
        if (BOOLEAN_TYPES.contains(raw)) {
            schema.addType(SimpleType.BOOLEAN);
            return;
        }
        if (Types.isIntegral(raw)) {
            schema.addType(SimpleType.INTEGER);
            return;
        }
        if (Number.class.isAssignableFrom(raw) || raw == double.class || raw == float.class) {
            schema.addType(SimpleType.NUMBER);
            return;
        }
        if (STRING_TYPES.contains(raw) || CharSequence.class.isAssignableFrom(raw)) {
            schema.addType(SimpleType.STRING);
            return;
        }
        if (raw.isEnum()) {
            schema.addType(SimpleType.STRING);
            if (schema.getEnum() == null) {
                schema.withEnum(enumNames(raw));
            }
            return;
        }
        final Method jsonValue = jsonValueMethod(raw);
        if (jsonValue != null) {
            scalarOf(jsonValue.getReturnType(), schema);
            return;
        }
        if (raw.isInterface()) {
            return;
        }
        if (Types.isJdkType(raw)) {
            if (context.isSkipUnsupportedProperties()) {
                throw new SkipPropertyException();
            }
            throw new UnsupportedTypeException(context.dottedPath(), type);
        }
        schema.addType(SimpleType.OBJECT);
        walkProperties(value, type, schema, context);
    }

    private void dispatchContainer(final Type type, final Class<?> raw, @Nullable final Object value,
                                   @Nullable final AnnotatedType annotated, final Schema schema,
                                   final ReflectContext context) throws SchemaException {
        if (raw.isArray()) {
            final Object first = value != null && Array.getLength(value) > 0 ? Array.get(value, 0) : null;
            walkItems(type instanceof Class<?> ? raw.getComponentType() : componentType(type),
                    elementSample(first, context), arrayElementAnnotation(annotated), schema, context);
            return;
        }
        if (Iterable.class.isAssignableFrom(raw)) {
            final Object first = value instanceof Iterable<?> iterable && iterable.iterator().hasNext()
                    ? iterable.iterator().next() : null;
            walkItems(Types.typeArgument(type, Iterable.class, 0), elementSample(first, context),
                    typeArgumentAnnotation(annotated, 0, 1), schema, context);
            return;
        }
        final Object first = value instanceof Map<?, ?> map && !map.isEmpty() ? map.values().iterator().next() : null;
        final Sample element = new Sample(elementSample(first, context), Types.typeArgument(type, Map.class, 1),
                isNullable(typeArgumentAnnotation(annotated, 1, 2)), false, typeArgumentAnnotation(annotated, 1, 2));
        schema.addType(SimpleType.OBJECT);
        final Schema additional = walkChild(element, "{}", schema, context);
        nullability.applyToElement(additional, element.resolve().nullable());
        schema.withAdditionalProperties(additional.toSchemaOrBool());
    }

    /**
     * Drops element samples that are containers already walked on the current path, so the element
     * is reflected from its declared type.
     */
    private static @Nullable Object elementSample(@Nullable final Object element, final ReflectContext context) {
        if (element != null && context.cycles().isActiveSample(element)) {
            logger.trace("Container sample contains itself at {}", context.path());
            return null;
        }
        return element;
    }

    private void walkItems(final Type elementType, @Nullable final Object first, @Nullable final AnnotatedType annotated,
                           final Schema schema, final ReflectContext context) throws SchemaException {
        final Sample element = new Sample(first, elementType, isNullable(annotated), false, annotated);
        final Schema items = walkChild(element, "[]", schema, context);
        nullability.applyToElement(items, element.resolve().nullable());
        schema.addType(SimpleType.ARRAY);
        schema.withItems(items.toSchemaOrBool());
    }

    private static Type componentType(final Type arrayType) {
        if (arrayType instanceof GenericArrayType generic) {
            return generic.getGenericComponentType();
        }
        return Types.rawType(arrayType).getComponentType();
    }

    // ---- properties ----

    private void walkProperties(@Nullable final Object value, final Type type, final Schema schema,
                                final ReflectContext context) throws SchemaException {
        final Class<?> raw = Types.rawType(type);
        final Class<?> superclass = raw.getSuperclass();
        if (superclass != null && !raw.isRecord() && !raw.isEnum() && !Types.isJdkType(superclass)) {
            final Type superType = Types.supertype(type, superclass);
            if (EmbedReferencer.class.isAssignableFrom(superclass)) {
                schema.addAllOf(walkChild(Sample.exact(value, superType), "allOf", schema, context).toSchemaOrBool());
            } else {
                walkProperties(value, superType, schema, context);
            }
        }

        constraints.applyToObject(schema, FieldTags.of(raw).without("title", "description"), context);

        for (final PropertyField field : PropertyFields.declaredBy(value, type)) {
            placeProperty(field, schema, context);
        }
    }

    private void walkVirtualProperties(final VirtualObject virtual, final Schema schema, final ReflectContext context)
            throws SchemaException {
        if (virtual.title() != null) {
            schema.withTitle(virtual.title());
        }
        if (virtual.description() != null) {
            schema.withDescription(virtual.description());
        }
        for (final VirtualObject.VirtualField field : virtual.fields()) {
            final Object fieldValue = field.value();
            final Type fieldType = fieldValue != null ? fieldValue.getClass() : Object.class;
            placeProperty(new PropertyField(field.name(), fieldType, fieldValue, field.tags(), false, false, null),
                    schema, context);
        }
    }

    private void placeProperty(final PropertyField field, final Schema parent, final ReflectContext context)
            throws SchemaException {
        final FieldTags.NameTag nameTag = context.lookupName(field);
        if (nameTag != null && "-".equals(nameTag.name())) {
            return;
        }

        if (field.unwrapped()) {
            placeEmbedded(field, parent, context);
            return;
        }

        if (nameTag == null && context.isRequireNameTags()) {
            return;
        }

        final String propertyName = nameTag != null && !nameTag.name().isEmpty() ? nameTag.name() : field.name();
        final boolean omitEmpty = nameTag != null && nameTag.omitEmpty();

        context.pushPath(propertyName);
        try {
            final String path = context.dottedPath();
            final boolean required = ConstraintExtractor.readBool(field.tags(), "required", path);
            final Boolean nullable = ConstraintExtractor.readOptionalBool(field.tags(), "nullable", path);
            try {
                context.hooks().interceptProperty(
                        new InterceptPropParams(context, context.path(), propertyName, field, null, parent, false));

                final Schema property = walk(field.toSample(), context, parent);
                nullability.apply(property, field, omitEmpty, nullable, context);
                constraints.applyToProperty(property, field.tags(), context);

                context.hooks().interceptProperty(
                        new InterceptPropParams(context, context.path(), propertyName, field, property, parent, true));

                parent.withProperty(propertyName, property.toSchemaOrBool());
                if (required) {
                    parent.addRequired(propertyName);
                }
            } catch (final SkipPropertyException e) {
                logger.debug("Skipping property {}", path);
            }
        } finally {
            context.popPath();
        }
    }

    private void placeEmbedded(final PropertyField field, final Schema parent, final ReflectContext context)
            throws SchemaException {
        final Sample sample = field.toSample().resolve();
        if (sample.type() == null) {
            return;
        }
        if (EmbedReferencer.class.isAssignableFrom(Types.rawType(sample.type()))) {
            parent.addAllOf(walkChild(sample, "allOf", parent, context).toSchemaOrBool());
            return;
        }
        walkProperties(sample.value(), sample.type(), parent, context);
    }

    // ---- helpers ----

    private @Nullable Object findMapping(final Type type) {
        final Object exact = typeMappings.get(type);
        if (exact != null) {
            return exact;
        }
        return type instanceof Class<?> ? null : typeMappings.get(Types.rawType(type));
    }

    /**
     * The object whose capabilities apply: the sample itself, or a default instance of the type when no
     * (matching) sample is available.
     */
    private static @Nullable Object capabilitySource(@Nullable final Object value, final Class<?> raw,
                                                     final boolean exactType) {
        if (value != null && (!exactType || value.getClass() == raw)) {
            return value;
        }
        if (Types.isJdkType(raw) || !hasCapability(raw)) {
            return null;
        }
        return ZeroValues.instantiate(raw);
    }

    private static boolean hasCapability(final Class<?> raw) {
        for (final Class<?> capability : CAPABILITIES) {
            if (capability.isAssignableFrom(raw)) {
                return true;
            }
        }
        return false;
    }

    private void applyTitle(@Nullable final Object capabilities, @Nullable final Object value, final Class<?> raw,
                            final Schema schema, final ReflectContext context) throws SchemaException {
        if (!(value instanceof VirtualObject) && !Types.isJdkType(raw)) {
            constraints.populate(schema, titleTags(raw), context.dottedPath());
        }
        final String path = context.dottedPath();
        if (capabilities instanceof Titled titled) {
            schema.withTitle(HookPipeline.call(path, "title", titled::title));
        }
        if (capabilities instanceof Described described) {
            schema.withDescription(HookPipeline.call(path, "description", described::description));
        }
    }

    private static FieldTags titleTags(final Class<?> raw) {
        return FieldTags.of(raw).only("title", "description");
    }

    private static boolean isStructure(final Type type) {
        final Types.Kind kind = Types.kindOf(type);
        return kind == Types.Kind.OBJECT || kind == Types.Kind.ARRAY || kind == Types.Kind.MAP;
    }

    private static boolean isUnsupported(final Class<?> raw, @Nullable final Object value) {
        if (raw.isSynthetic() || (value != null && value.getClass().isSynthetic())) {
            return true;
        }
        if (raw.getPackageName().equals("java.util.function") || raw.isAnnotationPresent(FunctionalInterface.class)) {
            return true;
        }
        for (final Class<?> unsupported : UNSUPPORTED_TYPES) {
            if (unsupported.isAssignableFrom(raw)) {
                return true;
            }
        }
        return false;
    }

    private static List<Object> enumNames(final Class<?> enumType) {
        final List<Object> names = new ArrayList<>();
        for (final Object constant : enumType.getEnumConstants()) {
            final String name = ((Enum<?>) constant).name();
            String jsonName = name;
            try {
                final JsonProperty property = enumType.getField(name).getAnnotation(JsonProperty.class);
                if (property != null && !property.value().isEmpty()) {
                    jsonName = property.value();
                }
            } catch (final NoSuchFieldException e) {
                logger.debug("Enum constant {} of {} has no field", name, enumType.getName());
            }
            names.add(jsonName);
        }
        return names;
    }

    private static @Nullable Method jsonValueMethod(final Class<?> raw) {
        for (final Method method : raw.getMethods()) {
            final JsonValue jsonValue = method.getAnnotation(JsonValue.class);
            if (jsonValue != null && jsonValue.value() && method.getParameterCount() == 0
                    && method.getReturnType() != void.class) {
                return method;
            }
        }
        return null;
    }

    private static void scalarOf(final Class<?> type, final Schema schema) {
        if (BOOLEAN_TYPES.contains(type)) {
            schema.addType(SimpleType.BOOLEAN);
        } else if (Types.isIntegral(type)) {
            schema.addType(SimpleType.INTEGER);
        } else if (Number.class.isAssignableFrom(type) || type == double.class || type == float.class) {
            schema.addType(SimpleType.NUMBER);
        } else if (STRING_TYPES.contains(type) || CharSequence.class.isAssignableFrom(type)) {
            schema.addType(SimpleType.STRING);
        }
    }

    private static boolean isNullable(@Nullable final AnnotatedType annotated) {
        return annotated != null && annotated.isAnnotationPresent(Nullable.class);
    }

    /**
     * Annotated element type of an array declaration.
     */
    private static @Nullable AnnotatedType arrayElementAnnotation(@Nullable final AnnotatedType declaration) {
        return declaration instanceof AnnotatedArrayType array ? array.getAnnotatedGenericComponentType() : null;
    }

    /**
     * Annotated type argument of a generic declaration, if the declaration has the expected arity.
     */
    private static @Nullable AnnotatedType typeArgumentAnnotation(@Nullable final AnnotatedType declaration,
                                                                  final int index, final int arity) {
        if (declaration instanceof AnnotatedParameterizedType parameterized) {
            final AnnotatedType[] arguments = parameterized.getAnnotatedActualTypeArguments();
            if (arguments.length == arity) {
                return arguments[index];
            }
        }
        return null;
    }
}
