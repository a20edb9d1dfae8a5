package de.mirkosertic.jsonschema;

import de.mirkosertic.jsonschema.model.Schema;
import de.mirkosertic.jsonschema.util.FieldTags;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Configuration and mutable state of a single reflection invocation.
 *
 * <p>A fresh context is created for every call of {@link Reflector#reflect(Object, ReflectOption...)},
 * options and interceptors configure it before the walk starts. Contexts are not thread safe and must
 * not be shared between invocations.</p>
 */
public final class ReflectContext {

    public static final String DEFAULT_DEFINITIONS_PREFIX = "#/definitions/";

    private String definitionsPrefix = DEFAULT_DEFINITIONS_PREFIX;
    private String propertyNameTag = FieldTags.JSON_TAG;
    private List<String> additionalNameTags = List.of();
    private Map<String, String> propertyNameMapping = Map.of();
    private boolean requireNameTags;
    private boolean inlineRefs;
    private boolean rootRef;
    private boolean rootNullable;
    private boolean envelopNullability;
    private boolean skipUnsupportedProperties;
    private boolean skipNonConstraints;
    private @Nullable BiConsumer<String, Schema> definitionCollector;

    private final HookPipeline hooks = new HookPipeline();
    private final Map<String, Object> attributes = new HashMap<>();

    private final List<String> path = new ArrayList<>(List.of("#"));
    private final DefinitionRegistry registry = new DefinitionRegistry();
    private final CycleDetector cycles = new CycleDetector();
    private @Nullable String rootTypeName;
    private int virtualObjectCounter;

    ReflectContext() {
    }

    // ---- configuration ----

    public String getDefinitionsPrefix() {
        return definitionsPrefix;
    }

    public void setDefinitionsPrefix(final String definitionsPrefix) {
        this.definitionsPrefix = definitionsPrefix;
    }

    public String getPropertyNameTag() {
        return propertyNameTag;
    }

    public void setPropertyNameTag(final String propertyNameTag) {
        this.propertyNameTag = propertyNameTag;
    }

    public List<String> getAdditionalNameTags() {
        return additionalNameTags;
    }

    public void setAdditionalNameTags(final List<String> additionalNameTags) {
        this.additionalNameTags = List.copyOf(additionalNameTags);
    }

    public Map<String, String> getPropertyNameMapping() {
        return propertyNameMapping;
    }

    /**
     * Explicit property names by declared field name, consulted before any name tag.
     */
    public void setPropertyNameMapping(final Map<String, String> propertyNameMapping) {
        this.propertyNameMapping = Map.copyOf(propertyNameMapping);
    }

    public boolean isRequireNameTags() {
        return requireNameTags;
    }

    /**
     * When enabled, fields without a property name under the configured tags are skipped.
     */
    public void setRequireNameTags(final boolean requireNameTags) {
        this.requireNameTags = requireNameTags;
    }

    public boolean isInlineRefs() {
        return inlineRefs;
    }

    public void setInlineRefs(final boolean inlineRefs) {
        this.inlineRefs = inlineRefs;
    }

    public boolean isRootRef() {
        return rootRef;
    }

    public void setRootRef(final boolean rootRef) {
        this.rootRef = rootRef;
    }

    public boolean isRootNullable() {
        return rootNullable;
    }

    public void setRootNullable(final boolean rootNullable) {
        this.rootNullable = rootNullable;
    }

    public boolean isEnvelopNullability() {
        return envelopNullability;
    }

    public void setEnvelopNullability(final boolean envelopNullability) {
        this.envelopNullability = envelopNullability;
    }

    public boolean isSkipUnsupportedProperties() {
        return skipUnsupportedProperties;
    }

    public void setSkipUnsupportedProperties(final boolean skipUnsupportedProperties) {
        this.skipUnsupportedProperties = skipUnsupportedProperties;
    }

    public boolean isSkipNonConstraints() {
        return skipNonConstraints;
    }

    /**
     * When enabled, {@code default}, {@code example} and {@code examples} keywords are not collected.
     */
    public void setSkipNonConstraints(final boolean skipNonConstraints) {
        this.skipNonConstraints = skipNonConstraints;
    }

    public @Nullable BiConsumer<String, Schema> getDefinitionCollector() {
        return definitionCollector;
    }

    /**
     * Receives definitions instead of the root schema's {@code definitions} keyword.
     */
    public void setDefinitionCollector(@Nullable final BiConsumer<String, Schema> definitionCollector) {
        this.definitionCollector = definitionCollector;
    }

    public HookPipeline hooks() {
        return hooks;
    }

    /**
     * Free form values shared between interceptors of one invocation.
     */
    public Map<String, Object> attributes() {
        return attributes;
    }

    // ---- walk state ----

    /**
     * Current path, starting with {@code #}, followed by property names and container markers.
     */
    public List<String> path() {
        return Collections.unmodifiableList(path);
    }

    /**
     * Current path as dotted string without the leading {@code #}.
     */
    public String dottedPath() {
        return String.join(".", path.subList(1, path.size()));
    }

    /**
     * Looks up the definition a reference points to, empty if it is not (yet) registered.
     */
    public Schema definitionFor(final String reference) {
        final Schema schema = registry.definition(reference);
        return schema != null ? schema : new Schema();
    }

    void pushPath(final String segment) {
        path.add(segment);
    }

    void popPath() {
        path.remove(path.size() - 1);
    }

    boolean isRoot() {
        return path.size() == 1;
    }

    DefinitionRegistry registry() {
        return registry;
    }

    CycleDetector cycles() {
        return cycles;
    }

    @Nullable String rootTypeName() {
        return rootTypeName;
    }

    void rootTypeName(final String rootTypeName) {
        this.rootTypeName = rootTypeName;
    }

    String nextVirtualObjectName() {
        virtualObjectCounter++;
        return "VirtualObject" + virtualObjectCounter;
    }

    /**
     * Resolves the property name of a field: explicit mapping first, then the configured name tag,
     * then the additional tags in order.
     */
    FieldTags.@Nullable NameTag lookupName(final PropertyField field) {
        final String mapped = propertyNameMapping.get(field.name());
        if (mapped != null) {
            return new FieldTags.NameTag(mapped, false);
        }
        final FieldTags.NameTag primary = field.tags().name(propertyNameTag);
        if (primary != null) {
            return primary;
        }
        for (final String tag : additionalNameTags) {
            final FieldTags.NameTag additional = field.tags().name(tag);
            if (additional != null) {
                return additional;
            }
        }
        return null;
    }
}
