package de.mirkosertic.jsonschema;

import de.mirkosertic.jsonschema.util.FieldTags;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Object shape assembled at runtime instead of being declared as a class.
 *
 * <p>Each field carries a sample value that defines its type and tags that define its name and
 * keywords. Virtual objects are registered under their definition name; without one they are named
 * {@code VirtualObject1}, {@code VirtualObject2}, ... in the order they are met during one
 * invocation.</p>
 */
public final class VirtualObject {

    /**
     * @param name  declared field name
     * @param value sample value defining the property type
     * @param tags  property name tags and keywords
     */
    public record VirtualField(String name, @Nullable Object value, FieldTags tags) {
    }

    private final @Nullable String title;
    private final @Nullable String description;
    private final @Nullable String definitionName;
    private final boolean nullable;
    private final List<VirtualField> fields;

    private VirtualObject(final Builder builder) {
        this.title = builder.title;
        this.description = builder.description;
        this.definitionName = builder.definitionName;
        this.nullable = builder.nullable;
        this.fields = Collections.unmodifiableList(new ArrayList<>(builder.fields));
    }

    public static Builder builder() {
        return new Builder();
    }

    public @Nullable String title() {
        return title;
    }

    public @Nullable String description() {
        return description;
    }

    public @Nullable String definitionName() {
        return definitionName;
    }

    public boolean nullable() {
        return nullable;
    }

    public List<VirtualField> fields() {
        return fields;
    }

    public static final class Builder {

        private @Nullable String title;
        private @Nullable String description;
        private @Nullable String definitionName;
        private boolean nullable;
        private final List<VirtualField> fields = new ArrayList<>();

        private Builder() {
        }

        public Builder title(final String title) {
            this.title = title;
            return this;
        }

        public Builder description(final String description) {
            this.description = description;
            return this;
        }

        public Builder definitionName(final String definitionName) {
            this.definitionName = definitionName;
            return this;
        }

        public Builder nullable(final boolean nullable) {
            this.nullable = nullable;
            return this;
        }

        public Builder field(final String name, @Nullable final Object value, final FieldTags tags) {
            fields.add(new VirtualField(name, value, tags));
            return this;
        }

        public Builder field(final String name, @Nullable final Object value) {
            return field(name, value, FieldTags.empty());
        }

        public VirtualObject build() {
            return new VirtualObject(this);
        }
    }
}
