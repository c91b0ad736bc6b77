package info.isaksson.erland.androidtoflutter.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Framework-agnostic description of one renderable node: widget kind, literal properties,
 * wrappers (inner to outer) and mapped children.
 */
@JsonPropertyOrder({"kind", "sourceTag", "viewId", "properties", "wrappers", "children"})
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class WidgetDescriptor {

    public final WidgetKind kind;
    /** Original markup tag. */
    public final String sourceTag;
    public final String viewId;
    public final Map<String, WidgetProperty> properties;
    public final List<WidgetWrapper> wrappers;
    public final List<WidgetDescriptor> children;

    @JsonCreator
    public WidgetDescriptor(
            @JsonProperty("kind") WidgetKind kind,
            @JsonProperty("sourceTag") String sourceTag,
            @JsonProperty("viewId") String viewId,
            @JsonProperty("properties") Map<String, WidgetProperty> properties,
            @JsonProperty("wrappers") List<WidgetWrapper> wrappers,
            @JsonProperty("children") List<WidgetDescriptor> children
    ) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.sourceTag = sourceTag;
        this.viewId = viewId;
        this.properties = properties == null || properties.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        this.wrappers = wrappers == null ? List.of() : List.copyOf(wrappers);
        this.children = children == null ? List.of() : List.copyOf(children);
    }

    public static Builder builder(WidgetKind kind) {
        return new Builder(kind);
    }

    public WidgetProperty property(String key) {
        return properties.get(key);
    }

    public Optional<WidgetWrapper> wrapper(WidgetWrapper.Kind kind) {
        for (WidgetWrapper w : wrappers) {
            if (w.kind == kind) return Optional.of(w);
        }
        return Optional.empty();
    }

    public boolean hasWrapper(WidgetWrapper.Kind kind) {
        return wrapper(kind).isPresent();
    }

    /** Number of descriptors in this subtree, including this one. */
    public int size() {
        int n = 1;
        for (WidgetDescriptor c : children) n += c.size();
        return n;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WidgetDescriptor)) return false;
        WidgetDescriptor that = (WidgetDescriptor) o;
        return kind == that.kind
                && Objects.equals(sourceTag, that.sourceTag)
                && Objects.equals(viewId, that.viewId)
                && properties.equals(that.properties)
                && wrappers.equals(that.wrappers)
                && children.equals(that.children);
    }

    @Override public int hashCode() {
        return Objects.hash(kind, sourceTag, viewId, properties, wrappers, children);
    }

    @Override public String toString() {
        return "WidgetDescriptor{" + kind
                + (viewId == null ? "" : "#" + viewId)
                + ", children=" + children.size() + "}";
    }

    public static final class Builder {
        private WidgetKind kind;
        private String sourceTag;
        private String viewId;
        private final Map<String, WidgetProperty> properties = new LinkedHashMap<>();
        private final List<WidgetWrapper> wrappers = new ArrayList<>();
        private final List<WidgetDescriptor> children = new ArrayList<>();

        private Builder(WidgetKind kind) {
            this.kind = Objects.requireNonNull(kind);
        }

        public Builder kind(WidgetKind kind) {
            this.kind = Objects.requireNonNull(kind);
            return this;
        }

        public WidgetKind kind() {
            return kind;
        }

        public Builder sourceTag(String sourceTag) {
            this.sourceTag = sourceTag;
            return this;
        }

        public Builder viewId(String viewId) {
            this.viewId = viewId;
            return this;
        }

        public Builder property(String key, WidgetProperty value) {
            if (key != null && value != null) properties.put(key, value);
            return this;
        }

        public boolean hasProperty(String key) {
            return properties.containsKey(key);
        }

        public Builder wrap(WidgetWrapper wrapper) {
            if (wrapper != null) wrappers.add(wrapper);
            return this;
        }

        public Builder child(WidgetDescriptor child) {
            children.add(Objects.requireNonNull(child));
            return this;
        }

        public Builder children(List<WidgetDescriptor> list) {
            for (WidgetDescriptor c : list) child(c);
            return this;
        }

        public WidgetDescriptor build() {
            return new WidgetDescriptor(kind, sourceTag, viewId, properties, wrappers, children);
        }
    }
}
