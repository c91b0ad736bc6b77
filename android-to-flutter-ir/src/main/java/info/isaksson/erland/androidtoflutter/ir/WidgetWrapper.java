package info.isaksson.erland.androidtoflutter.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single-child widget wrapped around a descriptor (padding, alignment, Expanded...).
 * Wrappers are not part of the descriptor's child list.
 */
@JsonPropertyOrder({"kind", "properties"})
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class WidgetWrapper {

    public enum Kind {
        SIZED_BOX("SizedBox"),
        BACKGROUND("Container"),
        PADDING("Padding"),
        MARGIN("Padding"),
        VISIBILITY("Visibility"),
        CENTER("Center"),
        ALIGN("Align"),
        INK_WELL("InkWell"),
        POSITIONED_FILL("Positioned.fill"),
        EXPANDED("Expanded");

        private final String dartName;

        Kind(String dartName) {
            this.dartName = dartName;
        }

        public String dartName() {
            return dartName;
        }
    }

    public final Kind kind;
    public final Map<String, WidgetProperty> properties;

    @JsonCreator
    public WidgetWrapper(
            @JsonProperty("kind") Kind kind,
            @JsonProperty("properties") Map<String, WidgetProperty> properties
    ) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.properties = properties == null || properties.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public static WidgetWrapper of(Kind kind) {
        return new WidgetWrapper(kind, null);
    }

    public static WidgetWrapper of(Kind kind, String key, WidgetProperty value) {
        Map<String, WidgetProperty> p = new LinkedHashMap<>();
        p.put(key, value);
        return new WidgetWrapper(kind, p);
    }

    public WidgetProperty property(String key) {
        return properties.get(key);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WidgetWrapper)) return false;
        WidgetWrapper that = (WidgetWrapper) o;
        return kind == that.kind && properties.equals(that.properties);
    }

    @Override public int hashCode() {
        return Objects.hash(kind, properties);
    }

    @Override public String toString() {
        return kind + (properties.isEmpty() ? "" : properties.toString());
    }
}
