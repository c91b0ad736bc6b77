package info.isaksson.erland.androidtoflutter.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Behaviors keyed by view id or event (method) name, in discovery order.
 */
public final class BindingTable {

    public static final BindingTable EMPTY = new BindingTable(null);

    @JsonProperty("entries")
    public final Map<String, List<Behavior>> entries;

    @JsonCreator
    public BindingTable(@JsonProperty("entries") Map<String, List<Behavior>> entries) {
        if (entries == null || entries.isEmpty()) {
            this.entries = Collections.emptyMap();
        } else {
            Map<String, List<Behavior>> copy = new LinkedHashMap<>();
            for (var e : entries.entrySet()) {
                copy.put(e.getKey(), List.copyOf(e.getValue()));
            }
            this.entries = Collections.unmodifiableMap(copy);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Behavior> get(String key) {
        List<Behavior> list = entries.get(key);
        return list == null ? List.of() : list;
    }

    public Set<String> keys() {
        return entries.keySet();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public Optional<ClickBinding> clickBinding(String viewId) {
        if (viewId == null) return Optional.empty();
        for (Behavior b : get(viewId)) {
            if (b instanceof ClickBinding click) return Optional.of(click);
        }
        return Optional.empty();
    }

    /** All behaviors of the given type, in key order then discovery order. */
    public <T extends Behavior> List<T> all(Class<T> type) {
        List<T> out = new ArrayList<>();
        for (List<Behavior> list : entries.values()) {
            for (Behavior b : list) {
                if (type.isInstance(b)) out.add(type.cast(b));
            }
        }
        return out;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BindingTable)) return false;
        return entries.equals(((BindingTable) o).entries);
    }

    @Override public int hashCode() {
        return entries.hashCode();
    }

    @Override public String toString() {
        return "BindingTable" + entries;
    }

    public static final class Builder {
        private final Map<String, List<Behavior>> entries = new LinkedHashMap<>();

        private Builder() {}

        public Builder bind(String key, Behavior behavior) {
            if (key == null || behavior == null) return this;
            List<Behavior> list = entries.computeIfAbsent(key, k -> new ArrayList<>());
            if (!list.contains(behavior)) list.add(behavior);
            return this;
        }

        public BindingTable build() {
            return new BindingTable(entries);
        }
    }
}
