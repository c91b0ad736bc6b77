package info.isaksson.erland.androidtoflutter.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Generic element of a parsed layout document: tag, attributes in document order and children.
 *
 * <p>Attribute names have their {@code android:}/{@code app:} prefixes stripped; {@code tools:}
 * attributes keep theirs. Instances are immutable.</p>
 */
public final class MarkupNode {

    public final String tag;
    public final Map<String, String> attributes;
    public final List<MarkupNode> children;
    /** Document the node was parsed from, or null for synthetic nodes. */
    public final String documentId;

    public MarkupNode(String tag, Map<String, String> attributes, List<MarkupNode> children, String documentId) {
        this.tag = Objects.requireNonNull(tag, "tag must not be null");
        this.attributes = attributes == null || attributes.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.children = children == null ? List.of() : List.copyOf(children);
        this.documentId = documentId;
    }

    public MarkupNode(String tag, Map<String, String> attributes, List<MarkupNode> children) {
        this(tag, attributes, children, null);
    }

    public String attr(String name) {
        return attributes.get(name);
    }

    public String attr(String name, String defaultValue) {
        String v = attributes.get(name);
        return v == null ? defaultValue : v;
    }

    public boolean hasAttr(String name) {
        return attributes.containsKey(name);
    }

    /** The view id without its {@code @+id/} prefix, or null. */
    public String id() {
        return stripIdRef(attributes.get("id"));
    }

    /** Tag without a package qualifier ({@code androidx.cardview.widget.CardView} → {@code CardView}). */
    public String simpleTag() {
        int dot = tag.lastIndexOf('.');
        return dot >= 0 ? tag.substring(dot + 1) : tag;
    }

    /**
     * Strips {@code @+id/}, {@code @id/} and {@code @android:id/} prefixes from an id reference.
     * Returns null for null/blank input.
     */
    public static String stripIdRef(String ref) {
        if (ref == null) return null;
        String s = ref.trim();
        if (s.isEmpty()) return null;
        int slash = s.indexOf('/');
        if (s.startsWith("@") && slash > 0) {
            s = s.substring(slash + 1);
        }
        return s.isEmpty() ? null : s;
    }

    /** Extracts the resource name from {@code @layout/foo}, {@code @drawable/foo} etc. */
    public static String resourceName(String ref) {
        if (ref == null) return null;
        String s = ref.trim();
        int slash = s.lastIndexOf('/');
        if (!s.startsWith("@") || slash < 0) return s.isEmpty() ? null : s;
        String name = s.substring(slash + 1);
        return name.isEmpty() ? null : name;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MarkupNode)) return false;
        MarkupNode that = (MarkupNode) o;
        return tag.equals(that.tag)
                && attributes.equals(that.attributes)
                && children.equals(that.children)
                && Objects.equals(documentId, that.documentId);
    }

    @Override public int hashCode() {
        return Objects.hash(tag, attributes, children, documentId);
    }

    @Override public String toString() {
        return "MarkupNode{" + tag + (id() == null ? "" : "#" + id()) + ", children=" + children.size() + "}";
    }
}
