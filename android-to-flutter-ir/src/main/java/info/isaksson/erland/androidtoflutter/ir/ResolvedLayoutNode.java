package info.isaksson.erland.androidtoflutter.ir;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A markup node with its layout semantics made explicit.
 *
 * <p>Every positionRef targets a sibling within the same parent's resolved children; the
 * resolver drops references that do not. Children appear in resolved order.</p>
 */
public final class ResolvedLayoutNode {

    public enum Origin {
        /** An ordinary markup element. */
        ELEMENT,
        /** Wrapper keeping an include/stub's own attributes around the substituted root. */
        INCLUDE,
        /** Zero-size stand-in for an unresolvable or recursive reference. */
        PLACEHOLDER
    }

    public final MarkupNode markup;
    public final Origin origin;
    public final ContainerKind containerKind;
    public final Orientation orientation;
    public final List<PositionRef> positionRefs;
    public final Alignment alignment;
    public final boolean expanded;
    public final Double horizontalBias;
    public final Double verticalBias;
    public final String placeholderReason;
    public final List<ResolvedLayoutNode> children;

    private ResolvedLayoutNode(Builder b) {
        this.markup = Objects.requireNonNull(b.markup, "markup must not be null");
        this.origin = b.origin;
        this.containerKind = b.containerKind;
        this.orientation = b.orientation;
        this.positionRefs = List.copyOf(b.positionRefs);
        this.alignment = b.alignment;
        this.expanded = b.expanded;
        this.horizontalBias = b.horizontalBias;
        this.verticalBias = b.verticalBias;
        this.placeholderReason = b.placeholderReason;
        this.children = List.copyOf(b.children);
    }

    public static Builder builder(MarkupNode markup) {
        return new Builder(markup);
    }

    /** A zero-size placeholder standing in for {@code source}. */
    public static ResolvedLayoutNode placeholder(MarkupNode source, String reason) {
        Builder b = new Builder(source);
        b.origin = Origin.PLACEHOLDER;
        b.placeholderReason = reason;
        return b.build();
    }

    public Builder toBuilder() {
        Builder b = new Builder(markup);
        b.origin = origin;
        b.containerKind = containerKind;
        b.orientation = orientation;
        b.positionRefs.addAll(positionRefs);
        b.alignment = alignment;
        b.expanded = expanded;
        b.horizontalBias = horizontalBias;
        b.verticalBias = verticalBias;
        b.placeholderReason = placeholderReason;
        b.children.addAll(children);
        return b;
    }

    public String tag() {
        return markup.tag;
    }

    public String id() {
        return markup.id();
    }

    public Map<String, String> attributes() {
        return markup.attributes;
    }

    public String attr(String name) {
        return markup.attr(name);
    }

    public String attr(String name, String defaultValue) {
        return markup.attr(name, defaultValue);
    }

    public boolean isPlaceholder() {
        return origin == Origin.PLACEHOLDER;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResolvedLayoutNode)) return false;
        ResolvedLayoutNode that = (ResolvedLayoutNode) o;
        return expanded == that.expanded
                && markup.equals(that.markup)
                && origin == that.origin
                && containerKind == that.containerKind
                && orientation == that.orientation
                && positionRefs.equals(that.positionRefs)
                && alignment == that.alignment
                && Objects.equals(horizontalBias, that.horizontalBias)
                && Objects.equals(verticalBias, that.verticalBias)
                && Objects.equals(placeholderReason, that.placeholderReason)
                && children.equals(that.children);
    }

    @Override public int hashCode() {
        return Objects.hash(markup, origin, containerKind, orientation, positionRefs, alignment, expanded,
                horizontalBias, verticalBias, placeholderReason, children);
    }

    @Override public String toString() {
        return "ResolvedLayoutNode{" + markup.tag
                + (id() == null ? "" : "#" + id())
                + ", origin=" + origin
                + ", container=" + containerKind
                + ", children=" + children.size() + "}";
    }

    public static final class Builder {
        private final MarkupNode markup;
        private Origin origin = Origin.ELEMENT;
        private ContainerKind containerKind = ContainerKind.NONE;
        private Orientation orientation = Orientation.NONE;
        private final List<PositionRef> positionRefs = new ArrayList<>();
        private Alignment alignment = Alignment.NONE;
        private boolean expanded;
        private Double horizontalBias;
        private Double verticalBias;
        private String placeholderReason;
        private final List<ResolvedLayoutNode> children = new ArrayList<>();

        private Builder(MarkupNode markup) {
            this.markup = markup;
        }

        public Builder origin(Origin origin) {
            this.origin = Objects.requireNonNull(origin);
            return this;
        }

        public Builder containerKind(ContainerKind containerKind) {
            this.containerKind = Objects.requireNonNull(containerKind);
            return this;
        }

        public Builder orientation(Orientation orientation) {
            this.orientation = Objects.requireNonNull(orientation);
            return this;
        }

        public Builder positionRefs(List<PositionRef> refs) {
            this.positionRefs.clear();
            if (refs != null) this.positionRefs.addAll(refs);
            return this;
        }

        public Builder alignment(Alignment alignment) {
            this.alignment = Objects.requireNonNull(alignment);
            return this;
        }

        public Builder expanded(boolean expanded) {
            this.expanded = expanded;
            return this;
        }

        public Builder bias(Double horizontal, Double vertical) {
            this.horizontalBias = horizontal;
            this.verticalBias = vertical;
            return this;
        }

        public Builder children(List<ResolvedLayoutNode> children) {
            this.children.clear();
            if (children != null) this.children.addAll(children);
            return this;
        }

        public Builder addChild(ResolvedLayoutNode child) {
            this.children.add(Objects.requireNonNull(child));
            return this;
        }

        public ResolvedLayoutNode build() {
            return new ResolvedLayoutNode(this);
        }
    }
}
