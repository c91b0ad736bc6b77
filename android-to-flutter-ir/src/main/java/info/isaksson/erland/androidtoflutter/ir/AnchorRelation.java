package info.isaksson.erland.androidtoflutter.ir;

import java.util.List;

/**
 * Sibling-relative positioning attributes of a relative container.
 *
 * <p>Ordering relations contribute edges to the sibling sort; alignment relations only
 * record the reference.</p>
 */
public enum AnchorRelation {
    BELOW(Orientation.VERTICAL, false, "layout_below"),
    ABOVE(Orientation.VERTICAL, true, "layout_above"),
    TO_END_OF(Orientation.HORIZONTAL, false, "layout_toEndOf", "layout_toRightOf"),
    TO_START_OF(Orientation.HORIZONTAL, true, "layout_toStartOf", "layout_toLeftOf"),
    ALIGN_TOP(Orientation.NONE, false, "layout_alignTop"),
    ALIGN_BOTTOM(Orientation.NONE, false, "layout_alignBottom"),
    ALIGN_START(Orientation.NONE, false, "layout_alignStart", "layout_alignLeft"),
    ALIGN_END(Orientation.NONE, false, "layout_alignEnd", "layout_alignRight"),
    ALIGN_BASELINE(Orientation.NONE, false, "layout_alignBaseline");

    private final Orientation axis;
    private final boolean precedesTarget;
    private final List<String> attributeNames;

    AnchorRelation(Orientation axis, boolean precedesTarget, String... attributeNames) {
        this.axis = axis;
        this.precedesTarget = precedesTarget;
        this.attributeNames = List.of(attributeNames);
    }

    /** Axis along which the relation orders siblings; NONE for alignment-only relations. */
    public Orientation axis() {
        return axis;
    }

    public boolean isOrdering() {
        return axis != Orientation.NONE;
    }

    /** True when the positioned view comes before its anchor ({@code above}, {@code toStartOf}). */
    public boolean precedesTarget() {
        return precedesTarget;
    }

    public List<String> attributeNames() {
        return attributeNames;
    }
}
