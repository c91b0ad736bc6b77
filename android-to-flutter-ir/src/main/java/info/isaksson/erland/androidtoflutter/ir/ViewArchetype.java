package info.isaksson.erland.androidtoflutter.ir;

/** Structural bucket of a custom view class. */
public enum ViewArchetype {
    /** Extends a text, image or button primitive. */
    TEXT_LIKE,
    /** Extends a layout/view group; usually inflates its own layout resource. */
    COMPOSITE_CONTAINER,
    /** Draws itself, or its ancestry is unknown. */
    CUSTOM_DRAWN
}
