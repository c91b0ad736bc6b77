package info.isaksson.erland.androidtoflutter.ir;

/**
 * Closed set of Flutter widget kinds the mapper can produce.
 *
 * <p>{@link #CONTAINER} is the generic fallback for unknown tags with children;
 * {@link #UNKNOWN_PLACEHOLDER} stands in for childless unknown tags and keeps the original
 * tag in {@link WidgetDescriptor#sourceTag}.</p>
 */
public enum WidgetKind {
    COLUMN("Column"),
    ROW("Row"),
    STACK("Stack"),
    CONTAINER("Container"),
    SIZED_BOX("SizedBox"),
    CARD("Card"),
    SINGLE_CHILD_SCROLL_VIEW("SingleChildScrollView"),
    LIST_VIEW("ListView"),
    TEXT("Text"),
    TEXT_BUTTON("TextButton"),
    ELEVATED_BUTTON("ElevatedButton"),
    ICON_BUTTON("IconButton"),
    FLOATING_ACTION_BUTTON("FloatingActionButton"),
    TEXT_FIELD("TextField"),
    IMAGE("Image"),
    CHECKBOX("CheckboxListTile"),
    SWITCH("SwitchListTile"),
    RADIO("RadioListTile"),
    SLIDER("Slider"),
    CIRCULAR_PROGRESS_INDICATOR("CircularProgressIndicator"),
    LINEAR_PROGRESS_INDICATOR("LinearProgressIndicator"),
    DIVIDER("Divider"),
    CUSTOM_PAINT("CustomPaint"),
    PLACEHOLDER("Placeholder"),
    UNKNOWN_PLACEHOLDER("SizedBox");

    private final String dartName;

    WidgetKind(String dartName) {
        this.dartName = dartName;
    }

    /** Flutter class the emitter instantiates for this kind. */
    public String dartName() {
        return dartName;
    }

    /** Kinds rendered with a {@code children:} list rather than a single {@code child:}. */
    public boolean isMultiChild() {
        return this == COLUMN || this == ROW || this == STACK || this == LIST_VIEW;
    }
}
