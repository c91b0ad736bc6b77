package info.isaksson.erland.androidtoflutter.layout;

import info.isaksson.erland.androidtoflutter.ir.ContainerKind;
import info.isaksson.erland.androidtoflutter.ir.Orientation;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Every layout tag the resolver and mapper know, plus {@link #UNKNOWN}.
 *
 * <p>Tags match by any alias (simple or fully qualified). A qualified tag from the
 * {@code android.widget}/{@code android.view}/{@code android.webkit} packages also matches by
 * its simple name.</p>
 */
public enum ViewTag {
    LINEAR_LAYOUT(ContainerKind.LINEAR, Orientation.VERTICAL, false,
            "LinearLayout", "androidx.appcompat.widget.LinearLayoutCompat", "LinearLayoutCompat"),
    RADIO_GROUP(ContainerKind.LINEAR, Orientation.VERTICAL, false, "RadioGroup"),
    TABLE_LAYOUT(ContainerKind.LINEAR, Orientation.VERTICAL, true, "TableLayout"),
    TABLE_ROW(ContainerKind.LINEAR, Orientation.HORIZONTAL, true, "TableRow"),
    RELATIVE_LAYOUT(ContainerKind.RELATIVE, Orientation.VERTICAL, true, "RelativeLayout"),
    CONSTRAINT_LAYOUT(ContainerKind.CONSTRAINT, Orientation.VERTICAL, true,
            "androidx.constraintlayout.widget.ConstraintLayout", "android.support.constraint.ConstraintLayout",
            "ConstraintLayout", "androidx.constraintlayout.motion.widget.MotionLayout"),
    FRAME_LAYOUT(ContainerKind.FRAME, Orientation.NONE, true,
            "FrameLayout", "androidx.coordinatorlayout.widget.CoordinatorLayout", "CoordinatorLayout"),
    SCROLL_VIEW(ContainerKind.FRAME, Orientation.VERTICAL, true,
            "ScrollView", "androidx.core.widget.NestedScrollView", "NestedScrollView"),
    HORIZONTAL_SCROLL_VIEW(ContainerKind.FRAME, Orientation.HORIZONTAL, true, "HorizontalScrollView"),
    CARD_VIEW(ContainerKind.FRAME, Orientation.NONE, true,
            "androidx.cardview.widget.CardView", "CardView", "com.google.android.material.card.MaterialCardView"),
    TEXT_INPUT_LAYOUT(ContainerKind.FRAME, Orientation.NONE, true,
            "com.google.android.material.textfield.TextInputLayout"),
    LIST_VIEW(ContainerKind.NONE, Orientation.VERTICAL, true,
            "ListView", "GridView", "androidx.recyclerview.widget.RecyclerView", "RecyclerView"),
    TEXT_VIEW("TextView", "CheckedTextView", "androidx.appcompat.widget.AppCompatTextView",
            "com.google.android.material.textview.MaterialTextView"),
    BUTTON("Button", "androidx.appcompat.widget.AppCompatButton", "com.google.android.material.button.MaterialButton"),
    IMAGE_BUTTON("ImageButton", "androidx.appcompat.widget.AppCompatImageButton"),
    FLOATING_ACTION_BUTTON("com.google.android.material.floatingactionbutton.FloatingActionButton",
            "com.google.android.material.floatingactionbutton.ExtendedFloatingActionButton", "FloatingActionButton"),
    EDIT_TEXT("EditText", "AutoCompleteTextView", "MultiAutoCompleteTextView",
            "androidx.appcompat.widget.AppCompatEditText", "com.google.android.material.textfield.TextInputEditText"),
    IMAGE_VIEW("ImageView", "androidx.appcompat.widget.AppCompatImageView",
            "com.google.android.material.imageview.ShapeableImageView"),
    CHECK_BOX("CheckBox", "androidx.appcompat.widget.AppCompatCheckBox",
            "com.google.android.material.checkbox.MaterialCheckBox"),
    SWITCH("Switch", "ToggleButton", "androidx.appcompat.widget.SwitchCompat", "SwitchCompat",
            "com.google.android.material.switchmaterial.SwitchMaterial",
            "com.google.android.material.materialswitch.MaterialSwitch"),
    RADIO_BUTTON("RadioButton", "androidx.appcompat.widget.AppCompatRadioButton",
            "com.google.android.material.radiobutton.MaterialRadioButton"),
    SEEK_BAR("SeekBar", "androidx.appcompat.widget.AppCompatSeekBar", "com.google.android.material.slider.Slider"),
    PROGRESS_BAR("ProgressBar", "com.google.android.material.progressindicator.CircularProgressIndicator",
            "com.google.android.material.progressindicator.LinearProgressIndicator"),
    SPACE("Space", "androidx.legacy.widget.Space"),
    VIEW("View"),
    CONSTRAINT_HELPER("androidx.constraintlayout.widget.Guideline", "androidx.constraintlayout.widget.Barrier",
            "androidx.constraintlayout.widget.Group", "androidx.constraintlayout.helper.widget.Flow",
            "Guideline", "Barrier"),
    WEB_VIEW("WebView"),
    MEDIA_VIEW("VideoView", "SurfaceView", "TextureView", "com.google.android.gms.maps.MapView",
            "androidx.media3.ui.PlayerView", "com.google.android.exoplayer2.ui.PlayerView"),
    SPINNER("Spinner", "androidx.appcompat.widget.AppCompatSpinner"),
    FRAGMENT("fragment", "androidx.fragment.app.FragmentContainerView", "FragmentContainerView"),
    INCLUDE("include"),
    MERGE("merge"),
    VIEW_STUB("ViewStub"),
    UNKNOWN();

    private static final Map<String, ViewTag> BY_ALIAS = new HashMap<>();
    private static final Map<String, ViewTag> BY_SIMPLE_NAME = new HashMap<>();
    private static final List<String> FRAMEWORK_PACKAGES = List.of("android.widget.", "android.view.", "android.webkit.");

    static {
        for (ViewTag t : values()) {
            for (String a : t.aliases) {
                BY_ALIAS.putIfAbsent(a, t);
                BY_SIMPLE_NAME.putIfAbsent(a.substring(a.lastIndexOf('.') + 1), t);
            }
        }
    }

    private final ContainerKind containerKind;
    private final Orientation defaultOrientation;
    private final boolean fixedOrientation;
    private final List<String> aliases;

    ViewTag(ContainerKind containerKind, Orientation defaultOrientation, boolean fixedOrientation, String... aliases) {
        this.containerKind = containerKind;
        this.defaultOrientation = defaultOrientation;
        this.fixedOrientation = fixedOrientation;
        this.aliases = List.of(aliases);
    }

    ViewTag(String... aliases) {
        this(ContainerKind.NONE, Orientation.NONE, true, aliases);
    }

    public static ViewTag of(String tag) {
        if (tag == null) return UNKNOWN;
        ViewTag t = BY_ALIAS.get(tag);
        if (t != null) return t;
        for (String pkg : FRAMEWORK_PACKAGES) {
            if (tag.startsWith(pkg)) {
                t = BY_ALIAS.get(tag.substring(pkg.length()));
                if (t != null) return t;
            }
        }
        return UNKNOWN;
    }

    /**
     * Like {@link #of(String)}, but also accepts the bare simple name of a qualified alias
     * ({@code AppCompatTextView}), as found in {@code extends} clauses.
     */
    public static ViewTag ofClassName(String name) {
        ViewTag t = of(name);
        if (t != UNKNOWN || name == null) return t;
        t = BY_SIMPLE_NAME.get(name.substring(name.lastIndexOf('.') + 1));
        return t == null ? UNKNOWN : t;
    }

    public static boolean isKnown(String tag) {
        return of(tag) != UNKNOWN;
    }

    public ContainerKind containerKind() {
        return containerKind;
    }

    public Orientation defaultOrientation() {
        return defaultOrientation;
    }

    /** True when the {@code orientation} attribute is not consulted. */
    public boolean hasFixedOrientation() {
        return fixedOrientation;
    }

    public List<String> aliases() {
        return aliases;
    }
}
