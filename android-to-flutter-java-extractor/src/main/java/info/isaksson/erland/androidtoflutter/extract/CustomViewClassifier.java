package info.isaksson.erland.androidtoflutter.extract;

import com.github.javaparser.ast.CompilationUnit;
import info.isaksson.erland.androidtoflutter.ir.ViewArchetype;
import info.isaksson.erland.androidtoflutter.ir.ViewClassification;
import info.isaksson.erland.androidtoflutter.ir.WidgetKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Assigns a {@link ViewArchetype} to custom view classes from their superclass chain.
 *
 * <p>Rules, in order: a class in the chain overriding {@code onDraw} is custom drawn; a chain
 * ending in a text, image or button primitive is text-like; a chain ending in a container
 * primitive, or in any class named {@code *Layout}, is a composite; a chain ending in a
 * drawing primitive or an unknown class is custom drawn unless the class inflates a layout.</p>
 *
 * <p>Results are cached per class name. Instances are safe to share between threads.</p>
 */
public final class CustomViewClassifier {

    private static final Logger log = LoggerFactory.getLogger(CustomViewClassifier.class);

    private static final Map<String, WidgetKind> LEAF_PRIMITIVES = Map.ofEntries(
            Map.entry("TextView", WidgetKind.TEXT),
            Map.entry("AppCompatTextView", WidgetKind.TEXT),
            Map.entry("MaterialTextView", WidgetKind.TEXT),
            Map.entry("CheckedTextView", WidgetKind.TEXT),
            Map.entry("EditText", WidgetKind.TEXT_FIELD),
            Map.entry("AppCompatEditText", WidgetKind.TEXT_FIELD),
            Map.entry("TextInputEditText", WidgetKind.TEXT_FIELD),
            Map.entry("AutoCompleteTextView", WidgetKind.TEXT_FIELD),
            Map.entry("Button", WidgetKind.ELEVATED_BUTTON),
            Map.entry("AppCompatButton", WidgetKind.ELEVATED_BUTTON),
            Map.entry("MaterialButton", WidgetKind.ELEVATED_BUTTON),
            Map.entry("ImageButton", WidgetKind.ICON_BUTTON),
            Map.entry("AppCompatImageButton", WidgetKind.ICON_BUTTON),
            Map.entry("FloatingActionButton", WidgetKind.FLOATING_ACTION_BUTTON),
            Map.entry("ImageView", WidgetKind.IMAGE),
            Map.entry("AppCompatImageView", WidgetKind.IMAGE),
            Map.entry("ShapeableImageView", WidgetKind.IMAGE),
            Map.entry("CheckBox", WidgetKind.CHECKBOX),
            Map.entry("AppCompatCheckBox", WidgetKind.CHECKBOX),
            Map.entry("MaterialCheckBox", WidgetKind.CHECKBOX),
            Map.entry("Switch", WidgetKind.SWITCH),
            Map.entry("SwitchCompat", WidgetKind.SWITCH),
            Map.entry("SwitchMaterial", WidgetKind.SWITCH),
            Map.entry("ToggleButton", WidgetKind.SWITCH),
            Map.entry("RadioButton", WidgetKind.RADIO),
            Map.entry("AppCompatRadioButton", WidgetKind.RADIO),
            Map.entry("SeekBar", WidgetKind.SLIDER),
            Map.entry("AppCompatSeekBar", WidgetKind.SLIDER),
            Map.entry("ProgressBar", WidgetKind.CIRCULAR_PROGRESS_INDICATOR)
    );

    private static final Set<String> CONTAINER_PRIMITIVES = Set.of(
            "ViewGroup", "CardView", "MaterialCardView", "ScrollView", "NestedScrollView",
            "HorizontalScrollView", "RecyclerView", "ListView", "GridView", "ViewPager",
            "ViewPager2", "Toolbar", "RadioGroup", "TableRow", "ViewFlipper", "ViewAnimator",
            "ChipGroup", "BottomNavigationView", "NavigationView", "AppBarLayout");

    private static final Set<String> DRAWING_PRIMITIVES = Set.of("View", "SurfaceView", "TextureView", "GLSurfaceView");

    private final ClassSourceIndex index;
    private final Map<String, Optional<ViewClassification>> cache = new ConcurrentHashMap<>();

    public CustomViewClassifier(ClassSourceIndex index) {
        this.index = index == null ? ClassSourceIndex.EMPTY : index;
    }

    /**
     * Classify the class named by a markup tag. Empty when the class is not declared in the
     * indexed sources.
     */
    public Optional<ViewClassification> classify(String tagName) {
        if (tagName == null || tagName.isBlank()) return Optional.empty();
        return cache.computeIfAbsent(tagName, t -> index.find(t).map(c -> classify(index, c)));
    }

    /**
     * Classify {@code tagName} using only the given source text. The tag's class is looked up
     * in the source; when absent the first class of the source is used.
     *
     * @throws com.github.javaparser.ParseProblemException when the source does not parse
     */
    public static ViewClassification classify(String tagName, String classSource) {
        CompilationUnit cu = new JavaSourceParser().parse(classSource);
        ClassSourceIndex single = ClassSourceIndex.build(List.of(new ParsedUnit("<source>", cu)));
        ClassSource c = single.find(tagName)
                .or(() -> single.classes().stream().findFirst())
                .orElseThrow(() -> new IllegalArgumentException("No class declared in source for " + tagName));
        return classify(single, c);
    }

    static ViewClassification classify(ClassSourceIndex index, ClassSource cls) {
        List<String> chain = index.superclassChain(cls.simpleName);
        String terminal = chain.get(chain.size() - 1);
        boolean terminalInSource = index.contains(terminal);
        String primitive = terminalInSource || !isKnownPrimitive(terminal) ? null : terminal;
        String inflated = firstInflatedLayout(index, chain);

        ViewClassification result;
        if (anyOverridesOnDraw(index, chain)) {
            result = drawn(cls, chain, primitive, inflated);
        } else if (!terminalInSource && LEAF_PRIMITIVES.containsKey(terminal)) {
            result = new ViewClassification(cls.simpleName, ViewArchetype.TEXT_LIKE, LEAF_PRIMITIVES.get(terminal),
                    chain, primitive, inflated);
        } else if (!terminalInSource && (CONTAINER_PRIMITIVES.contains(terminal) || terminal.endsWith("Layout"))) {
            result = composite(cls, chain, primitive, inflated);
        } else if (inflated != null) {
            result = composite(cls, chain, primitive, inflated);
        } else {
            result = drawn(cls, chain, primitive, inflated);
        }
        log.debug("Classified {} as {} via {}", cls.simpleName, result.archetype(), chain);
        return result;
    }

    private static ViewClassification drawn(ClassSource cls, List<String> chain, String primitive, String inflated) {
        return new ViewClassification(cls.simpleName, ViewArchetype.CUSTOM_DRAWN, WidgetKind.CUSTOM_PAINT,
                chain, primitive, inflated);
    }

    private static ViewClassification composite(ClassSource cls, List<String> chain, String primitive, String inflated) {
        return new ViewClassification(cls.simpleName, ViewArchetype.COMPOSITE_CONTAINER, WidgetKind.CONTAINER,
                chain, primitive, inflated);
    }

    private static boolean isKnownPrimitive(String name) {
        return LEAF_PRIMITIVES.containsKey(name)
                || CONTAINER_PRIMITIVES.contains(name)
                || DRAWING_PRIMITIVES.contains(name)
                || name.endsWith("Layout");
    }

    private static boolean anyOverridesOnDraw(ClassSourceIndex index, List<String> chain) {
        for (String name : chain) {
            Optional<ClassSource> c = index.find(name);
            if (c.isPresent() && c.get().overridesOnDraw) return true;
        }
        return false;
    }

    private static String firstInflatedLayout(ClassSourceIndex index, List<String> chain) {
        for (String name : chain) {
            Optional<ClassSource> c = index.find(name);
            if (c.isPresent() && c.get().inflatedLayout != null) return c.get().inflatedLayout;
        }
        return null;
    }
}
