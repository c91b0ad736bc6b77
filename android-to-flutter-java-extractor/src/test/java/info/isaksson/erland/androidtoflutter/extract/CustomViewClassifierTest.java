package info.isaksson.erland.androidtoflutter.extract;

import info.isaksson.erland.androidtoflutter.ir.ViewArchetype;
import info.isaksson.erland.androidtoflutter.ir.ViewClassification;
import info.isaksson.erland.androidtoflutter.ir.WidgetKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class CustomViewClassifierTest {

    private static final String BADGE = """
            package com.example.ui;

            import androidx.appcompat.widget.AppCompatTextView;

            public class BadgeTextView extends AppCompatTextView {
                public BadgeTextView(Context context) { super(context); }
            }
            """;

    private static final String HEADER = """
            package com.example.ui;

            public class ProfileHeader extends LinearLayout {
                public ProfileHeader(Context context) {
                    super(context);
                    LayoutInflater.from(context).inflate(R.layout.view_profile_header, this, true);
                }
            }
            """;

    private static final String GAUGE = """
            package com.example.ui;

            public class Gauge extends View {
                @Override
                protected void onDraw(Canvas canvas) {
                    canvas.drawCircle(0f, 0f, 10f, paint);
                }
            }
            """;

    private static final String FANCY_GAUGE = """
            package com.example.ui;

            public class FancyGauge extends Gauge {
            }
            """;

    private static final String BUTTONS = """
            package com.example.ui;

            class BaseButton extends com.google.android.material.button.MaterialButton {
            }

            class PrimaryButton extends BaseButton {
            }
            """;

    private static final String MYSTERY = """
            package com.example.ui;

            public class Mystery extends com.vendor.widgets.FancyThing {
            }
            """;

    private static ClassSourceIndex index(String... sources) {
        JavaSourceParser parser = new JavaSourceParser();
        List<ParsedUnit> units = new ArrayList<>();
        for (int i = 0; i < sources.length; i++) {
            units.add(new ParsedUnit("Source" + i + ".java", parser.parse(sources[i])));
        }
        return ClassSourceIndex.build(units);
    }

    private final CustomViewClassifier classifier =
            new CustomViewClassifier(index(BADGE, HEADER, GAUGE, FANCY_GAUGE, BUTTONS, MYSTERY));

    @Test
    void textPrimitiveSubclassIsTextLike() {
        ViewClassification c = classifier.classify("com.example.ui.BadgeTextView").orElseThrow();
        assertEquals(ViewArchetype.TEXT_LIKE, c.archetype());
        assertEquals(WidgetKind.TEXT, c.placeholderKind());
        assertEquals("AppCompatTextView", c.terminalPrimitive());
        assertEquals(List.of("BadgeTextView", "AppCompatTextView"), c.superclassChain());
    }

    @Test
    void layoutSubclassIsCompositeWithInflatedLayout() {
        ViewClassification c = classifier.classify("ProfileHeader").orElseThrow();
        assertEquals(ViewArchetype.COMPOSITE_CONTAINER, c.archetype());
        assertEquals(WidgetKind.CONTAINER, c.placeholderKind());
        assertEquals("view_profile_header", c.inflatedLayout());
    }

    @Test
    void onDrawOverrideAnywhereInSourceChainIsCustomDrawn() {
        ViewClassification gauge = classifier.classify("Gauge").orElseThrow();
        assertEquals(ViewArchetype.CUSTOM_DRAWN, gauge.archetype());
        assertEquals(WidgetKind.CUSTOM_PAINT, gauge.placeholderKind());

        ViewClassification fancy = classifier.classify("FancyGauge").orElseThrow();
        assertEquals(ViewArchetype.CUSTOM_DRAWN, fancy.archetype());
        assertEquals(List.of("FancyGauge", "Gauge", "View"), fancy.superclassChain());
    }

    @Test
    void chainIsFollowedThroughInSourceAncestors() {
        ViewClassification c = classifier.classify("PrimaryButton").orElseThrow();
        assertEquals(ViewArchetype.TEXT_LIKE, c.archetype());
        assertEquals(WidgetKind.ELEVATED_BUTTON, c.placeholderKind());
        assertEquals("MaterialButton", c.terminalPrimitive());
    }

    @Test
    void unknownAncestryFallsBackToCustomDrawn() {
        ViewClassification c = classifier.classify("Mystery").orElseThrow();
        assertEquals(ViewArchetype.CUSTOM_DRAWN, c.archetype());
        assertNull(c.terminalPrimitive());
    }

    @Test
    void classesWithoutSourceAreNotClassified() {
        assertEquals(Optional.empty(), classifier.classify("com.other.Widget"));
    }

    @Test
    void classificationIsDeterministic() {
        CustomViewClassifier other = new CustomViewClassifier(index(MYSTERY, BUTTONS, FANCY_GAUGE, GAUGE, HEADER, BADGE));
        for (String name : List.of("BadgeTextView", "ProfileHeader", "Gauge", "FancyGauge", "PrimaryButton", "Mystery")) {
            assertEquals(classifier.classify(name), classifier.classify(name), name);
            assertEquals(classifier.classify(name), other.classify(name), name);
        }
    }

    @Test
    void classifiesFromSourceTextAlone() {
        ViewClassification fromText = CustomViewClassifier.classify("Gauge", GAUGE);
        assertEquals(ViewArchetype.CUSTOM_DRAWN, fromText.archetype());
        assertEquals(List.of("Gauge", "View"), fromText.superclassChain());
        assertEquals("View", fromText.terminalPrimitive());
    }
}
