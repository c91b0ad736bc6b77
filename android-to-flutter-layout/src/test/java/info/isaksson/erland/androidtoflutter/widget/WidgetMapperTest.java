package info.isaksson.erland.androidtoflutter.widget;

import info.isaksson.erland.androidtoflutter.ir.BindingTable;
import info.isaksson.erland.androidtoflutter.ir.ClickBinding;
import info.isaksson.erland.androidtoflutter.ir.ConversionWarnings;
import info.isaksson.erland.androidtoflutter.ir.MarkupNode;
import info.isaksson.erland.androidtoflutter.ir.ResolvedLayoutNode;
import info.isaksson.erland.androidtoflutter.ir.ViewArchetype;
import info.isaksson.erland.androidtoflutter.ir.ViewClassification;
import info.isaksson.erland.androidtoflutter.ir.WidgetDescriptor;
import info.isaksson.erland.androidtoflutter.ir.WidgetKind;
import info.isaksson.erland.androidtoflutter.ir.WidgetProperty;
import info.isaksson.erland.androidtoflutter.ir.WidgetWrapper;
import info.isaksson.erland.androidtoflutter.layout.LayoutResolver;
import info.isaksson.erland.androidtoflutter.markup.InMemoryDocumentRegistry;
import info.isaksson.erland.androidtoflutter.markup.MarkupParser;
import info.isaksson.erland.androidtoflutter.resources.ResourceTable;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class WidgetMapperTest {

    private static final String NS = "xmlns:android=\"http://schemas.android.com/apk/res/android\" "
            + "xmlns:app=\"http://schemas.android.com/apk/res-auto\"";

    private final ConversionWarnings warnings = new ConversionWarnings();

    private ResolvedLayoutNode resolve(String xml) throws Exception {
        MarkupNode root = new MarkupParser().parse(xml.replace("$NS", NS), "main");
        return new LayoutResolver(new InMemoryDocumentRegistry(Map.of("main", root))).resolve(root, warnings);
    }

    private WidgetDescriptor map(String xml) throws Exception {
        return new WidgetMapper(MappingContext.empty(warnings)).map(resolve(xml));
    }

    private WidgetDescriptor map(String xml, MappingContext.Builder context) throws Exception {
        return new WidgetMapper(context.warnings(warnings).build()).map(resolve(xml));
    }

    private static List<WidgetKind> kinds(WidgetDescriptor d) {
        return d.children.stream().map(c -> c.kind).collect(Collectors.toList());
    }

    private static List<WidgetWrapper.Kind> wrappers(WidgetDescriptor d) {
        return d.wrappers.stream().map(w -> w.kind).collect(Collectors.toList());
    }

    @Test
    void linearContainerPreservesChildOrder() throws Exception {
        WidgetDescriptor column = map("""
                <LinearLayout $NS>
                    <TextView android:id="@+id/a" android:text="A"/>
                    <Button android:id="@+id/b"/>
                    <EditText android:id="@+id/c"/>
                </LinearLayout>
                """);

        assertEquals(WidgetKind.COLUMN, column.kind);
        assertEquals(List.of(WidgetKind.TEXT, WidgetKind.ELEVATED_BUTTON, WidgetKind.TEXT_FIELD), kinds(column));
        assertEquals(List.of("a", "b", "c"),
                column.children.stream().map(c -> c.viewId).collect(Collectors.toList()));
        assertEquals(WidgetProperty.string("A"), column.children.get(0).property("text"));
        assertEquals(WidgetProperty.string("Button"), column.children.get(1).property("label"));
    }

    @Test
    void horizontalLinearBecomesRowWithAlignments() throws Exception {
        WidgetDescriptor row = map("""
                <LinearLayout $NS android:orientation="horizontal" android:gravity="center">
                    <TextView android:id="@+id/a"/>
                </LinearLayout>
                """);
        assertEquals(WidgetKind.ROW, row.kind);
        assertEquals(WidgetProperty.symbol("MainAxisAlignment.center"), row.property("mainAxisAlignment"));
        assertEquals(WidgetProperty.symbol("CrossAxisAlignment.center"), row.property("crossAxisAlignment"));
    }

    @Test
    void unknownTagWithChildrenBecomesContainer() throws Exception {
        WidgetDescriptor root = map("""
                <com.example.Fancy $NS>
                    <TextView android:id="@+id/a"/>
                    <TextView android:id="@+id/b"/>
                </com.example.Fancy>
                """);

        assertEquals(WidgetKind.CONTAINER, root.kind);
        assertEquals(2, root.children.size());
        assertEquals("com.example.Fancy", root.sourceTag);
        assertEquals(1, warnings.count(ConversionWarnings.UNKNOWN_TAG));
    }

    @Test
    void unknownLeafBecomesPlaceholderCarryingTag() throws Exception {
        WidgetDescriptor root = map("""
                <LinearLayout $NS>
                    <com.example.Gauge android:id="@+id/g"/>
                </LinearLayout>
                """);
        WidgetDescriptor gauge = root.children.get(0);
        assertEquals(WidgetKind.UNKNOWN_PLACEHOLDER, gauge.kind);
        assertEquals("com.example.Gauge", gauge.sourceTag);
    }

    @Test
    void missingIncludeMapsToZeroSizeBox() throws Exception {
        WidgetDescriptor root = map("""
                <LinearLayout $NS>
                    <include layout="@layout/missing"/>
                </LinearLayout>
                """);
        WidgetDescriptor box = root.children.get(0);
        assertEquals(WidgetKind.SIZED_BOX, box.kind);
        assertEquals(WidgetProperty.number(0), box.property("width"));
        assertEquals(WidgetProperty.number(0), box.property("height"));
    }

    @Test
    void buttonHandlersComeFromBindingsAttributeOrStub() throws Exception {
        BindingTable bindings = BindingTable.builder()
                .bind("login", new ClickBinding("login", "_onLoginClicked"))
                .build();
        WidgetDescriptor root = map("""
                <LinearLayout $NS>
                    <Button android:id="@+id/login"/>
                    <Button android:id="@+id/help" android:onClick="showHelp"/>
                    <Button android:id="@+id/sign_up"/>
                </LinearLayout>
                """, MappingContext.builder().bindings(bindings));

        assertEquals(WidgetProperty.handler("_onLoginClicked"), root.children.get(0).property("onPressed"));
        assertEquals(WidgetProperty.handler("_showHelp"), root.children.get(1).property("onPressed"));
        assertEquals(WidgetProperty.handler("_onSignUpPressed"), root.children.get(2).property("onPressed"));
    }

    @Test
    void clickableTextWithHandlerGetsInkWellAndWithoutOneBecomesTextButton() throws Exception {
        WidgetDescriptor root = map("""
                <LinearLayout $NS>
                    <TextView android:id="@+id/link" android:text="More" android:onClick="openMore"/>
                    <TextView android:id="@+id/plain" android:text="Tap" android:clickable="true"/>
                </LinearLayout>
                """);

        WidgetDescriptor link = root.children.get(0);
        assertEquals(WidgetKind.TEXT, link.kind);
        assertEquals(WidgetProperty.handler("_openMore"),
                link.wrapper(WidgetWrapper.Kind.INK_WELL).orElseThrow().property("onTap"));

        WidgetDescriptor plain = root.children.get(1);
        assertEquals(WidgetKind.TEXT_BUTTON, plain.kind);
        assertNull(plain.property("onPressed"));
    }

    @Test
    void constraintCenteringAndBiasBecomeWrappers() throws Exception {
        WidgetDescriptor root = map("""
                <androidx.constraintlayout.widget.ConstraintLayout $NS>
                    <TextView android:id="@+id/centered"
                        app:layout_constraintStart_toStartOf="parent"
                        app:layout_constraintEnd_toEndOf="parent"/>
                    <TextView android:id="@+id/biased"
                        app:layout_constraintTop_toTopOf="parent"
                        app:layout_constraintBottom_toBottomOf="parent"
                        app:layout_constraintVertical_bias="0.25"/>
                </androidx.constraintlayout.widget.ConstraintLayout>
                """);

        assertEquals(WidgetKind.COLUMN, root.kind);
        assertTrue(root.children.get(0).hasWrapper(WidgetWrapper.Kind.CENTER));
        WidgetWrapper align = root.children.get(1).wrapper(WidgetWrapper.Kind.ALIGN).orElseThrow();
        assertEquals(WidgetProperty.number(0.0), align.property("x"));
        assertEquals(WidgetProperty.number(-0.5), align.property("y"));
    }

    @Test
    void fullSizeImageInConstraintLayoutBecomesStackBackground() throws Exception {
        WidgetDescriptor root = map("""
                <androidx.constraintlayout.widget.ConstraintLayout $NS>
                    <TextView android:id="@+id/title"/>
                    <ImageView android:id="@+id/bg" android:src="@drawable/sky"
                        android:layout_width="match_parent" android:layout_height="match_parent"/>
                </androidx.constraintlayout.widget.ConstraintLayout>
                """);

        assertEquals(WidgetKind.STACK, root.kind);
        assertEquals(List.of(WidgetKind.IMAGE, WidgetKind.TEXT), kinds(root));
        WidgetDescriptor bg = root.children.get(0);
        assertTrue(bg.hasWrapper(WidgetWrapper.Kind.POSITIONED_FILL));
        assertEquals(WidgetProperty.string("assets/images/sky.png"), bg.property("asset"));
    }

    @Test
    void frameChildrenAlignFromLayoutGravity() throws Exception {
        WidgetDescriptor stack = map("""
                <FrameLayout $NS>
                    <com.google.android.material.floatingactionbutton.FloatingActionButton
                        android:id="@+id/fab" android:layout_gravity="bottom|end"/>
                </FrameLayout>
                """);
        assertEquals(WidgetKind.STACK, stack.kind);
        WidgetDescriptor fab = stack.children.get(0);
        assertEquals(WidgetKind.FLOATING_ACTION_BUTTON, fab.kind);
        assertEquals(WidgetProperty.symbol("Alignment.bottomRight"),
                fab.wrapper(WidgetWrapper.Kind.ALIGN).orElseThrow().property("alignment"));
    }

    @Test
    void decorationWrappersAreOrderedInnerToOuter() throws Exception {
        WidgetDescriptor root = map("""
                <LinearLayout $NS>
                    <TextView android:id="@+id/t"
                        android:layout_width="120dp"
                        android:layout_weight="2"
                        android:background="#FF0000"
                        android:padding="8dp"
                        android:layout_marginTop="4dp"
                        android:visibility="gone"/>
                </LinearLayout>
                """);

        WidgetDescriptor t = root.children.get(0);
        assertEquals(List.of(WidgetWrapper.Kind.SIZED_BOX, WidgetWrapper.Kind.BACKGROUND, WidgetWrapper.Kind.PADDING,
                WidgetWrapper.Kind.MARGIN, WidgetWrapper.Kind.VISIBILITY, WidgetWrapper.Kind.EXPANDED), wrappers(t));
        assertEquals(WidgetProperty.color(0xFFFF0000L),
                t.wrapper(WidgetWrapper.Kind.BACKGROUND).orElseThrow().property("color"));
        assertEquals(WidgetProperty.number(4), t.wrapper(WidgetWrapper.Kind.MARGIN).orElseThrow().property("top"));
        assertEquals(WidgetProperty.integer(2), t.wrapper(WidgetWrapper.Kind.EXPANDED).orElseThrow().property("flex"));
    }

    @Test
    void progressBarsByStyle() throws Exception {
        WidgetDescriptor root = map("""
                <LinearLayout $NS>
                    <ProgressBar android:id="@+id/spin"/>
                    <ProgressBar android:id="@+id/bar" style="?android:attr/progressBarStyleHorizontal"
                        android:max="60" android:progress="30"/>
                    <ProgressBar android:id="@+id/busy" style="@style/Widget.AppCompat.ProgressBar.Horizontal"
                        android:indeterminate="true"/>
                </LinearLayout>
                """);

        assertEquals(List.of(WidgetKind.CIRCULAR_PROGRESS_INDICATOR, WidgetKind.LINEAR_PROGRESS_INDICATOR,
                WidgetKind.LINEAR_PROGRESS_INDICATOR), kinds(root));
        assertEquals(WidgetProperty.number(0.5), root.children.get(1).property("value"));
        assertNull(root.children.get(2).property("value"));
    }

    @Test
    void thinViewBecomesDivider() throws Exception {
        WidgetDescriptor root = map("""
                <LinearLayout $NS>
                    <View android:layout_height="1dp" android:background="#DDDDDD"/>
                    <View android:layout_height="40dp"/>
                </LinearLayout>
                """);
        assertEquals(List.of(WidgetKind.DIVIDER, WidgetKind.CONTAINER), kinds(root));
        assertEquals(WidgetProperty.color(0xFFDDDDDDL), root.children.get(0).property("color"));
        assertFalse(root.children.get(0).hasWrapper(WidgetWrapper.Kind.BACKGROUND));
    }

    @Test
    void textFieldsDetectPasswordsAndInheritInputLayoutHint() throws Exception {
        WidgetDescriptor root = map("""
                <LinearLayout $NS>
                    <EditText android:id="@+id/pw" android:inputType="textPassword" android:hint="Secret"/>
                    <EditText android:id="@+id/mail" android:inputType="textEmailAddress"/>
                    <com.google.android.material.textfield.TextInputLayout android:hint="Name">
                        <com.google.android.material.textfield.TextInputEditText android:id="@+id/name"/>
                    </com.google.android.material.textfield.TextInputLayout>
                </LinearLayout>
                """);

        WidgetDescriptor pw = root.children.get(0);
        assertEquals(WidgetProperty.bool(true), pw.property("obscureText"));
        assertEquals(WidgetProperty.string("Secret"), pw.property("hintText"));
        assertEquals(WidgetProperty.symbol("TextInputType.emailAddress"), root.children.get(1).property("keyboardType"));
        WidgetDescriptor name = root.children.get(2).children.get(0);
        assertEquals(WidgetKind.TEXT_FIELD, name.kind);
        assertEquals(WidgetProperty.string("Name"), name.property("labelText"));
    }

    @Test
    void imageScaleTypeMapsToBoxFit() throws Exception {
        WidgetDescriptor root = map("""
                <LinearLayout $NS>
                    <ImageView android:id="@+id/a" app:srcCompat="@mipmap/logo" android:scaleType="fitXY"/>
                    <ImageView android:id="@+id/b"/>
                </LinearLayout>
                """);
        assertEquals(WidgetProperty.string("assets/images/logo.png"), root.children.get(0).property("asset"));
        assertEquals(WidgetProperty.symbol("BoxFit.fill"), root.children.get(0).property("fit"));
        assertNull(root.children.get(1).property("asset"));
    }

    @Test
    void textResolvesThroughResourcesAndReportsMissingOnes() throws Exception {
        ResourceTable resources = new ResourceTable(Map.of("title", "#112233"), Map.of("welcome", "Welcome!"), Map.of());
        WidgetDescriptor root = map("""
                <LinearLayout $NS>
                    <TextView android:id="@+id/a" android:text="@string/welcome" android:textColor="@color/title"
                        android:textStyle="bold" android:textSize="18sp"/>
                    <TextView android:id="@+id/b" android:text="@string/gone"/>
                </LinearLayout>
                """, MappingContext.builder().resources(resources));

        WidgetDescriptor a = root.children.get(0);
        assertEquals(WidgetProperty.string("Welcome!"), a.property("text"));
        assertEquals(WidgetProperty.color(0xFF112233L), a.property("color"));
        assertEquals(WidgetProperty.symbol("FontWeight.bold"), a.property("fontWeight"));
        assertEquals(WidgetProperty.number(18), a.property("fontSize"));
        assertEquals(WidgetProperty.string("gone"), root.children.get(1).property("text"));
        assertEquals(1, warnings.count(ConversionWarnings.UNRESOLVED_RESOURCE));
    }

    @Test
    void customViewsFollowTheirClassification() throws Exception {
        Map<String, ViewClassification> classes = Map.of(
                "com.example.BadgeView", new ViewClassification("BadgeView", ViewArchetype.TEXT_LIKE,
                        WidgetKind.TEXT, List.of("BadgeView", "AppCompatTextView"), "AppCompatTextView", null),
                "com.example.ChartView", new ViewClassification("ChartView", ViewArchetype.CUSTOM_DRAWN,
                        WidgetKind.CUSTOM_PAINT, List.of("ChartView", "View"), "View", null));
        WidgetDescriptor root = map("""
                <LinearLayout $NS>
                    <com.example.BadgeView android:id="@+id/badge" android:text="3"/>
                    <com.example.ChartView android:id="@+id/chart"/>
                </LinearLayout>
                """, MappingContext.builder().customViews(name -> Optional.ofNullable(classes.get(name))));

        assertEquals(List.of(WidgetKind.TEXT, WidgetKind.CUSTOM_PAINT), kinds(root));
        assertEquals(WidgetProperty.string("3"), root.children.get(0).property("text"));
        assertEquals(WidgetProperty.symbol("ChartViewPainter"), root.children.get(1).property("painter"));
        assertEquals(0, warnings.count(ConversionWarnings.UNKNOWN_TAG));
    }

    @Test
    void compositeViewInflatesItsLayoutOnce() throws Exception {
        ViewClassification header = new ViewClassification("HeaderView", ViewArchetype.COMPOSITE_CONTAINER,
                WidgetKind.CONTAINER, List.of("HeaderView", "LinearLayout"), "LinearLayout", "view_header");
        ResolvedLayoutNode inflated = resolve("""
                <LinearLayout $NS>
                    <TextView android:id="@+id/caption"/>
                    <com.example.HeaderView/>
                </LinearLayout>
                """);

        WidgetDescriptor root = map("""
                <FrameLayout $NS>
                    <com.example.HeaderView android:id="@+id/header"/>
                </FrameLayout>
                """, MappingContext.builder()
                .customViews(name -> name.equals("com.example.HeaderView") ? Optional.of(header) : Optional.empty())
                .layouts(id -> id.equals("view_header") ? Optional.of(inflated) : Optional.empty()));

        WidgetDescriptor container = root.children.get(0);
        assertEquals(WidgetKind.CONTAINER, container.kind);
        WidgetDescriptor column = container.children.get(0);
        assertEquals(List.of(WidgetKind.TEXT, WidgetKind.CONTAINER), kinds(column));
        assertTrue(column.children.get(1).children.isEmpty());
        assertEquals(1, warnings.count(ConversionWarnings.INFLATE_CYCLE));
    }

    @Test
    void includeWrapperMapsToContainerWithOneChild() throws Exception {
        MarkupNode main = new MarkupParser().parse("""
                <LinearLayout $NS>
                    <include layout="@layout/row" android:layout_marginTop="8dp"/>
                </LinearLayout>
                """.replace("$NS", NS), "main");
        MarkupNode row = new MarkupParser().parse("<TextView " + NS + " android:id=\"@+id/r\"/>", "row");
        ResolvedLayoutNode resolved = new LayoutResolver(new InMemoryDocumentRegistry(Map.of("main", main, "row", row)))
                .resolve(main, warnings);

        WidgetDescriptor include = new WidgetMapper(MappingContext.empty(warnings)).map(resolved).children.get(0);
        assertEquals(WidgetKind.CONTAINER, include.kind);
        assertEquals(List.of(WidgetKind.TEXT), kinds(include));
        assertTrue(include.hasWrapper(WidgetWrapper.Kind.MARGIN));
        assertTrue(include.children.get(0).wrappers.isEmpty());
    }
}
