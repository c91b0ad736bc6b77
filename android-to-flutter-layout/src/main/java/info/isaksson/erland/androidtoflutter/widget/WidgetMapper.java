package info.isaksson.erland.androidtoflutter.widget;

import info.isaksson.erland.androidtoflutter.ir.Alignment;
import info.isaksson.erland.androidtoflutter.ir.ContainerKind;
import info.isaksson.erland.androidtoflutter.ir.ConversionWarnings;
import info.isaksson.erland.androidtoflutter.ir.DartNames;
import info.isaksson.erland.androidtoflutter.ir.MarkupNode;
import info.isaksson.erland.androidtoflutter.ir.Orientation;
import info.isaksson.erland.androidtoflutter.ir.ResolvedLayoutNode;
import info.isaksson.erland.androidtoflutter.ir.ViewClassification;
import info.isaksson.erland.androidtoflutter.ir.WidgetDescriptor;
import info.isaksson.erland.androidtoflutter.ir.WidgetKind;
import info.isaksson.erland.androidtoflutter.ir.WidgetProperty;
import info.isaksson.erland.androidtoflutter.ir.WidgetWrapper;
import info.isaksson.erland.androidtoflutter.layout.Gravity;
import info.isaksson.erland.androidtoflutter.layout.ViewTag;
import info.isaksson.erland.androidtoflutter.resources.ResourceTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps a resolved layout tree to a widget descriptor tree.
 *
 * <p>Total over every input shape: unknown tags become a {@link WidgetKind#CONTAINER} around
 * their mapped children, or an {@link WidgetKind#UNKNOWN_PLACEHOLDER} when they have none.
 * Decorations are recorded as wrappers, so every resolved child yields exactly one mapped
 * child.</p>
 */
public final class WidgetMapper {

    private static final Logger log = LoggerFactory.getLogger(WidgetMapper.class);

    private static final Set<String> FILL = Set.of("match_parent", "fill_parent", "0dp");
    private static final double DIVIDER_MAX_HEIGHT = 2.0;

    private final MappingContext context;

    public WidgetMapper(MappingContext context) {
        this.context = context == null ? MappingContext.empty(null) : context;
    }

    public WidgetDescriptor map(ResolvedLayoutNode root) {
        if (root == null) throw new IllegalArgumentException("root is null");
        return new Mapping().mapNode(root, null, false);
    }

    private final class Mapping {
        private final ResourceTable res = context.resources;
        private final ConversionWarnings warnings = context.warnings;
        /** Layouts currently being inflated by composite custom views. */
        private final Set<String> inflating = new HashSet<>();
        /** Hint of an enclosing TextInputLayout, consumed by the first text field below it. */
        private String pendingHint;

        WidgetDescriptor mapNode(ResolvedLayoutNode node, ResolvedLayoutNode parent, boolean background) {
            WidgetDescriptor.Builder b;
            if (node.isPlaceholder()) {
                b = WidgetDescriptor.builder(WidgetKind.SIZED_BOX)
                        .property("width", WidgetProperty.number(0))
                        .property("height", WidgetProperty.number(0));
            } else if (node.origin == ResolvedLayoutNode.Origin.INCLUDE) {
                b = WidgetDescriptor.builder(WidgetKind.CONTAINER).children(mapChildren(node));
            } else {
                b = mapElement(node, ViewTag.of(node.tag()));
            }
            b.sourceTag(node.tag()).viewId(node.id());
            if (!node.isPlaceholder()) decorate(b, node);
            placeIn(b, node, parent, background);
            return b.build();
        }

        List<WidgetDescriptor> mapChildren(ResolvedLayoutNode node) {
            List<WidgetDescriptor> out = new ArrayList<>(node.children.size());
            for (ResolvedLayoutNode c : node.children) {
                out.add(mapNode(c, node, false));
            }
            return out;
        }

        private WidgetDescriptor.Builder mapElement(ResolvedLayoutNode node, ViewTag tag) {
            return switch (tag) {
                case LINEAR_LAYOUT, RADIO_GROUP, TABLE_LAYOUT, TABLE_ROW, RELATIVE_LAYOUT -> flex(node);
                case CONSTRAINT_LAYOUT -> constraint(node);
                case FRAME_LAYOUT -> WidgetDescriptor.builder(WidgetKind.STACK).children(mapChildren(node));
                case SCROLL_VIEW -> WidgetDescriptor.builder(WidgetKind.SINGLE_CHILD_SCROLL_VIEW)
                        .children(mapChildren(node));
                case HORIZONTAL_SCROLL_VIEW -> WidgetDescriptor.builder(WidgetKind.SINGLE_CHILD_SCROLL_VIEW)
                        .property("scrollDirection", WidgetProperty.symbol("Axis.horizontal"))
                        .children(mapChildren(node));
                case CARD_VIEW -> card(node);
                case TEXT_INPUT_LAYOUT -> textInputLayout(node);
                case LIST_VIEW -> WidgetDescriptor.builder(WidgetKind.LIST_VIEW).children(mapChildren(node));
                case TEXT_VIEW -> text(node);
                case BUTTON -> button(node);
                case IMAGE_BUTTON -> imageButton(node);
                case FLOATING_ACTION_BUTTON -> floatingActionButton(node);
                case EDIT_TEXT -> textField(node);
                case IMAGE_VIEW -> image(node);
                case CHECK_BOX -> toggle(node, WidgetKind.CHECKBOX);
                case SWITCH -> toggle(node, WidgetKind.SWITCH);
                case RADIO_BUTTON -> toggle(node, WidgetKind.RADIO);
                case SEEK_BAR -> slider(node);
                case PROGRESS_BAR -> progress(node);
                case SPACE -> space(node);
                case VIEW -> plainView(node);
                case CONSTRAINT_HELPER -> WidgetDescriptor.builder(WidgetKind.SIZED_BOX)
                        .property("width", WidgetProperty.number(0))
                        .property("height", WidgetProperty.number(0));
                case WEB_VIEW, MEDIA_VIEW, SPINNER -> placeholder(node.markup.simpleTag(), node);
                case FRAGMENT -> placeholder("Fragment " + node.attr("name"), node);
                case INCLUDE, MERGE, VIEW_STUB -> WidgetDescriptor.builder(WidgetKind.CONTAINER)
                        .children(mapChildren(node));
                case UNKNOWN -> unknown(node);
            };
        }

        // ---- containers ----

        private WidgetDescriptor.Builder flex(ResolvedLayoutNode node) {
            Orientation axis = node.orientation == Orientation.HORIZONTAL ? Orientation.HORIZONTAL : Orientation.VERTICAL;
            WidgetDescriptor.Builder b = WidgetDescriptor.builder(axis == Orientation.HORIZONTAL ? WidgetKind.ROW : WidgetKind.COLUMN);
            String gravity = node.attr("gravity");
            if (gravity != null) {
                b.property("mainAxisAlignment", mainAxisSymbol(Gravity.mainAxis(gravity, axis)));
                b.property("crossAxisAlignment", crossAxisSymbol(Gravity.crossAxis(gravity, axis)));
            }
            return b.children(mapChildren(node));
        }

        /** Column in declaration order; a full-size image child turns it into a stack background. */
        private WidgetDescriptor.Builder constraint(ResolvedLayoutNode node) {
            List<WidgetDescriptor> backgrounds = new ArrayList<>();
            List<WidgetDescriptor> foreground = new ArrayList<>();
            for (ResolvedLayoutNode c : node.children) {
                if (isBackgroundImage(c)) {
                    backgrounds.add(mapNode(c, node, true));
                } else {
                    foreground.add(mapNode(c, node, false));
                }
            }
            if (backgrounds.isEmpty()) {
                return WidgetDescriptor.builder(WidgetKind.COLUMN).children(foreground);
            }
            return WidgetDescriptor.builder(WidgetKind.STACK).children(backgrounds).children(foreground);
        }

        private WidgetDescriptor.Builder card(ResolvedLayoutNode node) {
            WidgetDescriptor.Builder b = WidgetDescriptor.builder(WidgetKind.CARD);
            dimension(node.attr("cardElevation")).ifPresent(v -> b.property("elevation", WidgetProperty.number(v)));
            dimension(node.attr("cardCornerRadius")).ifPresent(v -> b.property("radius", WidgetProperty.number(v)));
            color(node, "cardBackgroundColor").ifPresent(v -> b.property("color", WidgetProperty.color(v)));
            return b.children(mapChildren(node));
        }

        private WidgetDescriptor.Builder textInputLayout(ResolvedLayoutNode node) {
            String saved = pendingHint;
            pendingHint = text(node, "hint").orElse(null);
            try {
                return WidgetDescriptor.builder(WidgetKind.CONTAINER).children(mapChildren(node));
            } finally {
                pendingHint = saved;
            }
        }

        // ---- leaves ----

        private WidgetDescriptor.Builder text(ResolvedLayoutNode node) {
            String label = text(node, "text").orElse("");
            String handler = handlerFor(node, false);
            if (handler == null && "true".equals(node.attr("clickable"))) {
                WidgetDescriptor.Builder b = WidgetDescriptor.builder(WidgetKind.TEXT_BUTTON)
                        .property("label", WidgetProperty.string(label));
                color(node, "textColor").ifPresent(v -> b.property("color", WidgetProperty.color(v)));
                return b;
            }
            WidgetDescriptor.Builder b = WidgetDescriptor.builder(WidgetKind.TEXT)
                    .property("text", WidgetProperty.string(label));
            textStyle(b, node, "color");
            String align = textAlign(node);
            if (align != null) b.property("textAlign", WidgetProperty.symbol(align));
            integer(node.attr("maxLines")).ifPresent(v -> b.property("maxLines", WidgetProperty.integer(v)));
            return b;
        }

        private WidgetDescriptor.Builder button(ResolvedLayoutNode node) {
            WidgetDescriptor.Builder b = WidgetDescriptor.builder(WidgetKind.ELEVATED_BUTTON)
                    .property("label", WidgetProperty.string(text(node, "text").orElse("Button")));
            String handler = handlerFor(node, true);
            if (handler != null) b.property("onPressed", WidgetProperty.handler(handler));
            Optional<Long> bg = color(node, "backgroundTint");
            if (bg.isEmpty()) bg = color(node, "background");
            bg.ifPresent(v -> b.property("backgroundColor", WidgetProperty.color(v)));
            textStyle(b, node, "foregroundColor");
            return b;
        }

        private WidgetDescriptor.Builder imageButton(ResolvedLayoutNode node) {
            WidgetDescriptor.Builder b = WidgetDescriptor.builder(WidgetKind.ICON_BUTTON);
            String asset = imageAsset(node);
            if (asset != null) {
                b.property("asset", WidgetProperty.string(asset));
            } else {
                b.property("icon", WidgetProperty.symbol("Icons.image"));
            }
            String handler = handlerFor(node, true);
            if (handler != null) b.property("onPressed", WidgetProperty.handler(handler));
            text(node, "contentDescription").ifPresent(v -> b.property("tooltip", WidgetProperty.string(v)));
            return b;
        }

        private WidgetDescriptor.Builder floatingActionButton(ResolvedLayoutNode node) {
            WidgetDescriptor.Builder b = WidgetDescriptor.builder(WidgetKind.FLOATING_ACTION_BUTTON)
                    .property("icon", WidgetProperty.symbol("Icons.add"));
            String handler = handlerFor(node, true);
            if (handler != null) b.property("onPressed", WidgetProperty.handler(handler));
            color(node, "backgroundTint").ifPresent(v -> b.property("backgroundColor", WidgetProperty.color(v)));
            text(node, "contentDescription").ifPresent(v -> b.property("tooltip", WidgetProperty.string(v)));
            return b;
        }

        private WidgetDescriptor.Builder textField(ResolvedLayoutNode node) {
            WidgetDescriptor.Builder b = WidgetDescriptor.builder(WidgetKind.TEXT_FIELD);
            Optional<String> hint = text(node, "hint");
            String hintText = hint.orElse(null);
            if (hintText != null) {
                b.property("hintText", WidgetProperty.string(hintText));
            } else if (pendingHint != null) {
                b.property("labelText", WidgetProperty.string(pendingHint));
                hintText = pendingHint;
            }
            pendingHint = null;
            text(node, "text").ifPresent(v -> b.property("text", WidgetProperty.string(v)));

            String inputType = node.attr("inputType", "").toLowerCase(Locale.ROOT);
            boolean password = inputType.contains("password")
                    || "true".equals(node.attr("password"))
                    || (hintText != null && hintText.toLowerCase(Locale.ROOT).contains("password"));
            if (password) b.property("obscureText", WidgetProperty.bool(true));

            String keyboard = keyboardType(inputType);
            if (keyboard != null) b.property("keyboardType", WidgetProperty.symbol(keyboard));

            if ("true".equals(node.attr("singleLine"))) {
                b.property("maxLines", WidgetProperty.integer(1));
            } else {
                Optional<Long> lines = integer(node.attr("maxLines"));
                if (lines.isEmpty()) lines = integer(node.attr("lines"));
                lines.ifPresent(v -> b.property("maxLines", WidgetProperty.integer(v)));
            }
            textStyle(b, node, "color");
            return b;
        }

        private WidgetDescriptor.Builder image(ResolvedLayoutNode node) {
            WidgetDescriptor.Builder b = WidgetDescriptor.builder(WidgetKind.IMAGE);
            String asset = imageAsset(node);
            if (asset != null) b.property("asset", WidgetProperty.string(asset));
            b.property("fit", WidgetProperty.symbol(boxFit(node.attr("scaleType"))));
            text(node, "contentDescription").ifPresent(v -> b.property("semanticLabel", WidgetProperty.string(v)));
            return b;
        }

        private WidgetDescriptor.Builder toggle(ResolvedLayoutNode node, WidgetKind kind) {
            WidgetDescriptor.Builder b = WidgetDescriptor.builder(kind)
                    .property("title", WidgetProperty.string(text(node, "text").orElse("")))
                    .property("value", WidgetProperty.bool("true".equals(node.attr("checked"))));
            String handler = handlerFor(node, false);
            if (handler != null) b.property("onChanged", WidgetProperty.handler(handler));
            return b;
        }

        private WidgetDescriptor.Builder slider(ResolvedLayoutNode node) {
            WidgetDescriptor.Builder b = WidgetDescriptor.builder(WidgetKind.SLIDER)
                    .property("value", WidgetProperty.number(fraction(node)));
            String handler = handlerFor(node, false);
            if (handler != null) b.property("onChanged", WidgetProperty.handler(handler));
            return b;
        }

        /** Horizontal style or a linear indicator tag gives a linear bar; everything else spins. */
        private WidgetDescriptor.Builder progress(ResolvedLayoutNode node) {
            String style = node.attr("style", "") + " " + node.tag();
            boolean linear = style.contains("Horizontal") || style.contains("LinearProgressIndicator");
            if (!linear) return WidgetDescriptor.builder(WidgetKind.CIRCULAR_PROGRESS_INDICATOR);
            WidgetDescriptor.Builder b = WidgetDescriptor.builder(WidgetKind.LINEAR_PROGRESS_INDICATOR);
            if (!"true".equals(node.attr("indeterminate"))) {
                b.property("value", WidgetProperty.number(fraction(node)));
            }
            return b;
        }

        private WidgetDescriptor.Builder space(ResolvedLayoutNode node) {
            WidgetDescriptor.Builder b = WidgetDescriptor.builder(WidgetKind.SIZED_BOX);
            dimension(node.attr("layout_width")).ifPresent(v -> b.property("width", WidgetProperty.number(v)));
            dimension(node.attr("layout_height")).ifPresent(v -> b.property("height", WidgetProperty.number(v)));
            return b;
        }

        private WidgetDescriptor.Builder plainView(ResolvedLayoutNode node) {
            Optional<Double> height = dimension(node.attr("layout_height"));
            if (height.isPresent() && height.get() > 0 && height.get() <= DIVIDER_MAX_HEIGHT) {
                WidgetDescriptor.Builder b = WidgetDescriptor.builder(WidgetKind.DIVIDER)
                        .property("height", WidgetProperty.number(height.get()))
                        .property("thickness", WidgetProperty.number(height.get()));
                color(node, "background").ifPresent(v -> b.property("color", WidgetProperty.color(v)));
                return b;
            }
            return WidgetDescriptor.builder(WidgetKind.CONTAINER).children(mapChildren(node));
        }

        private WidgetDescriptor.Builder placeholder(String label, ResolvedLayoutNode node) {
            return WidgetDescriptor.builder(WidgetKind.PLACEHOLDER)
                    .property("label", WidgetProperty.string(label))
                    .children(mapChildren(node));
        }

        // ---- custom and unknown tags ----

        private WidgetDescriptor.Builder unknown(ResolvedLayoutNode node) {
            String className = "view".equals(node.tag()) && node.attr("class") != null ? node.attr("class") : node.tag();
            Optional<ViewClassification> classification = context.customViews.apply(className);
            if (classification.isPresent()) {
                return custom(node, classification.get());
            }
            log.debug("No mapping for tag {}", node.tag());
            warnings.warn(ConversionWarnings.UNKNOWN_TAG, "no widget mapping for " + node.tag(),
                    "tag", node.tag(), "view", String.valueOf(node.id()));
            if (node.children.isEmpty()) {
                return WidgetDescriptor.builder(WidgetKind.UNKNOWN_PLACEHOLDER);
            }
            return WidgetDescriptor.builder(WidgetKind.CONTAINER).children(mapChildren(node));
        }

        private WidgetDescriptor.Builder custom(ResolvedLayoutNode node, ViewClassification c) {
            switch (c.archetype()) {
                case TEXT_LIKE: {
                    ViewTag primitive = ViewTag.ofClassName(c.terminalPrimitive());
                    if (primitive != ViewTag.UNKNOWN) return mapElement(node, primitive);
                    return WidgetDescriptor.builder(c.placeholderKind()).children(mapChildren(node));
                }
                case COMPOSITE_CONTAINER: {
                    WidgetDescriptor.Builder b = WidgetDescriptor.builder(WidgetKind.CONTAINER);
                    WidgetDescriptor inflated = inflate(node, c.inflatedLayout());
                    if (inflated != null) b.child(inflated);
                    return b.children(mapChildren(node));
                }
                case CUSTOM_DRAWN:
                default: {
                    String simple = c.className().substring(c.className().lastIndexOf('.') + 1);
                    return WidgetDescriptor.builder(WidgetKind.CUSTOM_PAINT)
                            .property("painter", WidgetProperty.symbol(DartNames.pascal(simple) + "Painter"))
                            .children(mapChildren(node));
                }
            }
        }

        private WidgetDescriptor inflate(ResolvedLayoutNode node, String layoutId) {
            if (layoutId == null) return null;
            if (!inflating.add(layoutId)) {
                warnings.warn(ConversionWarnings.INFLATE_CYCLE, "recursive inflation of " + layoutId,
                        "layout", layoutId, "tag", node.tag());
                return null;
            }
            try {
                Optional<ResolvedLayoutNode> layout = context.layouts.apply(layoutId);
                if (layout.isEmpty()) {
                    warnings.warn(ConversionWarnings.UNRESOLVED_INCLUDE, "inflated layout not found: " + layoutId,
                            "layout", layoutId, "tag", node.tag());
                    return null;
                }
                return mapNode(layout.get(), null, false);
            } finally {
                inflating.remove(layoutId);
            }
        }

        // ---- wrappers ----

        /** Own decorations, inner to outer: size, background, padding, tap, margin, visibility. */
        private void decorate(WidgetDescriptor.Builder b, ResolvedLayoutNode node) {
            WidgetKind kind = b.kind();
            if (kind != WidgetKind.SIZED_BOX && kind != WidgetKind.DIVIDER) {
                Map<String, WidgetProperty> size = new LinkedHashMap<>();
                fixedDimension(node.attr("layout_width")).ifPresent(v -> size.put("width", WidgetProperty.number(v)));
                fixedDimension(node.attr("layout_height")).ifPresent(v -> size.put("height", WidgetProperty.number(v)));
                if (!size.isEmpty()) b.wrap(new WidgetWrapper(WidgetWrapper.Kind.SIZED_BOX, size));
            }

            if (!ownsBackground(kind)) {
                String bg = node.attr("background");
                if (bg != null) {
                    Optional<Long> c = color(node, "background");
                    if (c.isPresent()) {
                        b.wrap(WidgetWrapper.of(WidgetWrapper.Kind.BACKGROUND, "color", WidgetProperty.color(c.get())));
                    } else if (isDrawable(bg)) {
                        b.wrap(WidgetWrapper.of(WidgetWrapper.Kind.BACKGROUND, "image",
                                WidgetProperty.string(DartNames.imageAsset(MarkupNode.resourceName(bg)))));
                    }
                }
            }

            Map<String, WidgetProperty> padding = edges(node, "padding", "paddingStart", "paddingLeft",
                    "paddingTop", "paddingEnd", "paddingRight", "paddingBottom", "paddingHorizontal", "paddingVertical");
            if (padding != null) b.wrap(new WidgetWrapper(WidgetWrapper.Kind.PADDING, padding));

            if (!handlesTaps(kind)) {
                String handler = handlerFor(node, false);
                if (handler != null) {
                    b.wrap(WidgetWrapper.of(WidgetWrapper.Kind.INK_WELL, "onTap", WidgetProperty.handler(handler)));
                }
            }

            Map<String, WidgetProperty> margin = edges(node, "layout_margin", "layout_marginStart", "layout_marginLeft",
                    "layout_marginTop", "layout_marginEnd", "layout_marginRight", "layout_marginBottom",
                    "layout_marginHorizontal", "layout_marginVertical");
            if (margin != null) b.wrap(new WidgetWrapper(WidgetWrapper.Kind.MARGIN, margin));

            String visibility = node.attr("visibility");
            if ("gone".equals(visibility)) {
                b.wrap(WidgetWrapper.of(WidgetWrapper.Kind.VISIBILITY, "visible", WidgetProperty.bool(false)));
            } else if ("invisible".equals(visibility)) {
                Map<String, WidgetProperty> p = new LinkedHashMap<>();
                p.put("visible", WidgetProperty.bool(false));
                p.put("maintainSize", WidgetProperty.bool(true));
                b.wrap(new WidgetWrapper(WidgetWrapper.Kind.VISIBILITY, p));
            }
        }

        /** Wrappers that depend on the parent container: alignment, then expansion. */
        private void placeIn(WidgetDescriptor.Builder b, ResolvedLayoutNode node, ResolvedLayoutNode parent, boolean background) {
            if (parent == null) return;
            if (background) {
                b.wrap(WidgetWrapper.of(WidgetWrapper.Kind.POSITIONED_FILL));
                return;
            }
            ContainerKind kind = parent.containerKind;
            switch (kind) {
                case LINEAR -> {
                    String align = crossAxisAlignment(node.alignment, parent.orientation);
                    if (align != null) b.wrap(WidgetWrapper.of(WidgetWrapper.Kind.ALIGN, "alignment", WidgetProperty.symbol(align)));
                    if (node.expanded) {
                        Map<String, WidgetProperty> p = new LinkedHashMap<>();
                        long flex = weight(node.attr("layout_weight"));
                        if (flex > 1) p.put("flex", WidgetProperty.integer(flex));
                        b.wrap(new WidgetWrapper(WidgetWrapper.Kind.EXPANDED, p));
                    }
                }
                case RELATIVE -> {
                    switch (node.alignment) {
                        case CENTER -> b.wrap(WidgetWrapper.of(WidgetWrapper.Kind.CENTER));
                        case START -> b.wrap(WidgetWrapper.of(WidgetWrapper.Kind.ALIGN, "alignment",
                                WidgetProperty.symbol("Alignment.centerLeft")));
                        case END -> b.wrap(WidgetWrapper.of(WidgetWrapper.Kind.ALIGN, "alignment",
                                WidgetProperty.symbol("Alignment.centerRight")));
                        default -> {
                            // stays in flow position
                        }
                    }
                }
                case CONSTRAINT -> {
                    if (node.alignment != Alignment.CENTER) return;
                    double x = node.horizontalBias == null ? 0.0 : (node.horizontalBias - 0.5) * 2.0;
                    double y = node.verticalBias == null ? 0.0 : (node.verticalBias - 0.5) * 2.0;
                    if (x == 0.0 && y == 0.0) {
                        b.wrap(WidgetWrapper.of(WidgetWrapper.Kind.CENTER));
                    } else {
                        Map<String, WidgetProperty> p = new LinkedHashMap<>();
                        p.put("x", WidgetProperty.number(x));
                        p.put("y", WidgetProperty.number(y));
                        b.wrap(new WidgetWrapper(WidgetWrapper.Kind.ALIGN, p));
                    }
                }
                case FRAME -> {
                    if (parent.origin == ResolvedLayoutNode.Origin.INCLUDE) return;
                    String align = Gravity.stackAlignment(node.attr("layout_gravity"));
                    if (align != null) b.wrap(WidgetWrapper.of(WidgetWrapper.Kind.ALIGN, "alignment", WidgetProperty.symbol(align)));
                }
                case NONE -> {
                    // leaves and unknown containers impose no placement
                }
            }
        }

        // ---- attribute helpers ----

        /** Binding table first, then {@code android:onClick}, then a stub name when requested. */
        private String handlerFor(ResolvedLayoutNode node, boolean stub) {
            String id = node.id();
            if (id != null) {
                var binding = context.bindings.clickBinding(id);
                if (binding.isPresent()) return binding.get().handlerMethodName();
            }
            String onClick = node.attr("onClick");
            if (onClick != null && !onClick.isBlank()) return DartNames.methodName(onClick.trim());
            if (stub && id != null) return DartNames.handlerName(id);
            return null;
        }

        private Optional<String> text(ResolvedLayoutNode node, String attr) {
            String raw = node.attr(attr);
            if (raw == null) return Optional.empty();
            Optional<String> v = res.text(raw);
            if (v.isEmpty()) {
                warnings.warn(ConversionWarnings.UNRESOLVED_RESOURCE, "unresolved string " + raw,
                        "reference", raw, "view", String.valueOf(node.id()));
                return Optional.of(MarkupNode.resourceName(raw));
            }
            return v;
        }

        private Optional<Long> color(ResolvedLayoutNode node, String attr) {
            String raw = node.attr(attr);
            if (raw == null) return Optional.empty();
            Optional<Long> v = res.color(raw);
            if (v.isEmpty() && ResourceTable.isReference(raw, "color")) {
                warnings.warn(ConversionWarnings.UNRESOLVED_RESOURCE, "unresolved color " + raw,
                        "reference", raw, "view", String.valueOf(node.id()));
            }
            return v;
        }

        private Optional<Double> dimension(String raw) {
            return raw == null ? Optional.empty() : res.dimension(raw);
        }

        /** A size that is neither match/wrap nor a zero "match constraints" value. */
        private Optional<Double> fixedDimension(String raw) {
            if (raw == null || FILL.contains(raw) || "wrap_content".equals(raw)) return Optional.empty();
            return dimension(raw).filter(v -> v > 0);
        }

        private void textStyle(WidgetDescriptor.Builder b, ResolvedLayoutNode node, String colorKey) {
            dimension(node.attr("textSize")).ifPresent(v -> b.property("fontSize", WidgetProperty.number(v)));
            color(node, "textColor").ifPresent(v -> b.property(colorKey, WidgetProperty.color(v)));
            String style = node.attr("textStyle", "");
            if (style.contains("bold")) b.property("fontWeight", WidgetProperty.symbol("FontWeight.bold"));
            if (style.contains("italic")) b.property("fontStyle", WidgetProperty.symbol("FontStyle.italic"));
        }

        private Map<String, WidgetProperty> edges(ResolvedLayoutNode node, String all, String start, String left,
                                                  String top, String end, String right, String bottom,
                                                  String horizontal, String vertical) {
            double a = dimension(node.attr(all)).orElse(0.0);
            double h = dimension(node.attr(horizontal)).orElse(a);
            double v = dimension(node.attr(vertical)).orElse(a);
            double l = dimension(node.attr(start)).or(() -> dimension(node.attr(left))).orElse(h);
            double r = dimension(node.attr(end)).or(() -> dimension(node.attr(right))).orElse(h);
            double t = dimension(node.attr(top)).orElse(v);
            double bt = dimension(node.attr(bottom)).orElse(v);
            if (l == 0 && r == 0 && t == 0 && bt == 0) return null;
            Map<String, WidgetProperty> p = new LinkedHashMap<>();
            p.put("left", WidgetProperty.number(l));
            p.put("top", WidgetProperty.number(t));
            p.put("right", WidgetProperty.number(r));
            p.put("bottom", WidgetProperty.number(bt));
            return p;
        }

        private String imageAsset(ResolvedLayoutNode node) {
            String src = node.attr("srcCompat");
            if (src == null) src = node.attr("src");
            if (src == null || !isDrawable(src)) return null;
            return DartNames.imageAsset(MarkupNode.resourceName(src));
        }

        private double fraction(ResolvedLayoutNode node) {
            double max = integer(node.attr("max")).orElse(100L);
            double progress = integer(node.attr("progress")).orElse(0L);
            if (max <= 0) return 0.0;
            return Math.max(0.0, Math.min(1.0, progress / max));
        }

        private boolean isBackgroundImage(ResolvedLayoutNode child) {
            return ViewTag.of(child.tag()) == ViewTag.IMAGE_VIEW
                    && FILL.contains(child.attr("layout_width"))
                    && FILL.contains(child.attr("layout_height"));
        }
    }

    private static boolean ownsBackground(WidgetKind kind) {
        return kind == WidgetKind.ELEVATED_BUTTON || kind == WidgetKind.CARD || kind == WidgetKind.DIVIDER
                || kind == WidgetKind.FLOATING_ACTION_BUTTON;
    }

    private static boolean handlesTaps(WidgetKind kind) {
        return switch (kind) {
            case ELEVATED_BUTTON, TEXT_BUTTON, ICON_BUTTON, FLOATING_ACTION_BUTTON,
                    CHECKBOX, SWITCH, RADIO, SLIDER -> true;
            default -> false;
        };
    }

    private static boolean isDrawable(String ref) {
        return ref.startsWith("@drawable/") || ref.startsWith("@mipmap/");
    }

    static String boxFit(String scaleType) {
        if (scaleType == null) return "BoxFit.cover";
        return switch (scaleType) {
            case "centerInside", "center" -> "BoxFit.contain";
            case "fitXY" -> "BoxFit.fill";
            case "fitStart" -> "BoxFit.fitWidth";
            case "fitEnd" -> "BoxFit.fitHeight";
            default -> "BoxFit.cover";
        };
    }

    static String keyboardType(String inputType) {
        if (inputType.contains("emailaddress")) return "TextInputType.emailAddress";
        if (inputType.contains("phone")) return "TextInputType.phone";
        if (inputType.contains("number")) return "TextInputType.number";
        if (inputType.contains("multiline")) return "TextInputType.multiline";
        if (inputType.contains("uri")) return "TextInputType.url";
        return null;
    }

    static String textAlign(ResolvedLayoutNode node) {
        String ta = node.attr("textAlignment");
        if ("center".equals(ta)) return "TextAlign.center";
        if ("textEnd".equals(ta) || "viewEnd".equals(ta)) return "TextAlign.end";
        Set<String> g = Gravity.tokens(node.attr("gravity"));
        Alignment h = Gravity.horizontal(g);
        if (h == Alignment.CENTER) return "TextAlign.center";
        if (h == Alignment.END) return "TextAlign.end";
        return null;
    }

    static WidgetProperty mainAxisSymbol(Alignment a) {
        return switch (a) {
            case CENTER -> WidgetProperty.symbol("MainAxisAlignment.center");
            case END -> WidgetProperty.symbol("MainAxisAlignment.end");
            case START -> WidgetProperty.symbol("MainAxisAlignment.start");
            default -> null;
        };
    }

    static WidgetProperty crossAxisSymbol(Alignment a) {
        return switch (a) {
            case CENTER -> WidgetProperty.symbol("CrossAxisAlignment.center");
            case END -> WidgetProperty.symbol("CrossAxisAlignment.end");
            case START -> WidgetProperty.symbol("CrossAxisAlignment.start");
            case STRETCH -> WidgetProperty.symbol("CrossAxisAlignment.stretch");
            case NONE -> null;
        };
    }

    /** {@code Alignment} constant for a child's cross-axis gravity in a column or row. */
    static String crossAxisAlignment(Alignment a, Orientation parentAxis) {
        boolean row = parentAxis == Orientation.HORIZONTAL;
        return switch (a) {
            case START -> row ? "Alignment.topCenter" : "Alignment.centerLeft";
            case CENTER -> "Alignment.center";
            case END -> row ? "Alignment.bottomCenter" : "Alignment.centerRight";
            default -> null;
        };
    }

    static long weight(String raw) {
        if (raw == null) return 1;
        try {
            return Math.max(1, Math.round(Double.parseDouble(raw.trim())));
        } catch (NumberFormatException e) {
            return 1;
        }
    }

    static Optional<Long> integer(String raw) {
        if (raw == null) return Optional.empty();
        try {
            return Optional.of(Long.parseLong(raw.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
