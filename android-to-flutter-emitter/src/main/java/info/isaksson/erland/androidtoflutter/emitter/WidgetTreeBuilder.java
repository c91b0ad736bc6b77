package info.isaksson.erland.androidtoflutter.emitter;

import info.isaksson.erland.androidtoflutter.ir.DartNames;
import info.isaksson.erland.androidtoflutter.ir.StateBinding;
import info.isaksson.erland.androidtoflutter.ir.WidgetDescriptor;
import info.isaksson.erland.androidtoflutter.ir.WidgetKind;
import info.isaksson.erland.androidtoflutter.ir.WidgetProperty;
import info.isaksson.erland.androidtoflutter.ir.WidgetWrapper;
import info.isaksson.erland.androidtoflutter.ir.dart.DartAssign;
import info.isaksson.erland.androidtoflutter.ir.dart.DartBinary;
import info.isaksson.erland.androidtoflutter.ir.dart.DartBlock;
import info.isaksson.erland.androidtoflutter.ir.dart.DartCall;
import info.isaksson.erland.androidtoflutter.ir.dart.DartExpression;
import info.isaksson.erland.androidtoflutter.ir.dart.DartExpressionStmt;
import info.isaksson.erland.androidtoflutter.ir.dart.DartLambda;
import info.isaksson.erland.androidtoflutter.ir.dart.DartListLiteral;
import info.isaksson.erland.androidtoflutter.ir.dart.DartLiteral;
import info.isaksson.erland.androidtoflutter.ir.dart.DartName;
import info.isaksson.erland.androidtoflutter.ir.dart.DartStatement;
import info.isaksson.erland.androidtoflutter.ir.dart.DartTernary;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the Flutter widget expression for a descriptor tree. Wrappers are applied inner to
 * outer; view properties that handlers toggle are read from their state fields.
 */
final class WidgetTreeBuilder {

    private static final Set<WidgetWrapper.Kind> PLACEMENT = Set.of(
            WidgetWrapper.Kind.ALIGN, WidgetWrapper.Kind.CENTER,
            WidgetWrapper.Kind.EXPANDED, WidgetWrapper.Kind.POSITIONED_FILL);

    private final Set<StateBinding> stateBindings;

    WidgetTreeBuilder(Set<StateBinding> stateBindings) {
        this.stateBindings = stateBindings;
    }

    DartExpression build(WidgetDescriptor d) {
        DartExpression core = widget(d);
        return wrap(d, core);
    }

    // ----- widgets -----

    private DartExpression widget(WidgetDescriptor d) {
        Args a = new Args();
        switch (d.kind) {
            case COLUMN, ROW -> {
                a.value(d, "mainAxisAlignment");
                a.value(d, "crossAxisAlignment");
                a.put("children", children(d));
            }
            case STACK -> a.put("children", children(d));
            case LIST_VIEW -> {
                a.put("shrinkWrap", bool(true));
                a.put("children", children(d));
            }
            case SINGLE_CHILD_SCROLL_VIEW -> {
                a.value(d, "scrollDirection");
                a.put("child", singleChild(d));
            }
            case CONTAINER -> a.put("child", singleChild(d));
            case SIZED_BOX -> {
                a.value(d, "width");
                a.value(d, "height");
                a.put("child", singleChild(d));
            }
            case CARD -> {
                a.value(d, "elevation");
                a.value(d, "color");
                WidgetProperty radius = d.property("radius");
                if (radius != null) {
                    a.put("shape", named("RoundedRectangleBorder", "borderRadius",
                            DartCall.of(new DartName("BorderRadius"), "circular", value(radius))));
                }
                a.put("child", singleChild(d));
            }
            case TEXT -> {
                return text(d);
            }
            case TEXT_BUTTON -> {
                a.put("onPressed", pressed(d, "onPressed", null));
                a.put("child", label(d, "label", textStyle(d, "color")));
            }
            case ELEVATED_BUTTON -> {
                a.put("onPressed", pressed(d, "onPressed", new DartLambda(List.of(), new DartBlock(List.of()))));
                Args style = new Args();
                style.value(d, "backgroundColor");
                style.value(d, "foregroundColor");
                if (!style.isEmpty()) a.put("style", style.call(new DartName("ElevatedButton"), "styleFrom"));
                a.put("child", label(d, "label", textStyle(d, null)));
            }
            case ICON_BUTTON -> {
                a.put("onPressed", pressed(d, "onPressed", new DartLambda(List.of(), new DartBlock(List.of()))));
                a.value(d, "tooltip");
                WidgetProperty asset = d.property("asset");
                a.put("icon", asset != null
                        ? DartCall.of(new DartName("Image"), "asset", value(asset))
                        : DartCall.function("Icon", symbolOr(d, "icon", "Icons.image")));
            }
            case FLOATING_ACTION_BUTTON -> {
                a.put("onPressed", pressed(d, "onPressed", new DartLambda(List.of(), new DartBlock(List.of()))));
                a.value(d, "backgroundColor");
                a.value(d, "tooltip");
                a.put("child", DartCall.function("Icon", symbolOr(d, "icon", "Icons.add")));
            }
            case TEXT_FIELD -> textField(d, a);
            case IMAGE -> {
                WidgetProperty asset = d.property("asset");
                if (asset == null) {
                    return named("Container", "color", new DartName("Colors.grey"));
                }
                Args img = new Args();
                img.value(d, "fit");
                img.value(d, "semanticLabel");
                return img.call(new DartName("Image"), "asset", value(asset));
            }
            case CHECKBOX, SWITCH, RADIO -> toggle(d, a);
            case SLIDER -> {
                a.value(d, "value");
                a.put("onChanged", changed(d, null));
            }
            case CIRCULAR_PROGRESS_INDICATOR -> {
            }
            case LINEAR_PROGRESS_INDICATOR -> a.value(d, "value");
            case DIVIDER -> {
                a.value(d, "height");
                a.value(d, "thickness");
                a.value(d, "color");
            }
            case CUSTOM_PAINT -> {
                a.put("painter", DartCall.function(d.property("painter").value));
                a.put("child", singleChild(d));
            }
            case PLACEHOLDER -> {
                DartExpression inner = d.children.isEmpty()
                        ? named("Center", "child", DartCall.function("Text", value(d.property("label"))))
                        : singleChild(d);
                a.put("child", inner);
            }
            case UNKNOWN_PLACEHOLDER -> a.put("key", DartCall.function("ValueKey",
                    DartLiteral.string(d.sourceTag == null ? "unknown" : d.sourceTag)));
        }
        return a.call(null, d.kind.dartName());
    }

    private DartExpression text(WidgetDescriptor d) {
        Args a = new Args();
        a.value(d, "textAlign");
        a.value(d, "maxLines");
        DartExpression style = textStyle(d, "color");
        if (style != null) a.put("style", style);
        return a.call(null, "Text", textValue(d, "text"));
    }

    private void textField(WidgetDescriptor d, Args a) {
        if (d.viewId != null) a.put("controller", new DartName(DartNames.controllerName(d.viewId)));
        StateBinding enabled = binding(d, StateBinding.Property.ENABLED);
        if (enabled != null) a.put("enabled", new DartName(enabled.fieldName()));
        a.value(d, "obscureText");
        a.value(d, "keyboardType");
        a.value(d, "maxLines");
        DartExpression style = textStyle(d, "color");
        if (style != null) a.put("style", style);
        Args decoration = new Args();
        decoration.value(d, "hintText");
        decoration.value(d, "labelText");
        if (!decoration.isEmpty()) a.put("decoration", decoration.call(null, "InputDecoration"));
    }

    private void toggle(WidgetDescriptor d, Args a) {
        a.put("title", DartCall.function("Text", textValue(d, "title")));
        StateBinding checked = binding(d, StateBinding.Property.CHECKED);
        DartExpression current = checked != null ? new DartName(checked.fieldName()) : value(d.property("value"));
        if (d.kind == WidgetKind.RADIO) {
            a.put("value", bool(true));
            a.put("groupValue", current);
        } else {
            a.put("value", current);
        }
        DartExpression update = null;
        if (checked != null) {
            DartExpression next = switch (d.kind) {
                case CHECKBOX -> new DartBinary(new DartName("value"), "??", bool(false));
                case RADIO -> new DartBinary(new DartName("value"), "==", bool(true));
                default -> new DartName("value");
            };
            update = DartCall.function("setState", new DartLambda(List.of(), new DartBlock(List.of(
                    new DartAssign(new DartName(checked.fieldName()), "=", next, null)))));
        }
        a.put("onChanged", changed(d, update));
    }

    // ----- wrappers -----

    private DartExpression wrap(WidgetDescriptor d, DartExpression core) {
        StateBinding visible = binding(d, StateBinding.Property.VISIBLE);
        boolean visibilityPlaced = visible == null;
        DartExpression e = core;
        for (WidgetWrapper w : d.wrappers) {
            if (!visibilityPlaced && (w.kind == WidgetWrapper.Kind.VISIBILITY || PLACEMENT.contains(w.kind))) {
                e = visibility(e, visible, w.kind == WidgetWrapper.Kind.VISIBILITY ? w : null);
                visibilityPlaced = true;
                if (w.kind == WidgetWrapper.Kind.VISIBILITY) continue;
            }
            e = wrapper(w, e);
        }
        if (!visibilityPlaced) e = visibility(e, visible, null);
        return e;
    }

    private DartExpression visibility(DartExpression child, StateBinding visible, WidgetWrapper layout) {
        Args a = new Args();
        a.put("visible", new DartName(visible.fieldName()));
        if (layout != null && layout.property("maintainSize") != null) maintainSize(a);
        a.put("child", child);
        return a.call(null, "Visibility");
    }

    private DartExpression wrapper(WidgetWrapper w, DartExpression child) {
        Args a = new Args();
        switch (w.kind) {
            case SIZED_BOX -> {
                a.value(w.property("width"), "width");
                a.value(w.property("height"), "height");
            }
            case BACKGROUND -> {
                WidgetProperty color = w.property("color");
                if (color != null) {
                    a.put("color", value(color));
                } else {
                    Args image = new Args();
                    image.put("image", DartCall.function("AssetImage", value(w.property("image"))));
                    image.put("fit", new DartName("BoxFit.cover"));
                    a.put("decoration", named("BoxDecoration", "image", image.call(null, "DecorationImage")));
                }
            }
            case PADDING, MARGIN -> a.put("padding", edgeInsets(w));
            case VISIBILITY -> {
                a.value(w.property("visible"), "visible");
                if (w.property("maintainSize") != null) maintainSize(a);
            }
            case ALIGN -> {
                WidgetProperty alignment = w.property("alignment");
                a.put("alignment", alignment != null ? value(alignment)
                        : DartCall.function("Alignment", value(w.property("x")), value(w.property("y"))));
            }
            case INK_WELL -> a.put("onTap", handler(w.property("onTap").value, null));
            case EXPANDED -> a.value(w.property("flex"), "flex");
            case CENTER, POSITIONED_FILL -> {
            }
        }
        a.put("child", child);
        String name = w.kind.dartName();
        int dot = name.indexOf('.');
        return dot < 0 ? a.call(null, name) : a.call(new DartName(name.substring(0, dot)), name.substring(dot + 1));
    }

    private static void maintainSize(Args a) {
        a.put("maintainSize", bool(true));
        a.put("maintainAnimation", bool(true));
        a.put("maintainState", bool(true));
    }

    private static DartExpression edgeInsets(WidgetWrapper w) {
        WidgetProperty l = w.property("left");
        WidgetProperty t = w.property("top");
        WidgetProperty r = w.property("right");
        WidgetProperty b = w.property("bottom");
        DartName insets = new DartName("EdgeInsets");
        if (l.equals(t) && t.equals(r) && r.equals(b)) return DartCall.of(insets, "all", value(l));
        return DartCall.of(insets, "fromLTRB", value(l), value(t), value(r), value(b));
    }

    // ----- handlers -----

    /** {@code onPressed} value: the handler, disabled by an enabled-state field when one exists. */
    private DartExpression pressed(WidgetDescriptor d, String key, DartExpression fallback) {
        WidgetProperty p = d.property(key);
        if (p == null) return fallback == null ? new DartLiteral(DartLiteral.Kind.NULL, null) : fallback;
        return handler(p.value, binding(d, StateBinding.Property.ENABLED));
    }

    /** {@code onChanged} value of toggles and sliders, running {@code update} before the handler. */
    private DartExpression changed(WidgetDescriptor d, DartExpression update) {
        List<DartStatement> body = new ArrayList<>();
        if (update != null) body.add(new DartExpressionStmt(update));
        WidgetProperty p = d.property("onChanged");
        if (p != null) body.add(new DartExpressionStmt(DartCall.function(p.value, DartName.CONTEXT)));
        DartExpression callback = body.size() == 1 && update == null
                ? new DartLambda(List.of("value"), DartCall.function(p.value, DartName.CONTEXT))
                : new DartLambda(List.of("value"), new DartBlock(body));
        StateBinding enabled = binding(d, StateBinding.Property.ENABLED);
        if (enabled == null) return callback;
        return new DartTernary(new DartName(enabled.fieldName()), callback, new DartLiteral(DartLiteral.Kind.NULL, null));
    }

    private static DartExpression handler(String name, StateBinding enabled) {
        DartExpression callback = new DartLambda(List.of(), DartCall.function(name, DartName.CONTEXT));
        if (enabled == null) return callback;
        return new DartTernary(new DartName(enabled.fieldName()), callback, new DartLiteral(DartLiteral.Kind.NULL, null));
    }

    // ----- helpers -----

    private DartExpression children(WidgetDescriptor d) {
        List<DartExpression> out = new ArrayList<>();
        for (WidgetDescriptor c : d.children) out.add(build(c));
        return new DartListLiteral(out);
    }

    /** The only child, a column of several, or null when there are none. */
    private DartExpression singleChild(WidgetDescriptor d) {
        if (d.children.isEmpty()) return null;
        if (d.children.size() == 1) return build(d.children.get(0));
        return named("Column", "children", children(d));
    }

    private DartExpression label(WidgetDescriptor d, String key, DartExpression style) {
        Args a = new Args();
        if (style != null) a.put("style", style);
        return a.call(null, "Text", textValue(d, key));
    }

    /** Literal text of {@code key}, or the text state field when a handler changes it. */
    private DartExpression textValue(WidgetDescriptor d, String key) {
        StateBinding text = binding(d, StateBinding.Property.TEXT);
        if (text != null) return new DartName(text.fieldName());
        WidgetProperty p = d.property(key);
        return DartLiteral.string(p == null ? "" : p.value);
    }

    private static DartExpression textStyle(WidgetDescriptor d, String colorKey) {
        Args a = new Args();
        a.value(d, "fontSize");
        if (colorKey != null) a.value(d.property(colorKey), "color");
        a.value(d, "fontWeight");
        a.value(d, "fontStyle");
        return a.isEmpty() ? null : a.call(null, "TextStyle");
    }

    private StateBinding binding(WidgetDescriptor d, StateBinding.Property property) {
        if (d.viewId == null) return null;
        StateBinding b = new StateBinding(d.viewId, property);
        return stateBindings.contains(b) ? b : null;
    }

    private static DartExpression symbolOr(WidgetDescriptor d, String key, String fallback) {
        WidgetProperty p = d.property(key);
        return new DartName(p == null ? fallback : p.value);
    }

    private static DartExpression named(String name, String key, DartExpression value) {
        Map<String, DartExpression> args = new LinkedHashMap<>();
        args.put(key, value);
        return new DartCall(null, name, List.of(), args, false);
    }

    private static DartExpression bool(boolean b) {
        return new DartLiteral(DartLiteral.Kind.BOOLEAN, Boolean.toString(b));
    }

    /** Dart value of a literal widget property. */
    static DartExpression value(WidgetProperty p) {
        return switch (p.type) {
            case STRING -> DartLiteral.string(p.value);
            case NUMBER -> new DartLiteral(DartLiteral.Kind.NUMBER, p.value);
            case BOOLEAN -> new DartLiteral(DartLiteral.Kind.BOOLEAN, p.value);
            case SYMBOL -> new DartName(p.value);
            case COLOR -> DartCall.function("Color", new DartLiteral(DartLiteral.Kind.NUMBER, p.value));
            case HANDLER -> handler(p.value, null);
        };
    }

    /** Named arguments in insertion order; null values are skipped. */
    private static final class Args {
        private final Map<String, DartExpression> named = new LinkedHashMap<>();

        void put(String key, DartExpression value) {
            if (value != null) named.put(key, value);
        }

        void value(WidgetDescriptor d, String key) {
            value(d.property(key), key);
        }

        void value(WidgetProperty p, String key) {
            if (p != null) named.put(key, WidgetTreeBuilder.value(p));
        }

        boolean isEmpty() {
            return named.isEmpty();
        }

        DartCall call(DartExpression target, String name, DartExpression... positional) {
            return new DartCall(target, name, List.of(positional), named, false);
        }
    }
}
