package info.isaksson.erland.androidtoflutter.emitter;

import info.isaksson.erland.androidtoflutter.ir.DartNames;
import info.isaksson.erland.androidtoflutter.ir.ScreenModel;
import info.isaksson.erland.androidtoflutter.ir.StateBinding;
import info.isaksson.erland.androidtoflutter.ir.TranslatedHandler;
import info.isaksson.erland.androidtoflutter.ir.WidgetDescriptor;
import info.isaksson.erland.androidtoflutter.ir.WidgetKind;
import info.isaksson.erland.androidtoflutter.ir.WidgetProperty;
import info.isaksson.erland.androidtoflutter.ir.WidgetWrapper;
import info.isaksson.erland.androidtoflutter.ir.dart.DartCall;
import info.isaksson.erland.androidtoflutter.ir.dart.DartExpression;
import info.isaksson.erland.androidtoflutter.ir.dart.DartLiteral;
import info.isaksson.erland.androidtoflutter.ir.dart.DartName;
import info.isaksson.erland.androidtoflutter.ir.dart.DartNode;
import info.isaksson.erland.androidtoflutter.ir.dart.DartTrees;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Public API: serialize a {@link ScreenModel} into one Dart source file.
 *
 * <p>The screen becomes a {@code StatefulWidget} when it has text fields or state fields,
 * otherwise a {@code StatelessWidget}. Translated handlers follow {@code build}, sorted by
 * name, together with empty stubs for handler names the widget tree references but no
 * translated method provides. Custom-drawn views get a {@code CustomPainter} stub each.</p>
 *
 * <p>Output depends only on the model, so identical models give identical text.</p>
 */
public final class DartEmitter {

    private static final Pattern CONTROLLER = Pattern.compile("_[A-Za-z0-9]+Controller");

    /** Dart source of the screen. */
    public String emitScreen(ScreenModel model) {
        if (model == null) throw new IllegalArgumentException("model must not be null");
        return new Emission(model).render();
    }

    /** Write the screen to {@code outFile}, creating parent directories. */
    public void emitScreen(ScreenModel model, Path outFile) throws IOException {
        if (outFile == null) throw new IllegalArgumentException("outFile must not be null");
        String dart = emitScreen(model);
        Path parent = outFile.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(outFile, dart, StandardCharsets.UTF_8);
    }

    private static final class Emission {
        private final ScreenModel model;
        private final List<String> out = new ArrayList<>();
        private final Set<StateBinding> stateBindings;
        /** Controller field → initial text, or null. */
        private final Map<String, String> controllers = new TreeMap<>();
        private final Set<String> referencedHandlers = new TreeSet<>();
        private final Set<String> painters = new TreeSet<>();
        private final Map<String, WidgetDescriptor> byViewId = new LinkedHashMap<>();

        Emission(ScreenModel model) {
            this.model = model;
            this.stateBindings = new LinkedHashSet<>(model.stateBindings());
            scan(model.widgetTree);
            for (TranslatedHandler h : model.handlers) scanControllers(h.body());
        }

        String render() {
            String name = model.screenName;
            boolean stateful = !controllers.isEmpty() || !stateBindings.isEmpty();

            header();
            out.add("import 'package:flutter/material.dart';");
            out.add("");
            if (stateful) {
                out.add("class " + name + " extends StatefulWidget {");
                out.add("  const " + name + "({super.key});");
                out.add("");
                out.add("  @override");
                out.add("  State<" + name + "> createState() => _" + name + "State();");
                out.add("}");
                out.add("");
                out.add("class _" + name + "State extends State<" + name + "> {");
                fields();
                dispose();
            } else {
                out.add("class " + name + " extends StatelessWidget {");
                out.add("  const " + name + "({super.key});");
                out.add("");
            }
            build();
            handlers();
            out.add("}");
            for (String painter : painters) painter(painter);

            return String.join("\n", out) + "\n";
        }

        private void header() {
            StringBuilder source = new StringBuilder("// Converted from layout ");
            source.append(model.layoutId == null ? "(none)" : model.layoutId);
            if (model.className != null) source.append(" and ").append(model.className);
            out.add(source.append('.').toString());
            int untranslated = model.untranslatedCount();
            if (untranslated > 0) {
                out.add("// " + untranslated + " statement(s) could not be translated; look for \"untranslated:\" comments.");
            }
            out.add("");
        }

        private void fields() {
            for (Map.Entry<String, String> c : controllers.entrySet()) {
                String init = c.getValue() == null
                        ? "TextEditingController()"
                        : "TextEditingController(text: " + DartExpressionPrinter.quote(c.getValue()) + ")";
                out.add("  final TextEditingController " + c.getKey() + " = " + init + ";");
            }
            for (StateBinding b : stateBindings) {
                out.add("  " + b.property().dartType() + " " + b.fieldName() + " = " + initialValue(b) + ";");
            }
            out.add("");
        }

        private void dispose() {
            if (controllers.isEmpty()) return;
            out.add("  @override");
            out.add("  void dispose() {");
            for (String c : controllers.keySet()) out.add("    " + c + ".dispose();");
            out.add("    super.dispose();");
            out.add("  }");
            out.add("");
        }

        private void build() {
            Map<String, DartExpression> scaffold = new LinkedHashMap<>();
            Map<String, DartExpression> appBar = new LinkedHashMap<>();
            appBar.put("title", new DartCall(null, "Text", List.of(DartLiteral.string(title(model.screenName))), null, true));
            scaffold.put("appBar", new DartCall(null, "AppBar", List.of(), appBar, false));
            scaffold.put("body", new WidgetTreeBuilder(stateBindings).build(model.widgetTree));
            DartCall root = new DartCall(null, "Scaffold", List.of(), scaffold, false);

            out.add("  @override");
            out.add("  Widget build(BuildContext context) {");
            out.add("    return " + DartExpressionPrinter.expression(root, 2) + ";");
            out.add("  }");
        }

        private void handlers() {
            Map<String, TranslatedHandler> translated = new TreeMap<>();
            for (TranslatedHandler h : model.handlers) translated.put(h.name(), h);
            Set<String> names = new TreeSet<>(translated.keySet());
            names.addAll(referencedHandlers);
            for (String handlerName : names) {
                out.add("");
                TranslatedHandler h = translated.get(handlerName);
                List<String> params = new ArrayList<>();
                params.add("BuildContext context");
                if (h != null) params.addAll(h.parameters());
                String signature = "  void " + handlerName + "(" + String.join(", ", params) + ")";
                if (h == null || h.body().statements().isEmpty()) {
                    out.add(signature + " {}");
                    continue;
                }
                out.add(signature + " {");
                out.addAll(DartExpressionPrinter.blockBody(h.body(), 2));
                out.add("  }");
            }
        }

        private void painter(String painter) {
            out.add("");
            out.add("class " + painter + " extends CustomPainter {");
            out.add("  @override");
            out.add("  void paint(Canvas canvas, Size size) {}");
            out.add("");
            out.add("  @override");
            out.add("  bool shouldRepaint(covariant CustomPainter oldDelegate) => false;");
            out.add("}");
        }

        // ----- scanning -----

        private void scan(WidgetDescriptor d) {
            if (d.viewId != null) byViewId.putIfAbsent(d.viewId, d);
            if (d.kind == WidgetKind.TEXT_FIELD && d.viewId != null) {
                WidgetProperty text = d.property("text");
                controllers.put(DartNames.controllerName(d.viewId), text == null ? null : text.value);
            }
            if (d.kind == WidgetKind.CUSTOM_PAINT && d.property("painter") != null) {
                painters.add(d.property("painter").value);
            }
            for (WidgetProperty p : d.properties.values()) {
                if (p.type == WidgetProperty.Type.HANDLER) referencedHandlers.add(p.value);
            }
            for (WidgetWrapper w : d.wrappers) {
                for (WidgetProperty p : w.properties.values()) {
                    if (p.type == WidgetProperty.Type.HANDLER) referencedHandlers.add(p.value);
                }
            }
            for (WidgetDescriptor c : d.children) scan(c);
        }

        /** Controllers read by handlers for views that are not text fields in this layout. */
        private void scanControllers(DartNode node) {
            if (node instanceof DartName n && CONTROLLER.matcher(n.name()).matches()) {
                controllers.putIfAbsent(n.name(), null);
            }
            for (DartNode c : DartTrees.children(node)) scanControllers(c);
        }

        /** Initial state from the layout when the view is in the tree. */
        private String initialValue(StateBinding b) {
            WidgetDescriptor d = byViewId.get(b.viewId());
            if (d == null) return b.property().initialValue();
            switch (b.property()) {
                case TEXT: {
                    for (String key : List.of("text", "label", "title")) {
                        WidgetProperty p = d.property(key);
                        if (p != null && p.type == WidgetProperty.Type.STRING) return DartExpressionPrinter.quote(p.value);
                    }
                    return b.property().initialValue();
                }
                case VISIBLE: {
                    WidgetProperty visible = d.wrapper(WidgetWrapper.Kind.VISIBILITY)
                            .map(w -> w.property("visible")).orElse(null);
                    return visible == null ? b.property().initialValue() : visible.value;
                }
                case CHECKED: {
                    WidgetProperty value = d.property("value");
                    return value != null && value.type == WidgetProperty.Type.BOOLEAN ? value.value : b.property().initialValue();
                }
                default:
                    return b.property().initialValue();
            }
        }
    }

    /** {@code ConvertedUserProfile} → {@code User Profile}. */
    static String title(String screenName) {
        String base = screenName.startsWith("Converted") && screenName.length() > "Converted".length()
                ? screenName.substring("Converted".length())
                : screenName;
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < base.length(); i++) {
            char c = base.charAt(i);
            if (i > 0 && Character.isUpperCase(c) && !Character.isUpperCase(base.charAt(i - 1))) sb.append(' ');
            sb.append(c);
        }
        return sb.toString();
    }
}
