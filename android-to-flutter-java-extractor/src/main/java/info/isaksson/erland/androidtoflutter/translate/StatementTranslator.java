package info.isaksson.erland.androidtoflutter.translate;

import info.isaksson.erland.androidtoflutter.ir.ConversionWarnings;
import info.isaksson.erland.androidtoflutter.ir.DartNames;
import info.isaksson.erland.androidtoflutter.ir.StateBinding;
import info.isaksson.erland.androidtoflutter.ir.code.JAssign;
import info.isaksson.erland.androidtoflutter.ir.code.JBinary;
import info.isaksson.erland.androidtoflutter.ir.code.JBlock;
import info.isaksson.erland.androidtoflutter.ir.code.JCall;
import info.isaksson.erland.androidtoflutter.ir.code.JCast;
import info.isaksson.erland.androidtoflutter.ir.code.JClassLiteral;
import info.isaksson.erland.androidtoflutter.ir.code.JExpression;
import info.isaksson.erland.androidtoflutter.ir.code.JExpressionStmt;
import info.isaksson.erland.androidtoflutter.ir.code.JFieldAccess;
import info.isaksson.erland.androidtoflutter.ir.code.JIf;
import info.isaksson.erland.androidtoflutter.ir.code.JJump;
import info.isaksson.erland.androidtoflutter.ir.code.JLambda;
import info.isaksson.erland.androidtoflutter.ir.code.JLiteral;
import info.isaksson.erland.androidtoflutter.ir.code.JLoop;
import info.isaksson.erland.androidtoflutter.ir.code.JName;
import info.isaksson.erland.androidtoflutter.ir.code.JNew;
import info.isaksson.erland.androidtoflutter.ir.code.JNode;
import info.isaksson.erland.androidtoflutter.ir.code.JReturn;
import info.isaksson.erland.androidtoflutter.ir.code.JStatement;
import info.isaksson.erland.androidtoflutter.ir.code.JTernary;
import info.isaksson.erland.androidtoflutter.ir.code.JUnary;
import info.isaksson.erland.androidtoflutter.ir.code.JUnsupported;
import info.isaksson.erland.androidtoflutter.ir.dart.DartAssign;
import info.isaksson.erland.androidtoflutter.ir.dart.DartBinary;
import info.isaksson.erland.androidtoflutter.ir.dart.DartBlock;
import info.isaksson.erland.androidtoflutter.ir.dart.DartCall;
import info.isaksson.erland.androidtoflutter.ir.dart.DartExpression;
import info.isaksson.erland.androidtoflutter.ir.dart.DartExpressionStmt;
import info.isaksson.erland.androidtoflutter.ir.dart.DartFieldAccess;
import info.isaksson.erland.androidtoflutter.ir.dart.DartIf;
import info.isaksson.erland.androidtoflutter.ir.dart.DartJump;
import info.isaksson.erland.androidtoflutter.ir.dart.DartLambda;
import info.isaksson.erland.androidtoflutter.ir.dart.DartListLiteral;
import info.isaksson.erland.androidtoflutter.ir.dart.DartLiteral;
import info.isaksson.erland.androidtoflutter.ir.dart.DartLoop;
import info.isaksson.erland.androidtoflutter.ir.dart.DartName;
import info.isaksson.erland.androidtoflutter.ir.dart.DartNode;
import info.isaksson.erland.androidtoflutter.ir.dart.DartReturn;
import info.isaksson.erland.androidtoflutter.ir.dart.DartStatement;
import info.isaksson.erland.androidtoflutter.ir.dart.DartTernary;
import info.isaksson.erland.androidtoflutter.ir.dart.DartUnary;
import info.isaksson.erland.androidtoflutter.ir.dart.DartUntranslated;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Translates one Java method body ({@code J*} tree) into the Dart tree.
 *
 * <p>Translation is total: a construct without a rule becomes {@link DartUntranslated}
 * holding the original text and the translations of its parts, and records an
 * {@code UNTRANSLATED_STATEMENT} warning. One instance translates one body and accumulates
 * the state bindings, same-class calls and untranslated count found in it.</p>
 */
public final class StatementTranslator {

    private static final Set<String> LOG_METHODS = Set.of("v", "d", "i", "w", "e", "wtf");
    private static final DartName CONTEXT = DartName.CONTEXT;

    private final TranslationScope scope;
    private final ConversionWarnings warnings;
    private final String site;
    private final Map<String, String> aliases;

    private final Set<StateBinding> stateBindings = new LinkedHashSet<>();
    private final Set<String> calledMethods = new LinkedHashSet<>();
    private int untranslated;

    /**
     * @param site    {@code Class#method} used as warning context
     * @param aliases extra variable → view id entries, e.g. the clicked-view parameter of a listener
     */
    public StatementTranslator(TranslationScope scope, ConversionWarnings warnings, String site, Map<String, String> aliases) {
        this.scope = scope == null ? TranslationScope.EMPTY : scope;
        this.warnings = warnings == null ? new ConversionWarnings() : warnings;
        this.site = site == null ? "" : site;
        this.aliases = new HashMap<>(aliases == null ? Map.of() : aliases);
    }

    public StatementTranslator(TranslationScope scope, ConversionWarnings warnings, String site) {
        this(scope, warnings, site, null);
    }

    public List<StateBinding> stateBindings() {
        return List.copyOf(stateBindings);
    }

    /** Same-class methods called from the translated code, in first-call order. */
    public List<String> calledMethods() {
        return List.copyOf(calledMethods);
    }

    public int untranslatedCount() {
        return untranslated;
    }

    public DartNode translate(JNode node) {
        if (node instanceof JStatement s && !(node instanceof JUnsupported)) return translateStatement(s);
        if (node instanceof JExpression e) return translateExpression(e);
        return translateStatement((JStatement) node);
    }

    public DartBlock translateBlock(JBlock block) {
        List<DartStatement> out = new ArrayList<>();
        Map<String, DialogChain> builders = new HashMap<>();
        Map<DialogChain, PendingBuilder> pending = new IdentityHashMap<>();
        for (JStatement s : block.statements()) {
            if (absorbViewLookup(s) || absorbDialogBuilder(s, builders, pending, out)) continue;
            out.add(translateStatement(s));
        }
        return new DartBlock(withUnshownBuilders(out, pending));
    }

    /** Source of a builder that has not been shown yet and where its first statement sat. */
    private static final class PendingBuilder {
        final int position;
        final List<String> source = new ArrayList<>();

        PendingBuilder(int position) {
            this.position = position;
        }
    }

    /** A builder never shown keeps its statements as one untranslated marker at its first position. */
    private List<DartStatement> withUnshownBuilders(List<DartStatement> out, Map<DialogChain, PendingBuilder> pending) {
        List<PendingBuilder> unshown = new ArrayList<>();
        for (Map.Entry<DialogChain, PendingBuilder> e : pending.entrySet()) {
            if (!e.getKey().shown()) unshown.add(e.getValue());
        }
        if (unshown.isEmpty()) return out;
        unshown.sort(Comparator.comparingInt((PendingBuilder p) -> p.position).reversed());
        List<DartStatement> merged = new ArrayList<>(out);
        for (PendingBuilder p : unshown) {
            merged.add(p.position, untranslatedNode(String.join("\n", p.source), List.of()));
        }
        return merged;
    }

    public DartStatement translateStatement(JStatement s) {
        if (s instanceof JBlock b) return translateBlock(b);
        if (s instanceof JAssign a) return assign(a);
        if (s instanceof JIf i) {
            return new DartIf(translateExpression(i.condition()), translateStatement(i.thenBranch()),
                    i.elseBranch() == null ? null : translateStatement(i.elseBranch()));
        }
        if (s instanceof JLoop l) return loop(l);
        if (s instanceof JExpressionStmt e) {
            DartExpression x = translateExpression(e.expression());
            if (x instanceof DartUntranslated u) return u;
            return new DartExpressionStmt(x);
        }
        if (s instanceof JReturn r) return new DartReturn(r.value() == null ? null : translateExpression(r.value()));
        if (s instanceof JJump j) {
            return new DartJump(j.kind() == JJump.Kind.BREAK ? DartJump.Kind.BREAK : DartJump.Kind.CONTINUE);
        }
        JUnsupported u = (JUnsupported) s;
        return untranslatedNode(u.rawText(), translateAll(u.parts()));
    }

    public DartExpression translateExpression(JExpression e) {
        if (e instanceof JLiteral l) return literal(l);
        if (e instanceof JName n) return new DartName(n.name());
        if (e instanceof JFieldAccess f) return fieldAccess(f);
        if (e instanceof JCall c) return call(c);
        if (e instanceof JNew n) return creation(n);
        if (e instanceof JBinary b) {
            return new DartBinary(translateExpression(b.left()), b.operator(), translateExpression(b.right()));
        }
        if (e instanceof JUnary u) return new DartUnary(u.operator(), translateExpression(u.operand()), u.prefix());
        if (e instanceof JTernary t) {
            return new DartTernary(translateExpression(t.condition()), translateExpression(t.whenTrue()),
                    translateExpression(t.whenFalse()));
        }
        if (e instanceof JLambda l) return lambda(l);
        if (e instanceof JCast c) return translateExpression(c.expression());
        if (e instanceof JClassLiteral c) return new DartName(c.simpleType());
        JUnsupported u = (JUnsupported) e;
        return untranslatedNode(u.rawText(), translateAll(u.parts()));
    }

    // ----- statements -----

    private DartStatement assign(JAssign a) {
        DartExpression target = translateExpression(a.target());
        DartExpression value = a.value() == null ? null : translateExpression(a.value());
        String type = a.isDeclaration() ? TypeMapper.declarationType(a.declaredType()) : null;
        return new DartAssign(target, a.operator(), value, type);
    }

    private DartStatement loop(JLoop l) {
        DartStatement body = translateStatement(l.body());
        DartExpression condition = l.condition() == null ? null : translateExpression(l.condition());
        return switch (l.kind()) {
            case WHILE -> new DartLoop(DartLoop.Kind.WHILE, null, condition, null, null, body);
            case DO_WHILE -> new DartLoop(DartLoop.Kind.DO_WHILE, null, condition, null, null, body);
            case FOR_EACH -> new DartLoop(DartLoop.Kind.FOR_IN, null, condition, null, l.variable(), body);
            case FOR -> {
                List<DartStatement> init = new ArrayList<>();
                for (JStatement s : l.init()) init.add(translateStatement(s));
                List<DartExpression> update = new ArrayList<>();
                for (JExpression u : l.update()) update.add(translateExpression(u));
                yield new DartLoop(DartLoop.Kind.FOR, init, condition, update, null, body);
            }
        };
    }

    /** {@code Button b = findViewById(R.id.x);} is dropped; later uses of {@code b} resolve to view x. */
    private boolean absorbViewLookup(JStatement s) {
        if (!(s instanceof JAssign a) || !(a.target() instanceof JName n) || a.value() == null) return false;
        JExpression v = unwrap(a.value());
        if (!(v instanceof JCall c) || !TranslationScope.isViewLookup(c)) return false;
        aliases.put(n.name(), TranslationScope.resourceName(c.argument(0), "id"));
        return true;
    }

    private boolean absorbDialogBuilder(JStatement s, Map<String, DialogChain> builders,
                                        Map<DialogChain, PendingBuilder> pending, List<DartStatement> out) {
        if (s instanceof JAssign a && a.isDeclaration() && a.target() instanceof JName n && a.value() != null) {
            JExpression v = unwrap(a.value());
            JExpression root = DialogChain.root(v);
            DialogChain chain = null;
            if (DialogChain.isBuilderCreation(root)) {
                chain = new DialogChain().absorb(v);
            } else if (root instanceof JName r && builders.containsKey(r.name())) {
                chain = builders.get(r.name()).absorb(v);
            }
            if (chain == null) return false;
            builders.put(n.name(), chain);
            pending.computeIfAbsent(chain, c -> new PendingBuilder(out.size()))
                    .source.add(a.declaredType() + " " + n.name() + " = " + source(a.value()) + ";");
            if (chain.shown()) out.add(new DartExpressionStmt(showDialog(chain)));
            return true;
        }
        if (s instanceof JExpressionStmt e && e.expression() instanceof JCall c
                && DialogChain.root(c) instanceof JName r && builders.containsKey(r.name())) {
            DialogChain chain = builders.get(r.name());
            boolean wasShown = chain.shown();
            chain.absorb(c);
            pending.computeIfAbsent(chain, x -> new PendingBuilder(out.size())).source.add(c.source() + ";");
            if (chain.shown() && (!wasShown || c.name().equals("show"))) {
                out.add(new DartExpressionStmt(showDialog(chain)));
            }
            return true;
        }
        return false;
    }

    private static String source(JExpression e) {
        if (e instanceof JCall c) return c.source();
        if (e instanceof JNew n) return n.source();
        if (e instanceof JCast c) return "(" + c.type() + ") " + source(c.expression());
        return e.toString();
    }

    // ----- expressions -----

    private DartExpression literal(JLiteral l) {
        return switch (l.kind()) {
            case STRING, CHAR -> DartLiteral.string(l.value());
            case INT, LONG -> new DartLiteral(DartLiteral.Kind.NUMBER, stripSuffix(l.value(), "lL"));
            case FLOAT, DOUBLE -> new DartLiteral(DartLiteral.Kind.NUMBER, decimal(stripSuffix(l.value(), "fFdD")));
            case BOOLEAN -> new DartLiteral(DartLiteral.Kind.BOOLEAN, l.value());
            case NULL -> new DartLiteral(DartLiteral.Kind.NULL, "null");
        };
    }

    private DartExpression fieldAccess(JFieldAccess f) {
        String res = TranslationScope.resourceName(f, null);
        if (res != null) {
            String type = TranslationScope.resourceName(f, "string") != null ? "string" : null;
            return DartLiteral.string(type == null ? res : scope.string(res));
        }
        if (f.scope() instanceof JName n && n.name().equals("this")) return new DartName(f.name());
        return new DartFieldAccess(translateExpression(f.scope()), f.name());
    }

    private DartExpression creation(JNew n) {
        String target = intentTarget(n);
        if (target != null) return route(target);
        return new DartCall(null, n.simpleType(), translateExpressions(n.arguments()), null, false);
    }

    private DartExpression lambda(JLambda l) {
        DartNode body = l.body() instanceof JBlock b
                ? translateBlock(b)
                : translateExpression((JExpression) l.body());
        return new DartLambda(l.parameters(), body);
    }

    private DartExpression call(JCall c) {
        DartExpression recognized = navigationOrLifecycle(c);
        if (recognized == null) recognized = transientMessage(c);
        if (recognized == null) recognized = dialog(c);
        if (recognized == null) recognized = logging(c);
        if (recognized == null) recognized = viewState(c);
        if (recognized == null) recognized = sameClass(c);
        if (recognized == null) recognized = library(c);
        if (recognized != null) return recognized;

        List<DartNode> parts = new ArrayList<>();
        if (c.scope() != null) parts.add(translateExpression(c.scope()));
        parts.addAll(translateExpressions(c.arguments()));
        return untranslatedNode(c.source(), parts);
    }

    private DartExpression navigationOrLifecycle(JCall c) {
        if (!isUnqualified(c)) return null;
        switch (c.name()) {
            case "startActivity", "startActivityForResult" -> {
                if (c.arguments().isEmpty()) return null;
                DartExpression route = translateExpression(c.argument(0));
                return new DartCall(new DartName("Navigator"), "push", List.of(CONTEXT, route), null, false);
            }
            case "finish", "onBackPressed" -> {
                return c.arguments().isEmpty() ? DartCall.of(new DartName("Navigator"), "maybePop", CONTEXT) : null;
            }
            case "finishAffinity" -> {
                DartLambda isFirst = new DartLambda(List.of("route"), new DartFieldAccess(new DartName("route"), "isFirst"));
                return DartCall.of(new DartName("Navigator"), "popUntil", CONTEXT, isFirst);
            }
            case "isTaskRoot" -> {
                return new DartUnary("!", DartCall.of(new DartName("Navigator"), "canPop", CONTEXT), true);
            }
            case "getString" -> {
                String res = TranslationScope.resourceName(c.argument(0), "string");
                return res == null ? null : DartLiteral.string(scope.string(res));
            }
            default -> {
                return null;
            }
        }
    }

    private DartExpression transientMessage(JCall c) {
        JCall make = c;
        if (c.name().equals("show") && c.scope() instanceof JCall inner) make = inner;
        if (!isMessageFactory(make)) return null;
        if (make != c && !c.arguments().isEmpty()) return null;
        return snackBar(translateExpression(make.argument(1)));
    }

    private DartExpression dialog(JCall c) {
        if (!c.name().equals("show")) return null;
        return DialogChain.of(c).map(this::showDialog).orElse(null);
    }

    private DartExpression logging(JCall c) {
        if (c.scope() instanceof JName n && n.name().equals("Log") && LOG_METHODS.contains(c.name())
                && c.arguments().size() >= 2) {
            return DartCall.function("debugPrint", translateExpression(c.argument(1)));
        }
        if (c.scope() instanceof JFieldAccess f && ("System.out".equals(f.qualifiedName()) || "System.err".equals(f.qualifiedName()))
                && (c.name().equals("println") || c.name().equals("print"))) {
            DartExpression arg = c.arguments().isEmpty() ? DartLiteral.string("") : translateExpression(c.argument(0));
            return DartCall.function("print", arg);
        }
        return null;
    }

    private DartExpression viewState(JCall c) {
        if (c.scope() == null) return null;
        // v.getText().toString()
        if (c.name().equals("toString") && c.arguments().isEmpty() && c.scope() instanceof JCall inner
                && inner.name().equals("getText") && inner.arguments().isEmpty()) {
            String id = scope.viewIdOf(inner.scope(), aliases);
            if (id != null) return controllerText(id);
        }
        String id = scope.viewIdOf(c.scope(), aliases);
        if (id == null) return null;
        int argc = c.arguments().size();
        switch (c.name()) {
            case "getText" -> {
                return argc == 0 ? controllerText(id) : null;
            }
            case "setText" -> {
                return argc == 1 ? setState(id, StateBinding.Property.TEXT, translateExpression(c.argument(0))) : null;
            }
            case "setVisibility" -> {
                return argc == 1 ? setState(id, StateBinding.Property.VISIBLE, visibility(c.argument(0))) : null;
            }
            case "setEnabled" -> {
                return argc == 1 ? setState(id, StateBinding.Property.ENABLED, translateExpression(c.argument(0))) : null;
            }
            case "setChecked" -> {
                return argc == 1 ? setState(id, StateBinding.Property.CHECKED, translateExpression(c.argument(0))) : null;
            }
            case "isChecked" -> {
                return argc == 0 ? stateRead(id, StateBinding.Property.CHECKED) : null;
            }
            case "isEnabled" -> {
                return argc == 0 ? stateRead(id, StateBinding.Property.ENABLED) : null;
            }
            default -> {
                return null;
            }
        }
    }

    private DartExpression sameClass(JCall c) {
        if (!isUnqualified(c) || !scope.classMethods.contains(c.name())) return null;
        calledMethods.add(c.name());
        List<DartExpression> args = new ArrayList<>();
        args.add(CONTEXT);
        args.addAll(translateExpressions(c.arguments()));
        return new DartCall(null, DartNames.methodName(c.name()), args, null, false);
    }

    private DartExpression library(JCall c) {
        int argc = c.arguments().size();
        if (c.scope() instanceof JName owner) {
            String key = owner.name() + "." + c.name();
            switch (key) {
                case "String.valueOf":
                    return argc == 1 ? DartCall.of(translateExpression(c.argument(0)), "toString") : null;
                case "Integer.parseInt":
                case "Integer.valueOf":
                case "Long.parseLong":
                    return argc == 1 ? DartCall.of(new DartName("int"), "parse", translateExpression(c.argument(0))) : null;
                case "Double.parseDouble":
                case "Double.valueOf":
                case "Float.parseFloat":
                    return argc == 1 ? DartCall.of(new DartName("double"), "parse", translateExpression(c.argument(0))) : null;
                case "TextUtils.isEmpty":
                    return argc == 1 ? new DartFieldAccess(translateExpression(c.argument(0)), "isEmpty") : null;
                default:
                    break;
            }
        }
        if (c.scope() == null || !isInstanceLibraryCall(c.name(), argc)) return null;
        DartExpression target = translateExpression(c.scope());
        switch (c.name()) {
            case "equals":
                return new DartBinary(target, "==", translateExpression(c.argument(0)));
            case "equalsIgnoreCase":
                return new DartBinary(DartCall.of(target, "toLowerCase"), "==",
                        DartCall.of(translateExpression(c.argument(0)), "toLowerCase"));
            case "isEmpty":
                return new DartFieldAccess(target, "isEmpty");
            case "length":
            case "size":
                return new DartFieldAccess(target, "length");
            case "contains":
            case "startsWith":
            case "endsWith":
                return DartCall.of(target, c.name(), translateExpression(c.argument(0)));
            default:
                return DartCall.of(target, c.name());
        }
    }

    private static boolean isInstanceLibraryCall(String name, int argc) {
        switch (name) {
            case "isEmpty":
            case "length":
            case "size":
            case "trim":
            case "toString":
            case "toUpperCase":
            case "toLowerCase":
                return argc == 0;
            case "equals":
            case "equalsIgnoreCase":
            case "contains":
            case "startsWith":
            case "endsWith":
                return argc == 1;
            default:
                return false;
        }
    }

    // ----- Flutter shapes -----

    private DartExpression route(String targetClass) {
        DartCall screen = new DartCall(null, DartNames.screenClassName(targetClass), List.of(), null, true);
        Map<String, DartExpression> named = new LinkedHashMap<>();
        named.put("builder", new DartLambda(List.of("context"), screen));
        return new DartCall(null, "MaterialPageRoute", List.of(), named, false);
    }

    private static DartExpression snackBar(DartExpression message) {
        Map<String, DartExpression> named = new LinkedHashMap<>();
        named.put("content", DartCall.function("Text", message));
        DartCall bar = new DartCall(null, "SnackBar", List.of(), named, false);
        DartCall messenger = DartCall.of(new DartName("ScaffoldMessenger"), "of", CONTEXT);
        return DartCall.of(messenger, "showSnackBar", bar);
    }

    private DartExpression showDialog(DialogChain chain) {
        Map<String, DartExpression> dialog = new LinkedHashMap<>();
        JExpression title = chain.argument("setTitle", 0);
        if (title != null) dialog.put("title", DartCall.function("Text", translateExpression(title)));
        JExpression message = chain.argument("setMessage", 0);
        if (message != null) dialog.put("content", DartCall.function("Text", translateExpression(message)));
        List<DartExpression> actions = new ArrayList<>();
        for (String setter : List.of("setNegativeButton", "setNeutralButton", "setPositiveButton")) {
            JExpression label = chain.argument(setter, 0);
            if (label != null) actions.add(dialogAction(label, chain.argument(setter, 1)));
        }
        if (!actions.isEmpty()) dialog.put("actions", new DartListLiteral(actions));

        Map<String, DartExpression> named = new LinkedHashMap<>();
        named.put("context", CONTEXT);
        named.put("builder", new DartLambda(List.of("context"), new DartCall(null, "AlertDialog", List.of(), dialog, false)));
        return new DartCall(null, "showDialog", List.of(), named, false);
    }

    private DartExpression dialogAction(JExpression label, JExpression listener) {
        List<DartStatement> body = new ArrayList<>();
        body.add(new DartExpressionStmt(DartCall.of(new DartName("Navigator"), "pop", CONTEXT)));
        if (listener instanceof JLambda l) {
            if (l.body() instanceof JBlock b) {
                body.addAll(translateBlock(b).statements());
            } else {
                body.add(translateStatement(new JExpressionStmt((JExpression) l.body())));
            }
        }
        Map<String, DartExpression> named = new LinkedHashMap<>();
        named.put("onPressed", new DartLambda(List.of(), new DartBlock(body)));
        named.put("child", DartCall.function("Text", translateExpression(label)));
        return new DartCall(null, "TextButton", List.of(), named, false);
    }

    private DartExpression setState(String viewId, StateBinding.Property property, DartExpression value) {
        StateBinding binding = new StateBinding(viewId, property);
        stateBindings.add(binding);
        DartAssign assign = new DartAssign(new DartName(binding.fieldName()), "=", value, null);
        return DartCall.function("setState", new DartLambda(List.of(), new DartBlock(List.of(assign))));
    }

    private DartExpression stateRead(String viewId, StateBinding.Property property) {
        StateBinding binding = new StateBinding(viewId, property);
        stateBindings.add(binding);
        return new DartName(binding.fieldName());
    }

    private static DartExpression controllerText(String viewId) {
        return new DartFieldAccess(new DartName(DartNames.controllerName(viewId)), "text");
    }

    private DartExpression visibility(JExpression arg) {
        String name = arg instanceof JName n ? n.name()
                : arg instanceof JFieldAccess f ? f.name()
                : null;
        if ("VISIBLE".equals(name)) return new DartLiteral(DartLiteral.Kind.BOOLEAN, "true");
        if ("GONE".equals(name) || "INVISIBLE".equals(name)) return new DartLiteral(DartLiteral.Kind.BOOLEAN, "false");
        // View.VISIBLE is 0
        return new DartBinary(translateExpression(arg), "==", new DartLiteral(DartLiteral.Kind.NUMBER, "0"));
    }

    // ----- helpers -----

    private DartUntranslated untranslatedNode(String rawText, List<DartNode> parts) {
        untranslated++;
        warnings.warn(ConversionWarnings.UNTRANSLATED_STATEMENT, "No translation for: " + firstLine(rawText), "site", site);
        return new DartUntranslated(rawText, parts);
    }

    private List<DartNode> translateAll(List<JNode> nodes) {
        List<DartNode> out = new ArrayList<>();
        for (JNode n : nodes) out.add(translate(n));
        return out;
    }

    private List<DartExpression> translateExpressions(List<JExpression> list) {
        List<DartExpression> out = new ArrayList<>();
        for (JExpression e : list) out.add(translateExpression(e));
        return out;
    }

    private static boolean isUnqualified(JCall c) {
        return c.scope() == null || (c.scope() instanceof JName n && n.name().equals("this"));
    }

    static boolean isMessageFactory(JCall c) {
        if (!(c.scope() instanceof JName owner) || c.arguments().size() < 2) return false;
        return (owner.name().equals("Toast") && c.name().equals("makeText"))
                || (owner.name().equals("Snackbar") && c.name().equals("make"));
    }

    /** Target class of {@code new Intent(ctx, X.class)}, or null. */
    static String intentTarget(JNew n) {
        if (!n.simpleType().equals("Intent")) return null;
        for (JExpression arg : n.arguments()) {
            if (arg instanceof JClassLiteral c) return c.simpleType();
        }
        return null;
    }

    private static JExpression unwrap(JExpression e) {
        JExpression x = e;
        while (x instanceof JCast c) x = c.expression();
        return x;
    }

    private static String stripSuffix(String value, String suffixes) {
        String v = value.replace("_", "");
        String strip = v.startsWith("0x") || v.startsWith("0X") ? "lL" : suffixes;
        while (!v.isEmpty() && strip.indexOf(v.charAt(v.length() - 1)) >= 0) v = v.substring(0, v.length() - 1);
        return v;
    }

    private static String decimal(String v) {
        if (v.startsWith(".")) return "0" + v;
        if (v.endsWith(".")) return v + "0";
        return v;
    }

    private static String firstLine(String text) {
        String t = text.strip();
        int nl = t.indexOf('\n');
        return nl >= 0 ? t.substring(0, nl).strip() + " ..." : t;
    }
}
