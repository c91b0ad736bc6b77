package info.isaksson.erland.androidtoflutter.extract;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.CastExpr;
import com.github.javaparser.ast.expr.ClassExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.MethodReferenceExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.ThisExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.SwitchStmt;
import info.isaksson.erland.androidtoflutter.ir.Behavior;
import info.isaksson.erland.androidtoflutter.ir.BindingTable;
import info.isaksson.erland.androidtoflutter.ir.ClickBinding;
import info.isaksson.erland.androidtoflutter.ir.ConversionWarnings;
import info.isaksson.erland.androidtoflutter.ir.DartNames;
import info.isaksson.erland.androidtoflutter.ir.DialogSpec;
import info.isaksson.erland.androidtoflutter.ir.NavigationAction;
import info.isaksson.erland.androidtoflutter.ir.TranslatedHandler;
import info.isaksson.erland.androidtoflutter.ir.TransientMessage;
import info.isaksson.erland.androidtoflutter.ir.code.JBlock;
import info.isaksson.erland.androidtoflutter.ir.code.JStatement;
import info.isaksson.erland.androidtoflutter.ir.dart.DartBlock;
import info.isaksson.erland.androidtoflutter.translate.DialogChain;
import info.isaksson.erland.androidtoflutter.translate.StatementTranslator;
import info.isaksson.erland.androidtoflutter.translate.TranslationScope;
import info.isaksson.erland.androidtoflutter.translate.TypeMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Finds the UI behaviors of one screen class: click listeners, screen launches, toasts and
 * snackbars, and alert dialogs. Behaviors inside a click handler are keyed by the view id;
 * the others by the enclosing method name.
 *
 * <p>Each handler body, and every same-class method it calls, is translated into a
 * {@link TranslatedHandler}.</p>
 */
public final class BehaviorExtractor {

    private static final Logger log = LoggerFactory.getLogger(BehaviorExtractor.class);

    private final Map<String, String> xmlClickHandlers;
    private final Set<String> knownViewIds;
    private final Function<String, Optional<String>> strings;

    /**
     * @param xmlClickHandlers view id → method named by the layout's {@code android:onClick}
     * @param knownViewIds     view ids of the paired layout
     * @param strings          string resource lookup
     */
    public BehaviorExtractor(Map<String, String> xmlClickHandlers,
                             Set<String> knownViewIds,
                             Function<String, Optional<String>> strings) {
        this.xmlClickHandlers = xmlClickHandlers == null ? Map.of() : new LinkedHashMap<>(xmlClickHandlers);
        this.knownViewIds = knownViewIds == null ? Set.of() : new LinkedHashSet<>(knownViewIds);
        this.strings = strings == null ? name -> Optional.empty() : strings;
    }

    public BehaviorExtractor() {
        this(null, null, null);
    }

    public BehaviorExtraction extract(ClassSource cls, ConversionWarnings warnings) {
        return new Run(cls, warnings == null ? new ConversionWarnings() : warnings).extract();
    }

    /** A listener body awaiting translation. {@code keyNode} is the AST subtree its behaviors live in. */
    private record HandlerSource(String name, String viewId, JBlock body, Node keyNode,
                                 Map<String, String> aliases, String site) {
    }

    private record Positioned<T>(int line, int column, String key, T value) {
    }

    private final class Run {
        private final ClassSource cls;
        private final ClassOrInterfaceDeclaration decl;
        private final ConversionWarnings warnings;
        private final TranslationScope scope;
        private final BindingTable.Builder bindings = BindingTable.builder();
        private final Map<String, HandlerSource> handlerSources = new LinkedHashMap<>();

        Run(ClassSource cls, ConversionWarnings warnings) {
            this.cls = cls;
            this.decl = cls.declaration;
            this.warnings = warnings;
            this.scope = buildScope();
        }

        BehaviorExtraction extract() {
            collectListeners();
            collectXmlHandlers();

            List<Positioned<NavigationAction>> navigations = new ArrayList<>();
            List<Positioned<TransientMessage>> messages = new ArrayList<>();
            List<Positioned<DialogSpec>> dialogs = new ArrayList<>();

            for (MethodCallExpr call : ownNodes(MethodCallExpr.class)) {
                NavigationAction nav = navigation(call);
                if (nav != null) navigations.add(positioned(call, nav));
                TransientMessage msg = message(call);
                if (msg != null) messages.add(positioned(call, msg));
            }
            for (ObjectCreationExpr creation : ownNodes(ObjectCreationExpr.class)) {
                DialogSpec dialog = dialog(creation);
                if (dialog != null) dialogs.add(positioned(creation, dialog));
            }

            List<Positioned<? extends Behavior>> all = new ArrayList<>();
            all.addAll(navigations);
            all.addAll(messages);
            all.addAll(dialogs);
            all.sort(Comparator.comparingInt((Positioned<?> p) -> p.line).thenComparingInt(p -> p.column));
            for (Positioned<? extends Behavior> p : all) {
                bindings.bind(p.key, p.value);
            }

            List<TranslatedHandler> handlers = translateHandlers();
            log.debug("{}: {} handler(s), {} navigation(s), {} dialog(s), {} message(s)",
                    cls.simpleName, handlers.size(), navigations.size(), dialogs.size(), messages.size());
            return new BehaviorExtraction(bindings.build(), values(navigations), values(dialogs), values(messages), handlers);
        }

        // ----- scope -----

        private TranslationScope buildScope() {
            TranslationScope.Builder b = TranslationScope.builder().knownViewIds(knownViewIds).strings(strings);
            for (VariableDeclarator v : ownNodes(VariableDeclarator.class)) {
                String type = v.getType().asString();
                if (type.endsWith("Binding") && !type.equals("Binding")) b.bindingVariable(v.getNameAsString());
                v.getInitializer().ifPresent(init -> b.viewVariable(v.getNameAsString(), viewLookupId(init)));
            }
            for (AssignExpr a : ownNodes(AssignExpr.class)) {
                String name = assignedName(a.getTarget());
                if (name != null) b.viewVariable(name, viewLookupId(a.getValue()));
            }
            for (MethodDeclaration m : decl.getMethods()) b.classMethod(m.getNameAsString());
            return b.build();
        }

        private String viewLookupId(Expression e) {
            Expression x = strip(e);
            if (!(x instanceof MethodCallExpr call)) return null;
            String n = call.getNameAsString();
            if (!n.equals("findViewById") && !n.equals("requireViewById")) return null;
            return call.getArguments().isEmpty() ? null : ClassSourceIndex.resourceName(call.getArgument(0), "id");
        }

        // ----- listeners -----

        private void collectListeners() {
            for (MethodCallExpr call : ownNodes(MethodCallExpr.class)) {
                if (!call.getNameAsString().equals("setOnClickListener") || call.getArguments().size() != 1) continue;
                String site = site(call);
                String viewId = call.getScope()
                        .map(s -> scope.viewIdOf(StatementParser.expression(s), Map.of()))
                        .orElse(null);
                if (viewId == null) {
                    warnings.warn(ConversionWarnings.UNRESOLVED_HANDLER,
                            "Cannot resolve the view of " + StatementParser.rawText(call), "site", site);
                    continue;
                }
                if (!registerListener(viewId, call.getArgument(0), site, new HashSet<>())) {
                    warnings.warn(ConversionWarnings.UNRESOLVED_HANDLER,
                            "Unsupported click listener for " + viewId, "site", site);
                }
            }
        }

        /** Follows local aliases of the listener; {@code seen} holds the declarators already followed. */
        private boolean registerListener(String viewId, Expression listener, String site, Set<VariableDeclarator> seen) {
            Expression l = strip(listener);
            if (l instanceof LambdaExpr lambda) {
                register(viewId, DartNames.handlerName(viewId), StatementParser.lambdaBody(lambda), lambda,
                        firstParameter(lambda.getParameters(), viewId), site);
                return true;
            }
            if (l instanceof ObjectCreationExpr o && o.getAnonymousClassBody().isPresent()) {
                for (BodyDeclaration<?> member : o.getAnonymousClassBody().get()) {
                    if (member instanceof MethodDeclaration m && m.getNameAsString().equals("onClick") && m.getBody().isPresent()) {
                        register(viewId, DartNames.handlerName(viewId), StatementParser.methodBody(m), m,
                                firstParameter(m.getParameters(), viewId), site);
                        return true;
                    }
                }
                return false;
            }
            if (l instanceof MethodReferenceExpr ref && ref.getScope() instanceof ThisExpr) {
                return registerMethod(viewId, ref.getIdentifier(), site);
            }
            if (l instanceof ThisExpr) {
                return registerThis(viewId, site);
            }
            if (l instanceof NameExpr name) {
                for (VariableDeclarator v : ownNodes(VariableDeclarator.class)) {
                    if (v.getNameAsString().equals(name.getNameAsString()) && v.getInitializer().isPresent()) {
                        if (!seen.add(v)) {
                            log.debug("Listener alias cycle through {} for {}", name, viewId);
                            return false;
                        }
                        return registerListener(viewId, v.getInitializer().get(), site, seen);
                    }
                }
            }
            return false;
        }

        private boolean registerMethod(String viewId, String methodName, String site) {
            Optional<MethodDeclaration> m = method(methodName);
            if (m.isEmpty()) return false;
            register(viewId, DartNames.methodName(methodName), StatementParser.methodBody(m.get()), m.get(),
                    firstParameter(m.get().getParameters(), viewId), site);
            return true;
        }

        /** {@code setOnClickListener(this)}: the class's {@code onClick}, split per view id when it switches on it. */
        private boolean registerThis(String viewId, String site) {
            Optional<MethodDeclaration> onClick = method("onClick");
            if (onClick.isEmpty() || onClick.get().getBody().isEmpty()) return false;
            MethodDeclaration m = onClick.get();
            Map<String, String> aliases = firstParameter(m.getParameters(), viewId);
            Optional<Node> branch = branchFor(m.getBody().get(), viewId);
            if (branch.isPresent()) {
                register(viewId, DartNames.handlerName(viewId), branchBody(branch.get()), branch.get(), aliases, site);
            } else {
                register(viewId, DartNames.methodName("onClick"), StatementParser.methodBody(m), m, aliases, site);
            }
            return true;
        }

        private void collectXmlHandlers() {
            for (Map.Entry<String, String> e : xmlClickHandlers.entrySet()) {
                String site = cls.simpleName + "#" + e.getValue();
                if (!registerMethod(e.getKey(), e.getValue(), site)) {
                    warnings.warn(ConversionWarnings.UNRESOLVED_HANDLER,
                            "Method " + e.getValue() + " named by android:onClick is not declared in " + cls.simpleName,
                            "viewId", e.getKey());
                }
            }
        }

        private void register(String viewId, String name, JBlock body, Node keyNode, Map<String, String> aliases, String site) {
            bindings.bind(viewId, new ClickBinding(viewId, name));
            handlerSources.putIfAbsent(name, new HandlerSource(name, viewId, body, keyNode, aliases, site));
        }

        private Optional<Node> branchFor(BlockStmt body, String viewId) {
            for (SwitchStmt sw : body.findAll(SwitchStmt.class)) {
                if (!isGetIdCall(sw.getSelector())) continue;
                for (SwitchEntry entry : sw.getEntries()) {
                    for (Expression label : entry.getLabels()) {
                        if (viewId.equals(ClassSourceIndex.resourceName(label, "id"))) return Optional.of(entry);
                    }
                }
            }
            for (IfStmt stmt : body.findAll(IfStmt.class)) {
                if (stmt.getCondition() instanceof BinaryExpr b && b.getOperator() == BinaryExpr.Operator.EQUALS) {
                    String id = isGetIdCall(b.getLeft()) ? ClassSourceIndex.resourceName(b.getRight(), "id")
                            : isGetIdCall(b.getRight()) ? ClassSourceIndex.resourceName(b.getLeft(), "id")
                            : null;
                    if (viewId.equals(id)) return Optional.of(stmt.getThenStmt());
                }
            }
            return Optional.empty();
        }

        private JBlock branchBody(Node branch) {
            List<JStatement> out = new ArrayList<>();
            List<Statement> statements = branch instanceof SwitchEntry entry
                    ? entry.getStatements()
                    : branch instanceof BlockStmt block ? block.getStatements() : List.of((Statement) branch);
            for (Statement s : statements) {
                if (s instanceof BreakStmt b && b.getLabel().isEmpty()) continue;
                out.add(StatementParser.statement(s));
            }
            return new JBlock(out);
        }

        private boolean isGetIdCall(Expression e) {
            Expression x = strip(e);
            return x instanceof MethodCallExpr m && m.getNameAsString().equals("getId") && m.getArguments().isEmpty();
        }

        // ----- behaviors -----

        private NavigationAction navigation(MethodCallExpr call) {
            String name = call.getNameAsString();
            if (!name.equals("startActivity") && !name.equals("startActivityForResult")) return null;
            if (call.getArguments().isEmpty()) return null;
            Expression arg = strip(call.getArgument(0));
            String target = null;
            if (arg instanceof ObjectCreationExpr o) {
                target = intentTarget(o);
            } else if (arg instanceof NameExpr n) {
                target = intentVariableTarget(call, n.getNameAsString());
            }
            return target == null ? null : new NavigationAction(target, site(call));
        }

        private String intentVariableTarget(Node usage, String variable) {
            Node body = enclosingCallable(usage);
            if (body == null) return null;
            String target = null;
            for (VariableDeclarator v : body.findAll(VariableDeclarator.class)) {
                if (v.getNameAsString().equals(variable) && v.getInitializer().isPresent()
                        && strip(v.getInitializer().get()) instanceof ObjectCreationExpr o) {
                    target = intentTarget(o);
                }
            }
            for (AssignExpr a : body.findAll(AssignExpr.class)) {
                if (variable.equals(assignedName(a.getTarget())) && strip(a.getValue()) instanceof ObjectCreationExpr o) {
                    String t = intentTarget(o);
                    if (t != null) target = t;
                }
            }
            return target;
        }

        private String intentTarget(ObjectCreationExpr o) {
            if (!o.getType().getNameAsString().equals("Intent")) return null;
            for (Expression a : o.getArguments()) {
                if (a instanceof ClassExpr c) return ClassSourceIndex.simpleName(c.getType().asString());
            }
            return null;
        }

        private TransientMessage message(MethodCallExpr call) {
            Optional<Expression> owner = call.getScope();
            if (owner.isEmpty() || !(owner.get() instanceof NameExpr n) || call.getArguments().size() < 2) return null;
            boolean toast = n.getNameAsString().equals("Toast") && call.getNameAsString().equals("makeText");
            boolean snack = n.getNameAsString().equals("Snackbar") && call.getNameAsString().equals("make");
            if (!toast && !snack) return null;
            String text = DialogChain.describe(StatementParser.expression(call.getArgument(1)), scope);
            boolean longDuration = call.getArguments().size() > 2
                    && (call.getArgument(2).toString().contains("LONG") || call.getArgument(2).toString().contains("INDEFINITE"));
            return new TransientMessage(text, longDuration, site(call));
        }

        private DialogSpec dialog(ObjectCreationExpr creation) {
            if (!DialogChain.isBuilderCreation(StatementParser.expression(creation))) return null;
            Expression outer = creation;
            while (outer.getParentNode().orElse(null) instanceof MethodCallExpr parent
                    && parent.getScope().orElse(null) == outer) {
                outer = parent;
            }
            DialogChain chain = new DialogChain().absorb(StatementParser.expression(outer));
            // Builder held in a variable: fold in every call made on it in the same body.
            if (outer.getParentNode().orElse(null) instanceof VariableDeclarator v) {
                Node body = enclosingCallable(v);
                if (body != null) {
                    for (MethodCallExpr call : body.findAll(MethodCallExpr.class)) {
                        if (call.getParentNode().orElse(null) instanceof MethodCallExpr p && p.getScope().orElse(null) == call) continue;
                        if (rootName(call).map(r -> r.equals(v.getNameAsString())).orElse(false)) {
                            chain.absorb(StatementParser.expression(call));
                        }
                    }
                }
            }
            if (chain.isEmpty()) return null;
            return new DialogSpec(chain.text("setTitle", scope), chain.text("setMessage", scope),
                    chain.text("setPositiveButton", scope), chain.text("setNegativeButton", scope));
        }

        // ----- translation -----

        private List<TranslatedHandler> translateHandlers() {
            List<TranslatedHandler> out = new ArrayList<>();
            Set<String> produced = new LinkedHashSet<>();
            Deque<String> helpers = new ArrayDeque<>();
            for (HandlerSource h : handlerSources.values()) {
                StatementTranslator t = new StatementTranslator(scope, warnings, h.site, h.aliases);
                DartBlock body = t.translateBlock(h.body);
                out.add(new TranslatedHandler(h.name, h.viewId, List.of(), body, t.stateBindings(),
                        t.untranslatedCount(), h.site));
                produced.add(h.name);
                helpers.addAll(t.calledMethods());
            }
            while (!helpers.isEmpty()) {
                String javaName = helpers.poll();
                String name = DartNames.methodName(javaName);
                if (!produced.add(name)) continue;
                Optional<MethodDeclaration> m = method(javaName);
                if (m.isEmpty()) continue;
                String site = cls.simpleName + "#" + javaName;
                StatementTranslator t = new StatementTranslator(scope, warnings, site);
                DartBlock body = t.translateBlock(StatementParser.methodBody(m.get()));
                List<String> params = new ArrayList<>();
                for (Parameter p : m.get().getParameters()) {
                    params.add(TypeMapper.parameterType(p.getType().asString()) + " " + p.getNameAsString());
                }
                out.add(new TranslatedHandler(name, null, params, body, t.stateBindings(), t.untranslatedCount(), site));
                helpers.addAll(t.calledMethods());
            }
            return out;
        }

        // ----- helpers -----

        private String keyFor(Node node) {
            for (HandlerSource h : handlerSources.values()) {
                if (h.keyNode == node || h.keyNode.isAncestorOf(node)) return h.viewId;
            }
            return enclosingMethodName(node);
        }

        private String site(Node node) {
            int line = node.getBegin().map(p -> p.line).orElse(0);
            return cls.simpleName + "#" + enclosingMethodName(node) + ":" + line;
        }

        private String enclosingMethodName(Node node) {
            Optional<MethodDeclaration> m = node.findAncestor(MethodDeclaration.class);
            while (m.isPresent() && ClassSourceIndex.enclosingClass(m.get()) != decl) {
                m = m.get().findAncestor(MethodDeclaration.class);
            }
            return m.map(MethodDeclaration::getNameAsString).orElse("<init>");
        }

        private Node enclosingCallable(Node node) {
            Optional<MethodDeclaration> m = node.findAncestor(MethodDeclaration.class);
            if (m.isPresent()) return m.get();
            return node.findAncestor(BodyDeclaration.class).map(b -> (Node) b).orElse(null);
        }

        private Optional<MethodDeclaration> method(String name) {
            return decl.getMethodsByName(name).stream().findFirst();
        }

        private <T extends Node> List<T> ownNodes(Class<T> type) {
            List<T> out = new ArrayList<>();
            for (T n : decl.findAll(type)) {
                if (ClassSourceIndex.enclosingClass(n) == decl) out.add(n);
            }
            return out;
        }

        private <T> Positioned<T> positioned(Node node, T value) {
            return new Positioned<>(node.getBegin().map(p -> p.line).orElse(0),
                    node.getBegin().map(p -> p.column).orElse(0), keyFor(node), value);
        }
    }

    private static Map<String, String> firstParameter(List<Parameter> parameters, String viewId) {
        if (parameters.isEmpty()) return Map.of();
        Map<String, String> aliases = new HashMap<>();
        aliases.put(parameters.get(0).getNameAsString(), viewId);
        return aliases;
    }

    private static String assignedName(Expression target) {
        if (target instanceof NameExpr n) return n.getNameAsString();
        if (target instanceof FieldAccessExpr f && f.getScope() instanceof ThisExpr) return f.getNameAsString();
        return null;
    }

    private static Optional<String> rootName(MethodCallExpr call) {
        Expression x = call;
        while (x instanceof MethodCallExpr m && m.getScope().isPresent()) x = m.getScope().get();
        return x instanceof NameExpr n ? Optional.of(n.getNameAsString()) : Optional.empty();
    }

    private static Expression strip(Expression e) {
        Expression x = e;
        while (x instanceof CastExpr || x instanceof EnclosedExpr) {
            x = x instanceof CastExpr c ? c.getExpression() : ((EnclosedExpr) x).getInner();
        }
        return x;
    }

    private static <T> List<T> values(List<Positioned<T>> list) {
        List<T> out = new ArrayList<>();
        for (Positioned<T> p : list) out.add(p.value);
        return out;
    }
}
