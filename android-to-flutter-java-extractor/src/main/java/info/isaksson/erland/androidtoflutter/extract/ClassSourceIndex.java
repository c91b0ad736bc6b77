package info.isaksson.erland.androidtoflutter.extract;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.type.ClassOrInterfaceType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Name → class facts lookup built once from parsed sources. Read-only after {@link #build},
 * so one instance can be shared by concurrent screen translations.
 */
public final class ClassSourceIndex {

    public static final ClassSourceIndex EMPTY = new ClassSourceIndex(List.of());

    private final Map<String, ClassSource> byQualifiedName = new TreeMap<>();
    private final Map<String, ClassSource> bySimpleName = new TreeMap<>();

    private ClassSourceIndex(List<ClassSource> classes) {
        for (ClassSource c : classes) {
            byQualifiedName.putIfAbsent(c.qualifiedName, c);
        }
        // Simple names resolve to the first class in qualified-name order.
        for (ClassSource c : byQualifiedName.values()) {
            bySimpleName.putIfAbsent(c.simpleName, c);
        }
    }

    public static ClassSourceIndex build(List<ParsedUnit> units) {
        List<ClassSource> out = new ArrayList<>();
        for (ParsedUnit u : units) {
            collect(u, out);
        }
        return new ClassSourceIndex(out);
    }

    /** Look up by qualified name first, then by simple name. */
    public Optional<ClassSource> find(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        ClassSource c = byQualifiedName.get(name);
        if (c == null) c = bySimpleName.get(simpleName(name));
        return Optional.ofNullable(c);
    }

    public boolean contains(String name) {
        return find(name).isPresent();
    }

    /** All classes ordered by qualified name. */
    public List<ClassSource> classes() {
        return Collections.unmodifiableList(new ArrayList<>(byQualifiedName.values()));
    }

    public int size() {
        return byQualifiedName.size();
    }

    /**
     * The class's simple name followed by its ancestors' simple names. The walk stops after the
     * first ancestor not declared in source, at a class without superclass, or on a cycle.
     */
    public List<String> superclassChain(String name) {
        Set<String> chain = new LinkedHashSet<>();
        String current = simpleName(name);
        while (current != null && chain.add(current)) {
            Optional<ClassSource> c = find(current);
            if (c.isEmpty()) break;
            current = c.get().superclass;
        }
        return List.copyOf(chain);
    }

    /** Classes whose chain reaches a known screen base class, e.g. {@code AppCompatActivity}. */
    public List<ClassSource> screenClasses() {
        List<ClassSource> out = new ArrayList<>();
        for (ClassSource c : byQualifiedName.values()) {
            List<String> chain = superclassChain(c.simpleName);
            String terminal = chain.get(chain.size() - 1);
            if (contains(terminal)) continue;
            if (terminal.endsWith("Activity") || terminal.endsWith("Fragment")) out.add(c);
        }
        out.sort(Comparator.comparing(c -> c.qualifiedName));
        return out;
    }

    static String simpleName(String name) {
        if (name == null) return null;
        String n = name;
        int lt = n.indexOf('<');
        if (lt >= 0) n = n.substring(0, lt);
        int dot = n.lastIndexOf('.');
        return dot >= 0 ? n.substring(dot + 1) : n;
    }

    private static void collect(ParsedUnit unit, List<ClassSource> out) {
        CompilationUnit cu = unit.cu();
        String pkg = cu.getPackageDeclaration().map(p -> p.getNameAsString()).orElse("");
        for (ClassOrInterfaceDeclaration decl : cu.findAll(ClassOrInterfaceDeclaration.class)) {
            if (decl.isInterface()) continue;
            String qn = decl.getFullyQualifiedName().orElseGet(
                    () -> pkg.isEmpty() ? decl.getNameAsString() : pkg + "." + decl.getNameAsString());
            String superclass = decl.getExtendedTypes().isEmpty()
                    ? null
                    : typeName(decl.getExtendedTypes().get(0));
            out.add(new ClassSource(
                    decl.getNameAsString(),
                    qn,
                    superclass,
                    unit.name(),
                    overridesOnDraw(decl),
                    inflatedLayout(decl),
                    contentLayout(decl),
                    decl));
        }
    }

    private static String typeName(ClassOrInterfaceType t) {
        return t.getNameAsString();
    }

    private static boolean overridesOnDraw(ClassOrInterfaceDeclaration decl) {
        for (MethodDeclaration m : decl.getMethodsByName("onDraw")) {
            if (m.getParameters().size() == 1) return true;
        }
        return false;
    }

    private static String inflatedLayout(ClassOrInterfaceDeclaration decl) {
        for (MethodCallExpr call : ownCalls(decl)) {
            if (!call.getNameAsString().equals("inflate")) continue;
            String layout = firstLayoutArgument(call);
            if (layout == null) layout = bindingLayout(call);
            if (layout != null) return layout;
        }
        return null;
    }

    private static String contentLayout(ClassOrInterfaceDeclaration decl) {
        String viaBinding = null;
        boolean setsContent = false;
        for (MethodCallExpr call : ownCalls(decl)) {
            String name = call.getNameAsString();
            if (name.equals("setContentView")) {
                String layout = firstLayoutArgument(call);
                if (layout != null) return layout;
                setsContent = true;
            } else if (name.equals("inflate") && viaBinding == null) {
                viaBinding = bindingLayout(call);
            }
        }
        // setContentView(binding.getRoot())
        return setsContent ? viaBinding : null;
    }

    /** {@code R.layout.x} among the call's arguments. */
    static String firstLayoutArgument(MethodCallExpr call) {
        for (Expression arg : call.getArguments()) {
            String layout = resourceName(arg, "layout");
            if (layout != null) return layout;
        }
        return null;
    }

    /** {@code ActivityLoginBinding.inflate(...)} → {@code activity_login}. */
    static String bindingLayout(MethodCallExpr call) {
        Optional<Expression> scope = call.getScope();
        if (scope.isEmpty() || !scope.get().isNameExpr()) return null;
        String type = scope.get().asNameExpr().getNameAsString();
        if (!type.endsWith("Binding") || type.length() == "Binding".length()) return null;
        if (!Character.isUpperCase(type.charAt(0))) return null;
        return snakeCase(type.substring(0, type.length() - "Binding".length()));
    }

    /** {@code R.<type>.<name>} → name. */
    static String resourceName(Expression e, String type) {
        if (!(e instanceof FieldAccessExpr fa)) return null;
        if (!(fa.getScope() instanceof FieldAccessExpr typeAccess)) return null;
        if (!typeAccess.getNameAsString().equals(type)) return null;
        Expression r = typeAccess.getScope();
        boolean isR = (r instanceof NameExpr n && n.getNameAsString().equals("R"))
                || (r instanceof FieldAccessExpr rf && rf.getNameAsString().equals("R"));
        return isR ? fa.getNameAsString() : null;
    }

    static String snakeCase(String pascal) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < pascal.length(); i++) {
            char c = pascal.charAt(i);
            if (Character.isUpperCase(c)) {
                if (i > 0) sb.append('_');
                sb.append(Character.toLowerCase(c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /** Calls inside {@code decl} that do not belong to a nested class declaration. */
    private static List<MethodCallExpr> ownCalls(ClassOrInterfaceDeclaration decl) {
        List<MethodCallExpr> out = new ArrayList<>();
        for (MethodCallExpr call : decl.findAll(MethodCallExpr.class)) {
            if (enclosingClass(call) == decl) out.add(call);
        }
        return out;
    }

    static ClassOrInterfaceDeclaration enclosingClass(Node node) {
        Optional<Node> p = node.getParentNode();
        while (p.isPresent()) {
            if (p.get() instanceof ClassOrInterfaceDeclaration c) return c;
            p = p.get().getParentNode();
        }
        return null;
    }
}
