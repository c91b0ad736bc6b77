package info.isaksson.erland.androidtoflutter.translate;

import info.isaksson.erland.androidtoflutter.ir.code.JCall;
import info.isaksson.erland.androidtoflutter.ir.code.JExpression;
import info.isaksson.erland.androidtoflutter.ir.code.JFieldAccess;
import info.isaksson.erland.androidtoflutter.ir.code.JLiteral;
import info.isaksson.erland.androidtoflutter.ir.code.JName;
import info.isaksson.erland.androidtoflutter.ir.code.JNew;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Setter calls collected from an alert dialog builder, either one fluent chain or several
 * statements on a builder variable. Later setters replace earlier ones.
 */
public final class DialogChain {

    private final Map<String, JCall> setters = new LinkedHashMap<>();
    private boolean shown;

    /** Chain rooted at {@code new AlertDialog.Builder(...)}; empty for any other expression. */
    public static Optional<DialogChain> of(JExpression outer) {
        if (!isBuilderCreation(root(outer))) return Optional.empty();
        DialogChain chain = new DialogChain();
        chain.absorb(outer);
        return Optional.of(chain);
    }

    public static boolean isBuilderCreation(JExpression e) {
        if (!(e instanceof JNew n)) return false;
        String simple = n.simpleType();
        return simple.equals("MaterialAlertDialogBuilder")
                || (simple.equals("Builder") && n.type().contains("AlertDialog"));
    }

    /** Innermost receiver of a call chain. */
    public static JExpression root(JExpression e) {
        JExpression x = e;
        while (x instanceof JCall c && c.scope() != null) x = c.scope();
        return x;
    }

    /** Record every call of the chain {@code outer}, innermost first. */
    public DialogChain absorb(JExpression outer) {
        Deque<JCall> calls = new ArrayDeque<>();
        JExpression x = outer;
        while (x instanceof JCall c) {
            calls.push(c);
            x = c.scope();
        }
        for (JCall c : calls) {
            if (c.name().equals("show")) {
                shown = true;
            } else if (c.name().startsWith("set")) {
                setters.put(c.name(), c);
            }
        }
        return this;
    }

    public boolean shown() {
        return shown;
    }

    public boolean isEmpty() {
        return setters.isEmpty();
    }

    /** Argument {@code index} of the last call to {@code setter}, or null. */
    public JExpression argument(String setter, int index) {
        JCall c = setters.get(setter);
        return c == null ? null : c.argument(index);
    }

    /**
     * Display text of a setter's first argument: literal content, resolved string resource,
     * or the source expression. Null when the setter was not called.
     */
    public String text(String setter, TranslationScope scope) {
        return describe(argument(setter, 0), scope);
    }

    public static String describe(JExpression e, TranslationScope scope) {
        if (e == null) return null;
        if (e instanceof JLiteral l) return l.kind() == JLiteral.Kind.NULL ? null : l.value();
        String res = TranslationScope.resourceName(e, "string");
        if (res != null) return scope.string(res);
        if (e instanceof JCall c) {
            if (c.name().equals("getString") && c.scope() == null) {
                String inner = TranslationScope.resourceName(c.argument(0), "string");
                if (inner != null) return scope.string(inner);
            }
            return c.source();
        }
        if (e instanceof JName n) return n.name();
        if (e instanceof JFieldAccess f && f.qualifiedName() != null) return f.qualifiedName();
        return e.toString();
    }
}
