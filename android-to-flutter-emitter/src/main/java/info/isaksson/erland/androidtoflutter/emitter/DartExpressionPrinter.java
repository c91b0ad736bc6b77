package info.isaksson.erland.androidtoflutter.emitter;

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
import java.util.List;
import java.util.Map;

/**
 * Formats Dart statement and expression trees as source text, two spaces per indent level.
 *
 * <p>Calls and list literals stay on one line while they fit in {@link #LINE_WIDTH} columns;
 * otherwise each argument goes on its own line with a trailing comma. Untranslated nodes become
 * {@code // untranslated:} comment lines carrying the original text; an untranslated
 * sub-expression is printed as {@code null} below its comment.</p>
 */
public final class DartExpressionPrinter {

    public static final int LINE_WIDTH = 80;
    public static final String UNTRANSLATED_PREFIX = "// untranslated: ";

    private DartExpressionPrinter() {}

    public static String indent(int level) {
        return "  ".repeat(Math.max(0, level));
    }

    // ----- statements -----

    /** Lines of {@code statement}, each already indented to {@code level}. */
    public static List<String> statement(DartStatement statement, int level) {
        List<String> out = new ArrayList<>();
        appendStatement(statement, level, out);
        return out;
    }

    /** Statements of a block without the surrounding braces. */
    public static List<String> blockBody(DartBlock block, int level) {
        List<String> out = new ArrayList<>();
        for (DartStatement s : block.statements()) appendStatement(s, level, out);
        return out;
    }

    /** Comment lines for an untranslated construct, one prefix per source line. */
    public static List<String> untranslatedComment(String rawText, int level) {
        List<String> out = new ArrayList<>();
        for (String line : rawText.strip().split("\\R")) {
            out.add(indent(level) + UNTRANSLATED_PREFIX + line.stripTrailing());
        }
        return out;
    }

    private static void appendStatement(DartStatement s, int level, List<String> out) {
        String pad = indent(level);
        if (s instanceof DartUntranslated u) {
            out.addAll(untranslatedComment(u.rawText(), level));
            return;
        }
        if (s instanceof DartBlock b) {
            out.add(pad + "{");
            for (DartStatement c : b.statements()) appendStatement(c, level + 1, out);
            out.add(pad + "}");
            return;
        }
        if (s instanceof DartIf i) {
            commentsFor(i.condition(), level, out);
            out.add(pad + "if (" + expression(i.condition(), level) + ") {");
            appendBranch(i.thenBranch(), level + 1, out);
            DartStatement otherwise = i.elseBranch();
            while (otherwise instanceof DartIf elseIf) {
                commentsFor(elseIf.condition(), level, out);
                out.add(pad + "} else if (" + expression(elseIf.condition(), level) + ") {");
                appendBranch(elseIf.thenBranch(), level + 1, out);
                otherwise = elseIf.elseBranch();
            }
            if (otherwise != null) {
                out.add(pad + "} else {");
                appendBranch(otherwise, level + 1, out);
            }
            out.add(pad + "}");
            return;
        }
        if (s instanceof DartLoop l) {
            appendLoop(l, level, out);
            return;
        }
        if (s instanceof DartJump j) {
            out.add(pad + (j.kind() == DartJump.Kind.BREAK ? "break;" : "continue;"));
            return;
        }
        if (s instanceof DartReturn r) {
            if (r.value() == null) {
                out.add(pad + "return;");
            } else {
                commentsFor(r.value(), level, out);
                out.add(pad + "return " + expression(r.value(), level) + ";");
            }
            return;
        }
        if (s instanceof DartAssign a) {
            commentsFor(a, level, out);
            out.add(pad + assignment(a, level) + ";");
            return;
        }
        if (s instanceof DartExpressionStmt e) {
            commentsFor(e.expression(), level, out);
            out.add(pad + expression(e.expression(), level) + ";");
        }
    }

    private static void appendBranch(DartStatement branch, int level, List<String> out) {
        if (branch instanceof DartBlock b) {
            for (DartStatement c : b.statements()) appendStatement(c, level, out);
        } else {
            appendStatement(branch, level, out);
        }
    }

    private static void appendLoop(DartLoop l, int level, List<String> out) {
        String pad = indent(level);
        switch (l.kind()) {
            case WHILE -> {
                out.add(pad + "while (" + expression(l.condition(), level) + ") {");
                appendBranch(l.body(), level + 1, out);
                out.add(pad + "}");
            }
            case DO_WHILE -> {
                out.add(pad + "do {");
                appendBranch(l.body(), level + 1, out);
                out.add(pad + "} while (" + expression(l.condition(), level) + ");");
            }
            case FOR -> {
                List<String> init = new ArrayList<>();
                for (DartStatement st : l.init()) {
                    init.add(st instanceof DartAssign a ? assignment(a, level) : String.join(" ", statement(st, 0)));
                }
                List<String> update = new ArrayList<>();
                for (DartExpression u : l.update()) update.add(expression(u, level));
                String condition = l.condition() == null ? "" : expression(l.condition(), level);
                out.add(pad + "for (" + String.join(", ", init) + "; " + condition + "; " + String.join(", ", update) + ") {");
                appendBranch(l.body(), level + 1, out);
                out.add(pad + "}");
            }
            case FOR_IN -> {
                out.add(pad + "for (final " + l.variable() + " in " + expression(l.condition(), level) + ") {");
                appendBranch(l.body(), level + 1, out);
                out.add(pad + "}");
            }
        }
    }

    private static String assignment(DartAssign a, int level) {
        StringBuilder sb = new StringBuilder();
        if (a.declaredType() != null) sb.append(a.declaredType()).append(' ');
        sb.append(expression(a.target(), level));
        if (a.value() != null) {
            sb.append(' ').append(a.operator()).append(' ').append(expression(a.value(), level));
        }
        return sb.toString();
    }

    /** Comment lines for untranslated sub-expressions that print inline as {@code null}. */
    private static void commentsFor(DartNode node, int level, List<String> out) {
        List<DartUntranslated> found = new ArrayList<>();
        collectInline(node, found);
        for (DartUntranslated u : found) out.addAll(untranslatedComment(u.rawText(), level));
    }

    private static void collectInline(DartNode node, List<DartUntranslated> found) {
        if (node == null) return;
        if (node instanceof DartUntranslated u) {
            found.add(u);
            return;
        }
        // Block bodies print their own comments.
        if (node instanceof DartLambda l && l.body() instanceof DartBlock) return;
        if (node instanceof DartAssign a) {
            collectInline(a.target(), found);
            collectInline(a.value(), found);
            return;
        }
        if (node instanceof DartCall c) {
            collectInline(c.target(), found);
            for (DartExpression e : c.arguments()) collectInline(e, found);
            for (DartExpression e : c.namedArguments().values()) collectInline(e, found);
        } else if (node instanceof DartFieldAccess f) {
            collectInline(f.target(), found);
        } else if (node instanceof DartBinary b) {
            collectInline(b.left(), found);
            collectInline(b.right(), found);
        } else if (node instanceof DartUnary u) {
            collectInline(u.operand(), found);
        } else if (node instanceof DartTernary t) {
            collectInline(t.condition(), found);
            collectInline(t.whenTrue(), found);
            collectInline(t.whenFalse(), found);
        } else if (node instanceof DartLambda l) {
            collectInline(l.body(), found);
        } else if (node instanceof DartListLiteral l) {
            for (DartExpression e : l.elements()) collectInline(e, found);
        }
    }

    // ----- expressions -----

    /**
     * Source of {@code e} as it appears starting on a line indented to {@code level}. Multi-line
     * results indent their inner lines relative to that level and end at that level.
     */
    public static String expression(DartExpression e, int level) {
        if (e == null) return "null";
        if (e instanceof DartUntranslated) return "null";
        if (e instanceof DartLiteral l) return literal(l);
        if (e instanceof DartName n) return n.name();
        if (e instanceof DartFieldAccess f) return operand(f.target(), level) + "." + f.name();
        if (e instanceof DartBinary b) {
            return binaryOperand(b.left(), level) + " " + b.operator() + " " + binaryOperand(b.right(), level);
        }
        if (e instanceof DartUnary u) {
            String operand = operand(u.operand(), level);
            return u.prefix() ? u.operator() + operand : operand + u.operator();
        }
        if (e instanceof DartTernary t) {
            return binaryOperand(t.condition(), level) + " ? " + binaryOperand(t.whenTrue(), level)
                    + " : " + binaryOperand(t.whenFalse(), level);
        }
        if (e instanceof DartLambda l) return lambda(l, level);
        if (e instanceof DartListLiteral l) return list(l, level);
        if (e instanceof DartCall c) return call(c, level);
        throw new IllegalStateException("Unhandled expression " + e.getClass().getSimpleName());
    }

    private static String lambda(DartLambda l, int level) {
        String params = "(" + String.join(", ", l.parameters()) + ")";
        if (l.body() instanceof DartBlock b) {
            if (b.statements().isEmpty()) return params + " {}";
            StringBuilder sb = new StringBuilder(params).append(" {\n");
            for (String line : blockBody(b, level + 1)) sb.append(line).append('\n');
            return sb.append(indent(level)).append('}').toString();
        }
        if (l.body() instanceof DartExpression body) return params + " => " + expression(body, level);
        // A statement body other than a block.
        StringBuilder sb = new StringBuilder(params).append(" {\n");
        for (String line : statement((DartStatement) l.body(), level + 1)) sb.append(line).append('\n');
        return sb.append(indent(level)).append('}').toString();
    }

    private static String list(DartListLiteral l, int level) {
        if (l.elements().isEmpty()) return "[]";
        List<String> inline = new ArrayList<>();
        for (DartExpression e : l.elements()) inline.add(expression(e, level + 1));
        String flat = "[" + String.join(", ", inline) + "]";
        if (fits(flat, level)) return flat;
        StringBuilder sb = new StringBuilder("[\n");
        for (String item : inline) sb.append(indent(level + 1)).append(item).append(",\n");
        return sb.append(indent(level)).append(']').toString();
    }

    private static String call(DartCall c, int level) {
        StringBuilder head = new StringBuilder();
        if (c.constant()) head.append("const ");
        if (c.target() != null) head.append(operand(c.target(), level)).append('.');
        head.append(c.name());

        // setState(() { ... }) keeps the closure on the call line.
        if (c.namedArguments().isEmpty() && c.arguments().size() == 1
                && c.arguments().get(0) instanceof DartLambda l && l.body() instanceof DartBlock) {
            return head + "(" + expression(l, level) + ")";
        }

        List<String> args = new ArrayList<>();
        for (DartExpression a : c.arguments()) args.add(expression(a, level + 1));
        for (Map.Entry<String, DartExpression> e : c.namedArguments().entrySet()) {
            args.add(e.getKey() + ": " + expression(e.getValue(), level + 1));
        }
        if (args.isEmpty()) return head + "()";
        String flat = head + "(" + String.join(", ", args) + ")";
        if (fits(flat, level)) return flat;
        StringBuilder sb = new StringBuilder(head).append("(\n");
        for (String a : args) sb.append(indent(level + 1)).append(a).append(",\n");
        return sb.append(indent(level)).append(')').toString();
    }

    private static boolean fits(String flat, int level) {
        return flat.indexOf('\n') < 0 && indent(level).length() + flat.length() <= LINE_WIDTH;
    }

    /** Receiver of a call or field access; operators need parentheses there. */
    private static String operand(DartExpression e, int level) {
        String s = expression(e, level);
        return needsParentheses(e) ? "(" + s + ")" : s;
    }

    private static String binaryOperand(DartExpression e, int level) {
        String s = expression(e, level);
        return e instanceof DartBinary || e instanceof DartTernary ? "(" + s + ")" : s;
    }

    private static boolean needsParentheses(DartExpression e) {
        return e instanceof DartBinary || e instanceof DartTernary || e instanceof DartUnary || e instanceof DartLambda;
    }

    static String literal(DartLiteral l) {
        return switch (l.kind()) {
            case STRING -> quote(l.value());
            case NUMBER, BOOLEAN -> l.value();
            case NULL -> "null";
        };
    }

    /** Single-quoted Dart string literal. */
    public static String quote(String value) {
        StringBuilder sb = new StringBuilder("'");
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\'' -> sb.append("\\'");
                case '$' -> sb.append("\\$");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.append('\'').toString();
    }
}
