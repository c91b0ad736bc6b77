package info.isaksson.erland.androidtoflutter.ir.dart;

import java.util.ArrayList;
import java.util.List;

/** Traversal helpers over {@link DartNode} trees. */
public final class DartTrees {

    private DartTrees() {}

    /** Direct children in source order. */
    public static List<DartNode> children(DartNode node) {
        List<DartNode> out = new ArrayList<>();
        if (node instanceof DartBlock b) {
            out.addAll(b.statements());
        } else if (node instanceof DartAssign a) {
            out.add(a.target());
            if (a.value() != null) out.add(a.value());
        } else if (node instanceof DartIf i) {
            out.add(i.condition());
            out.add(i.thenBranch());
            if (i.elseBranch() != null) out.add(i.elseBranch());
        } else if (node instanceof DartLoop l) {
            out.addAll(l.init());
            if (l.condition() != null) out.add(l.condition());
            out.addAll(l.update());
            out.add(l.body());
        } else if (node instanceof DartExpressionStmt e) {
            out.add(e.expression());
        } else if (node instanceof DartReturn r) {
            if (r.value() != null) out.add(r.value());
        } else if (node instanceof DartUntranslated u) {
            out.addAll(u.partialTranslations());
        } else if (node instanceof DartCall c) {
            if (c.target() != null) out.add(c.target());
            out.addAll(c.arguments());
            out.addAll(c.namedArguments().values());
        } else if (node instanceof DartFieldAccess f) {
            out.add(f.target());
        } else if (node instanceof DartBinary b) {
            out.add(b.left());
            out.add(b.right());
        } else if (node instanceof DartUnary u) {
            out.add(u.operand());
        } else if (node instanceof DartTernary t) {
            out.add(t.condition());
            out.add(t.whenTrue());
            out.add(t.whenFalse());
        } else if (node instanceof DartLambda l) {
            out.add(l.body());
        } else if (node instanceof DartListLiteral l) {
            out.addAll(l.elements());
        }
        return out;
    }

    /** Untranslated nodes in the tree, outermost first in pre-order. */
    public static List<DartUntranslated> untranslated(DartNode root) {
        List<DartUntranslated> out = new ArrayList<>();
        collectUntranslated(root, out);
        return out;
    }

    private static void collectUntranslated(DartNode node, List<DartUntranslated> out) {
        if (node == null) return;
        if (node instanceof DartUntranslated u) out.add(u);
        for (DartNode c : children(node)) collectUntranslated(c, out);
    }
}
