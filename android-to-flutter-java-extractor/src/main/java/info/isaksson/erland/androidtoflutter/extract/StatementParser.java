package info.isaksson.erland.androidtoflutter.extract;

import com.github.javaparser.TokenRange;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.CastExpr;
import com.github.javaparser.ast.expr.CharLiteralExpr;
import com.github.javaparser.ast.expr.ClassExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.DoubleLiteralExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.LongLiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.NullLiteralExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.TextBlockLiteralExpr;
import com.github.javaparser.ast.expr.ThisExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.ContinueStmt;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.EmptyStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.WhileStmt;
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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Converts JavaParser statements and expressions into the {@code J*} tree.
 *
 * <p>Conversion is total. Shapes without a tree counterpart (try, switch, synchronized,
 * labeled jumps, array access, instanceof, method references, ...) become
 * {@link JUnsupported} carrying the verbatim source tokens and the converted child
 * statements and expressions.</p>
 */
public final class StatementParser {

    private StatementParser() {}

    /** Body of a method; an abstract or native method yields an empty block. */
    public static JBlock methodBody(MethodDeclaration method) {
        return method.getBody().map(StatementParser::block).orElseGet(() -> new JBlock(List.of()));
    }

    /** Lambda body as a block; an expression body becomes a single expression statement. */
    public static JBlock lambdaBody(LambdaExpr lambda) {
        Optional<Expression> expr = lambda.getExpressionBody();
        if (expr.isPresent()) {
            return new JBlock(List.of(expressionStatement(expr.get())));
        }
        Statement body = lambda.getBody();
        return body instanceof BlockStmt b ? block(b) : new JBlock(List.of(statement(body)));
    }

    public static JBlock block(BlockStmt block) {
        List<JStatement> out = new ArrayList<>();
        for (Statement s : block.getStatements()) out.add(statement(s));
        return new JBlock(out);
    }

    public static JStatement statement(Statement s) {
        if (s instanceof BlockStmt b) return block(b);
        if (s instanceof ExpressionStmt e) return expressionStatement(e.getExpression());
        if (s instanceof IfStmt i) {
            return new JIf(expression(i.getCondition()), statement(i.getThenStmt()),
                    i.getElseStmt().map(StatementParser::statement).orElse(null));
        }
        if (s instanceof WhileStmt w) {
            return new JLoop(JLoop.Kind.WHILE, null, expression(w.getCondition()), null, null, statement(w.getBody()));
        }
        if (s instanceof DoStmt d) {
            return new JLoop(JLoop.Kind.DO_WHILE, null, expression(d.getCondition()), null, null, statement(d.getBody()));
        }
        if (s instanceof ForStmt f) {
            List<JStatement> init = new ArrayList<>();
            for (Expression e : f.getInitialization()) init.add(expressionStatement(e));
            List<JExpression> update = new ArrayList<>();
            for (Expression e : f.getUpdate()) update.add(expression(e));
            return new JLoop(JLoop.Kind.FOR, init, f.getCompare().map(StatementParser::expression).orElse(null),
                    update, null, statement(f.getBody()));
        }
        if (s instanceof ForEachStmt f) {
            return new JLoop(JLoop.Kind.FOR_EACH, null, expression(f.getIterable()), null,
                    f.getVariableDeclarator().getNameAsString(), statement(f.getBody()));
        }
        if (s instanceof ReturnStmt r) {
            return new JReturn(r.getExpression().map(StatementParser::expression).orElse(null));
        }
        if (s instanceof BreakStmt b && b.getLabel().isEmpty()) return new JJump(JJump.Kind.BREAK);
        if (s instanceof ContinueStmt c && c.getLabel().isEmpty()) return new JJump(JJump.Kind.CONTINUE);
        if (s instanceof EmptyStmt) return new JBlock(List.of());
        return unsupported(s);
    }

    static JStatement expressionStatement(Expression e) {
        if (e instanceof AssignExpr a) {
            return new JAssign(expression(a.getTarget()), a.getOperator().asString(), expression(a.getValue()), null);
        }
        if (e instanceof VariableDeclarationExpr v) {
            if (v.getVariables().size() != 1) return unsupported(v);
            VariableDeclarator d = v.getVariable(0);
            return new JAssign(new JName(d.getNameAsString()), "=",
                    d.getInitializer().map(StatementParser::expression).orElse(null),
                    d.getType().asString());
        }
        return new JExpressionStmt(expression(e));
    }

    public static JExpression expression(Expression e) {
        if (e instanceof EnclosedExpr en) return expression(en.getInner());
        if (e instanceof MethodCallExpr m) {
            return new JCall(m.getScope().map(StatementParser::expression).orElse(null), m.getNameAsString(),
                    expressions(m.getArguments()), rawText(m));
        }
        if (e instanceof ObjectCreationExpr o) return creation(o);
        if (e instanceof StringLiteralExpr s) return new JLiteral(JLiteral.Kind.STRING, s.asString());
        if (e instanceof TextBlockLiteralExpr t) return new JLiteral(JLiteral.Kind.STRING, t.asString());
        if (e instanceof CharLiteralExpr c) return new JLiteral(JLiteral.Kind.CHAR, String.valueOf(c.asChar()));
        if (e instanceof IntegerLiteralExpr i) return new JLiteral(JLiteral.Kind.INT, i.getValue());
        if (e instanceof LongLiteralExpr l) return new JLiteral(JLiteral.Kind.LONG, l.getValue());
        if (e instanceof DoubleLiteralExpr d) {
            String v = d.getValue();
            boolean isFloat = v.endsWith("f") || v.endsWith("F");
            return new JLiteral(isFloat ? JLiteral.Kind.FLOAT : JLiteral.Kind.DOUBLE, v);
        }
        if (e instanceof BooleanLiteralExpr b) return new JLiteral(JLiteral.Kind.BOOLEAN, String.valueOf(b.getValue()));
        if (e instanceof NullLiteralExpr) return new JLiteral(JLiteral.Kind.NULL, "null");
        if (e instanceof NameExpr n) return new JName(n.getNameAsString());
        if (e instanceof ThisExpr) return new JName("this");
        if (e instanceof FieldAccessExpr f) return new JFieldAccess(expression(f.getScope()), f.getNameAsString());
        if (e instanceof BinaryExpr b) {
            return new JBinary(expression(b.getLeft()), b.getOperator().asString(), expression(b.getRight()));
        }
        if (e instanceof UnaryExpr u) {
            return new JUnary(u.getOperator().asString(), expression(u.getExpression()), u.isPrefix());
        }
        if (e instanceof ConditionalExpr c) {
            return new JTernary(expression(c.getCondition()), expression(c.getThenExpr()), expression(c.getElseExpr()));
        }
        if (e instanceof LambdaExpr l) return lambda(l);
        if (e instanceof CastExpr c) return new JCast(c.getType().asString(), expression(c.getExpression()));
        if (e instanceof ClassExpr c) return new JClassLiteral(c.getType().asString());
        return unsupported(e);
    }

    private static JExpression creation(ObjectCreationExpr o) {
        Optional<com.github.javaparser.ast.NodeList<BodyDeclaration<?>>> anonymous = o.getAnonymousClassBody();
        if (anonymous.isEmpty()) {
            return new JNew(o.getType().asString(), expressions(o.getArguments()), rawText(o));
        }
        // A listener with a single method folds into a lambda over that method.
        List<BodyDeclaration<?>> members = anonymous.get();
        if (members.size() == 1 && members.get(0) instanceof MethodDeclaration m && m.getBody().isPresent()) {
            return new JLambda(parameterNames(m.getParameters()), methodBody(m));
        }
        return unsupported(o);
    }

    private static JLambda lambda(LambdaExpr l) {
        List<String> params = parameterNames(l.getParameters());
        Optional<Expression> expr = l.getExpressionBody();
        if (expr.isPresent() && !(expr.get() instanceof AssignExpr)) {
            return new JLambda(params, expression(expr.get()));
        }
        return new JLambda(params, lambdaBody(l));
    }

    private static List<String> parameterNames(List<Parameter> parameters) {
        List<String> out = new ArrayList<>();
        for (Parameter p : parameters) out.add(p.getNameAsString());
        return out;
    }

    private static List<JExpression> expressions(List<Expression> list) {
        List<JExpression> out = new ArrayList<>();
        for (Expression e : list) out.add(expression(e));
        return out;
    }

    private static JUnsupported unsupported(Node node) {
        return new JUnsupported(rawText(node), parts(node));
    }

    /** Converted statements and expressions below {@code node}, looking through other node types. */
    private static List<JNode> parts(Node node) {
        List<JNode> out = new ArrayList<>();
        for (Node child : node.getChildNodes()) {
            if (child instanceof Statement s) {
                out.add(statement(s));
            } else if (child instanceof VariableDeclarationExpr || child instanceof AssignExpr) {
                out.add(expressionStatement((Expression) child));
            } else if (child instanceof Expression e) {
                out.add(expression(e));
            } else if (child instanceof VariableDeclarator d) {
                d.getInitializer().ifPresent(init -> out.add(expression(init)));
            } else {
                out.addAll(parts(child));
            }
        }
        return out;
    }

    /** Verbatim source tokens of {@code node}, including comments and whitespace. */
    static String rawText(Node node) {
        return node.getTokenRange().map(TokenRange::toString).orElseGet(node::toString);
    }
}
