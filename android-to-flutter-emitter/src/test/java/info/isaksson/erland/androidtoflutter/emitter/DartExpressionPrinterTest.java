package info.isaksson.erland.androidtoflutter.emitter;

import info.isaksson.erland.androidtoflutter.ir.dart.DartAssign;
import info.isaksson.erland.androidtoflutter.ir.dart.DartBinary;
import info.isaksson.erland.androidtoflutter.ir.dart.DartBlock;
import info.isaksson.erland.androidtoflutter.ir.dart.DartCall;
import info.isaksson.erland.androidtoflutter.ir.dart.DartExpression;
import info.isaksson.erland.androidtoflutter.ir.dart.DartExpressionStmt;
import info.isaksson.erland.androidtoflutter.ir.dart.DartIf;
import info.isaksson.erland.androidtoflutter.ir.dart.DartLambda;
import info.isaksson.erland.androidtoflutter.ir.dart.DartLiteral;
import info.isaksson.erland.androidtoflutter.ir.dart.DartLoop;
import info.isaksson.erland.androidtoflutter.ir.dart.DartName;
import info.isaksson.erland.androidtoflutter.ir.dart.DartReturn;
import info.isaksson.erland.androidtoflutter.ir.dart.DartUnary;
import info.isaksson.erland.androidtoflutter.ir.dart.DartUntranslated;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class DartExpressionPrinterTest {

    private static final DartName A = new DartName("a");
    private static final DartName B = new DartName("b");

    @Test
    void stringsAreSingleQuotedAndEscaped() {
        assertEquals("'it\\'s \\$5\\n'", DartExpressionPrinter.quote("it's $5\n"));
        assertEquals("'C:\\\\temp'", DartExpressionPrinter.expression(DartLiteral.string("C:\\temp"), 0));
    }

    @Test
    void nestedOperatorsAreParenthesized() {
        DartBinary sum = new DartBinary(A, "+", B);
        assertEquals("(a + b) * c", DartExpressionPrinter.expression(new DartBinary(sum, "*", new DartName("c")), 0));
        assertEquals("!(a == b)", DartExpressionPrinter.expression(
                new DartUnary("!", new DartBinary(A, "==", B), true), 0));
        assertEquals("(a + b).toString()", DartExpressionPrinter.expression(DartCall.of(sum, "toString"), 0));
        assertEquals("i++", DartExpressionPrinter.expression(new DartUnary("++", new DartName("i"), false), 0));
    }

    @Test
    void setStateKeepsItsClosureOnTheCallLine() {
        DartAssign assign = new DartAssign(new DartName("_statusTextText"), "=", DartLiteral.string("Saved"), null);
        DartCall setState = DartCall.function("setState", new DartLambda(List.of(), new DartBlock(List.of(assign))));

        String printed = String.join("\n", DartExpressionPrinter.statement(new DartExpressionStmt(setState), 1));

        assertEquals("  setState(() {\n    _statusTextText = 'Saved';\n  });", printed);
    }

    @Test
    void longCallsPutOneArgumentPerLine() {
        Map<String, DartExpression> named = new LinkedHashMap<>();
        named.put("style", new DartCall(null, "TextStyle", List.of(),
                Map.of("fontSize", new DartLiteral(DartLiteral.Kind.NUMBER, "14.0")), false));
        String text = "x".repeat(70);
        DartCall call = new DartCall(null, "Text", List.of(DartLiteral.string(text)), named, false);

        assertEquals("Text(\n  '" + text + "',\n  style: TextStyle(fontSize: 14.0),\n)",
                DartExpressionPrinter.expression(call, 0));
        assertEquals("Text('short')", DartExpressionPrinter.expression(DartCall.function("Text", DartLiteral.string("short")), 0));
    }

    @Test
    void untranslatedStatementsBecomeCommentLines() {
        DartUntranslated raw = new DartUntranslated("analytics.track(\"login\",\n        count);", List.of());

        List<String> lines = DartExpressionPrinter.statement(raw, 2);

        assertEquals(List.of(
                "    // untranslated: analytics.track(\"login\",",
                "    // untranslated: " + "        count);"), lines);
    }

    @Test
    void untranslatedSubExpressionIsCommentedAndNulled() {
        DartAssign declaration = new DartAssign(new DartName("user"), "=",
                new DartUntranslated("repository.find(id)", List.of()), "var");

        assertEquals(List.of("// untranslated: repository.find(id)", "var user = null;"),
                DartExpressionPrinter.statement(declaration, 0));
    }

    @Test
    void conditionalChainsAndLoops() {
        DartIf chain = new DartIf(A,
                new DartBlock(List.of(new DartReturn(null))),
                new DartIf(B,
                        new DartExpressionStmt(DartCall.function("print", DartLiteral.string("b"))),
                        new DartBlock(List.of(new DartExpressionStmt(DartCall.function("print", DartLiteral.string("c")))))));

        assertEquals(List.of(
                "if (a) {",
                "  return;",
                "} else if (b) {",
                "  print('b');",
                "} else {",
                "  print('c');",
                "}"), String.join("\n", DartExpressionPrinter.statement(chain, 0)).lines().toList());

        DartLoop forIn = new DartLoop(DartLoop.Kind.FOR_IN, null, new DartName("items"), null, "item",
                new DartBlock(List.of(new DartExpressionStmt(DartCall.function("print", new DartName("item"))))));
        assertEquals(List.of("for (final item in items) {", "  print(item);", "}"),
                DartExpressionPrinter.statement(forIn, 0));
    }
}
