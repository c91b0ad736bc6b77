package info.isaksson.erland.androidtoflutter.extract;

import com.github.javaparser.ast.body.MethodDeclaration;
import info.isaksson.erland.androidtoflutter.ir.code.JAssign;
import info.isaksson.erland.androidtoflutter.ir.code.JBlock;
import info.isaksson.erland.androidtoflutter.ir.code.JCall;
import info.isaksson.erland.androidtoflutter.ir.code.JExpressionStmt;
import info.isaksson.erland.androidtoflutter.ir.code.JLambda;
import info.isaksson.erland.androidtoflutter.ir.code.JLiteral;
import info.isaksson.erland.androidtoflutter.ir.code.JLoop;
import info.isaksson.erland.androidtoflutter.ir.code.JName;
import info.isaksson.erland.androidtoflutter.ir.code.JUnsupported;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class StatementParserTest {

    static JBlock body(String statements) {
        String source = "class Screen {\n  void handler(View v) {\n" + statements + "\n  }\n}\n";
        MethodDeclaration m = new JavaSourceParser().parse(source).findFirst(MethodDeclaration.class).orElseThrow();
        return StatementParser.methodBody(m);
    }

    @Test
    void declarationsKeepTheirJavaTypeAndLiteralsTheirSourceText() {
        JBlock b = body("""
                long total = 10L;
                String label = "a\\tb";
                total += 2;
                """);
        assertEquals(3, b.statements().size());

        JAssign total = (JAssign) b.statements().get(0);
        assertEquals("long", total.declaredType());
        assertEquals(new JLiteral(JLiteral.Kind.LONG, "10L"), total.value());

        JAssign label = (JAssign) b.statements().get(1);
        assertEquals(JLiteral.string("a\tb"), label.value());

        JAssign plus = (JAssign) b.statements().get(2);
        assertFalse(plus.isDeclaration());
        assertEquals("+=", plus.operator());
    }

    @Test
    void anonymousListenerFoldsIntoLambda() {
        JBlock b = body("""
                button.setOnClickListener(new View.OnClickListener() {
                    @Override
                    public void onClick(View view) {
                        finish();
                    }
                });
                """);
        JCall register = (JCall) ((JExpressionStmt) b.statements().get(0)).expression();
        assertEquals("setOnClickListener", register.name());
        JLambda listener = (JLambda) register.argument(0);
        assertEquals(List.of("view"), listener.parameters());
        assertEquals(1, ((JBlock) listener.body()).statements().size());
    }

    @Test
    void unsupportedShapesKeepVerbatimTextAndParsedParts() {
        JBlock b = body("""
                switch (mode) {
                    case 1: start(); break;
                    default: stop();
                }
                int first = values[0];
                """);

        JUnsupported sw = (JUnsupported) b.statements().get(0);
        assertTrue(sw.rawText().startsWith("switch (mode) {"), sw.rawText());
        assertTrue(sw.rawText().contains("default: stop();"));
        assertTrue(sw.parts().contains(new JName("mode")));
        assertTrue(sw.parts().stream().anyMatch(p -> p instanceof JExpressionStmt e
                && e.expression() instanceof JCall c && c.name().equals("stop")));

        JAssign first = (JAssign) b.statements().get(1);
        JUnsupported access = (JUnsupported) first.value();
        assertEquals("values[0]", access.rawText());
        assertEquals(2, access.parts().size());
        assertTrue(access.parts().containsAll(List.of(new JName("values"), new JLiteral(JLiteral.Kind.INT, "0"))));
    }

    @Test
    void loopsAndMultiDeclarations() {
        JBlock b = body("""
                for (int i = 0; i < 3; i++) { tick(i); }
                for (String s : names) log(s);
                int a = 1, c = 2;
                """);
        JLoop counted = (JLoop) b.statements().get(0);
        assertEquals(JLoop.Kind.FOR, counted.kind());
        assertEquals(1, counted.init().size());
        assertEquals(1, counted.update().size());

        JLoop each = (JLoop) b.statements().get(1);
        assertEquals(JLoop.Kind.FOR_EACH, each.kind());
        assertEquals("s", each.variable());
        assertEquals(new JName("names"), each.condition());

        JUnsupported multi = (JUnsupported) b.statements().get(2);
        assertEquals("int a = 1, c = 2", multi.rawText());
    }
}
