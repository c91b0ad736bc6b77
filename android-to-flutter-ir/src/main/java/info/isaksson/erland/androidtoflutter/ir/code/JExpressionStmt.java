package info.isaksson.erland.androidtoflutter.ir.code;

import java.util.Objects;

public record JExpressionStmt(JExpression expression) implements JStatement {

    public JExpressionStmt {
        Objects.requireNonNull(expression, "expression must not be null");
    }
}
