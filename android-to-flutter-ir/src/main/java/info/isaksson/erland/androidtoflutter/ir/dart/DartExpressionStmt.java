package info.isaksson.erland.androidtoflutter.ir.dart;

import java.util.Objects;

public record DartExpressionStmt(DartExpression expression) implements DartStatement {

    public DartExpressionStmt {
        Objects.requireNonNull(expression, "expression must not be null");
    }
}
