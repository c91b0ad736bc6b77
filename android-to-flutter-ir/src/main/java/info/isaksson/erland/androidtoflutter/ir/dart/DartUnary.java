package info.isaksson.erland.androidtoflutter.ir.dart;

import java.util.Objects;

public record DartUnary(String operator, DartExpression operand, boolean prefix) implements DartExpression {

    public DartUnary {
        Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(operand, "operand must not be null");
    }
}
