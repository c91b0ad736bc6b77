package info.isaksson.erland.androidtoflutter.ir.code;

import java.util.Objects;

public record JUnary(String operator, JExpression operand, boolean prefix) implements JExpression {

    public JUnary {
        Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(operand, "operand must not be null");
    }
}
