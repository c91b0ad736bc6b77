package info.isaksson.erland.androidtoflutter.ir.code;

import java.util.Objects;

public record JCast(String type, JExpression expression) implements JExpression {

    public JCast {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(expression, "expression must not be null");
    }
}
