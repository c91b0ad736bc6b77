package info.isaksson.erland.androidtoflutter.ir.code;

import java.util.Objects;

public record JTernary(JExpression condition, JExpression whenTrue, JExpression whenFalse) implements JExpression {

    public JTernary {
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(whenTrue, "whenTrue must not be null");
        Objects.requireNonNull(whenFalse, "whenFalse must not be null");
    }
}
