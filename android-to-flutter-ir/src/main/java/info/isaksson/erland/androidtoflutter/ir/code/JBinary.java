package info.isaksson.erland.androidtoflutter.ir.code;

import java.util.Objects;

/** Binary operation; {@code operator} is the Java symbol. */
public record JBinary(JExpression left, String operator, JExpression right) implements JExpression {

    public JBinary {
        Objects.requireNonNull(left, "left must not be null");
        Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(right, "right must not be null");
    }
}
