package info.isaksson.erland.androidtoflutter.ir.dart;

import java.util.Objects;

public record DartBinary(DartExpression left, String operator, DartExpression right) implements DartExpression {

    public DartBinary {
        Objects.requireNonNull(left, "left must not be null");
        Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(right, "right must not be null");
    }
}
