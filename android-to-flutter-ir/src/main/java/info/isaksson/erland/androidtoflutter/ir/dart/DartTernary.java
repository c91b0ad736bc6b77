package info.isaksson.erland.androidtoflutter.ir.dart;

import java.util.Objects;

public record DartTernary(DartExpression condition, DartExpression whenTrue, DartExpression whenFalse)
        implements DartExpression {

    public DartTernary {
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(whenTrue, "whenTrue must not be null");
        Objects.requireNonNull(whenFalse, "whenFalse must not be null");
    }
}
