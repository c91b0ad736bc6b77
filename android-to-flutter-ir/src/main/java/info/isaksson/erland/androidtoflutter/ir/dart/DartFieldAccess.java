package info.isaksson.erland.androidtoflutter.ir.dart;

import java.util.Objects;

public record DartFieldAccess(DartExpression target, String name) implements DartExpression {

    public DartFieldAccess {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(name, "name must not be null");
    }
}
