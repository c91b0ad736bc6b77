package info.isaksson.erland.androidtoflutter.ir.dart;

import java.util.Objects;

/**
 * Assignment or declaration.
 *
 * @param declaredType Dart type or {@code var} for declarations, null for plain assignments
 */
public record DartAssign(DartExpression target, String operator, DartExpression value, String declaredType)
        implements DartStatement {

    public DartAssign {
        Objects.requireNonNull(target, "target must not be null");
        operator = operator == null ? "=" : operator;
    }
}
