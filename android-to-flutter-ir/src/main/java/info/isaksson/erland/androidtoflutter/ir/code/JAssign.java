package info.isaksson.erland.androidtoflutter.ir.code;

import java.util.Objects;

/**
 * Assignment or local variable declaration.
 *
 * @param target       assigned expression
 * @param operator     {@code =}, {@code +=}, ...
 * @param value        assigned value; null for a declaration without initializer
 * @param declaredType declared Java type for declarations, null for plain assignments
 */
public record JAssign(JExpression target, String operator, JExpression value, String declaredType) implements JStatement {

    public JAssign {
        Objects.requireNonNull(target, "target must not be null");
        operator = operator == null ? "=" : operator;
    }

    public boolean isDeclaration() {
        return declaredType != null;
    }
}
