package info.isaksson.erland.androidtoflutter.ir.code;

/** {@code return}; value is null for a bare return. */
public record JReturn(JExpression value) implements JStatement {
}
