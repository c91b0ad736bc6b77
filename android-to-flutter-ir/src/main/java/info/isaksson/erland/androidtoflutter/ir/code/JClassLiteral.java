package info.isaksson.erland.androidtoflutter.ir.code;

import java.util.Objects;

/** {@code Type.class}. */
public record JClassLiteral(String type) implements JExpression {

    public JClassLiteral {
        Objects.requireNonNull(type, "type must not be null");
    }

    public String simpleType() {
        int dot = type.lastIndexOf('.');
        return dot >= 0 ? type.substring(dot + 1) : type;
    }
}
