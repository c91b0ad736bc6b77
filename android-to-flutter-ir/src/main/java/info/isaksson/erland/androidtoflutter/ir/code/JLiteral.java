package info.isaksson.erland.androidtoflutter.ir.code;

import java.util.Objects;

/**
 * Literal value. Strings and chars hold their decoded content; numbers keep the source text
 * including suffixes.
 */
public record JLiteral(Kind kind, String value) implements JExpression {

    public enum Kind {
        STRING,
        CHAR,
        INT,
        LONG,
        FLOAT,
        DOUBLE,
        BOOLEAN,
        NULL
    }

    public JLiteral {
        Objects.requireNonNull(kind, "kind must not be null");
        value = value == null ? "null" : value;
    }

    public static JLiteral string(String value) {
        return new JLiteral(Kind.STRING, value);
    }
}
