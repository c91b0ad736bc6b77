package info.isaksson.erland.androidtoflutter.ir.dart;

import java.util.Objects;

/** Literal; strings hold unescaped content. */
public record DartLiteral(Kind kind, String value) implements DartExpression {

    public enum Kind {
        STRING,
        NUMBER,
        BOOLEAN,
        NULL
    }

    public DartLiteral {
        Objects.requireNonNull(kind, "kind must not be null");
        value = value == null ? "null" : value;
    }

    public static DartLiteral string(String value) {
        return new DartLiteral(Kind.STRING, value);
    }
}
