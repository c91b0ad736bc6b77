package info.isaksson.erland.androidtoflutter.ir.code;

import java.util.List;
import java.util.Objects;

/** Object creation {@code new Type(args)}; {@code type} is written as in the source. */
public record JNew(String type, List<JExpression> arguments, String source) implements JExpression {

    public JNew {
        Objects.requireNonNull(type, "type must not be null");
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
        source = source == null ? "new " + type + "(...)" : source;
    }

    /** Type name without qualifier and type arguments. */
    public String simpleType() {
        String t = type;
        int lt = t.indexOf('<');
        if (lt >= 0) t = t.substring(0, lt);
        int dot = t.lastIndexOf('.');
        return dot >= 0 ? t.substring(dot + 1) : t;
    }
}
