package info.isaksson.erland.androidtoflutter.ir.code;

import java.util.List;
import java.util.Objects;

/**
 * Source construct without a tree counterpart. Keeps the verbatim text plus whatever child
 * statements/expressions could still be parsed.
 */
public record JUnsupported(String rawText, List<JNode> parts) implements JStatement, JExpression {

    public JUnsupported {
        Objects.requireNonNull(rawText, "rawText must not be null");
        parts = parts == null ? List.of() : List.copyOf(parts);
    }

    public JUnsupported(String rawText) {
        this(rawText, List.of());
    }
}
