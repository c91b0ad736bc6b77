package info.isaksson.erland.androidtoflutter.ir.code;

import java.util.Objects;

/** Identifier, including {@code this}. */
public record JName(String name) implements JExpression {

    public JName {
        Objects.requireNonNull(name, "name must not be null");
    }
}
