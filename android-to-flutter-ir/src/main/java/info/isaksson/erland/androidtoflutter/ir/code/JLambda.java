package info.isaksson.erland.androidtoflutter.ir.code;

import java.util.List;
import java.util.Objects;

/**
 * Lambda, or a single-method anonymous listener folded into one. The body is a
 * {@link JBlock} or an expression.
 */
public record JLambda(List<String> parameters, JNode body) implements JExpression {

    public JLambda {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        Objects.requireNonNull(body, "body must not be null");
    }
}
