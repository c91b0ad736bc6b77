package info.isaksson.erland.androidtoflutter.ir.code;

import java.util.List;
import java.util.Objects;

/**
 * Method call.
 *
 * @param scope  receiver, null for unqualified calls
 * @param source verbatim call text
 */
public record JCall(JExpression scope, String name, List<JExpression> arguments, String source) implements JExpression {

    public JCall {
        Objects.requireNonNull(name, "name must not be null");
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
        source = source == null ? name + "(...)" : source;
    }

    public JExpression argument(int index) {
        return index < arguments.size() ? arguments.get(index) : null;
    }
}
