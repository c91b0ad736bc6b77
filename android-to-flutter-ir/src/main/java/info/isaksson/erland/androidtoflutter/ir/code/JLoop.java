package info.isaksson.erland.androidtoflutter.ir.code;

import java.util.List;
import java.util.Objects;

/**
 * Any Java loop. For {@link Kind#FOR_EACH} the condition holds the iterated expression and
 * {@code variable} the loop variable.
 */
public record JLoop(Kind kind,
                    List<JStatement> init,
                    JExpression condition,
                    List<JExpression> update,
                    String variable,
                    JStatement body) implements JStatement {

    public enum Kind {
        WHILE,
        DO_WHILE,
        FOR,
        FOR_EACH
    }

    public JLoop {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(body, "body must not be null");
        init = init == null ? List.of() : List.copyOf(init);
        update = update == null ? List.of() : List.copyOf(update);
    }
}
