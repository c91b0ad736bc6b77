package info.isaksson.erland.androidtoflutter.ir.dart;

import java.util.List;
import java.util.Objects;

/** Loop; for {@link Kind#FOR_IN} the condition is the iterable. */
public record DartLoop(Kind kind,
                       List<DartStatement> init,
                       DartExpression condition,
                       List<DartExpression> update,
                       String variable,
                       DartStatement body) implements DartStatement {

    public enum Kind {
        WHILE,
        DO_WHILE,
        FOR,
        FOR_IN
    }

    public DartLoop {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(body, "body must not be null");
        init = init == null ? List.of() : List.copyOf(init);
        update = update == null ? List.of() : List.copyOf(update);
    }
}
