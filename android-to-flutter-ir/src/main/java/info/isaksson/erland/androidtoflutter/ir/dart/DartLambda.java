package info.isaksson.erland.androidtoflutter.ir.dart;

import java.util.List;
import java.util.Objects;

/** Closure; the body is a {@link DartBlock} or an expression ({@code =>} form). */
public record DartLambda(List<String> parameters, DartNode body) implements DartExpression {

    public DartLambda {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        Objects.requireNonNull(body, "body must not be null");
    }
}
