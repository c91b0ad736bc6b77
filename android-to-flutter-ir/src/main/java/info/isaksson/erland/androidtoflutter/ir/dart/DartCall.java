package info.isaksson.erland.androidtoflutter.ir.dart;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Method, function or constructor call.
 *
 * @param target   receiver, null for top-level functions and constructors
 * @param constant emit with {@code const}
 */
public record DartCall(DartExpression target,
                       String name,
                       List<DartExpression> arguments,
                       Map<String, DartExpression> namedArguments,
                       boolean constant) implements DartExpression {

    public DartCall {
        Objects.requireNonNull(name, "name must not be null");
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
        namedArguments = namedArguments == null || namedArguments.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(namedArguments));
    }

    public static DartCall of(DartExpression target, String name, DartExpression... arguments) {
        return new DartCall(target, name, List.of(arguments), null, false);
    }

    public static DartCall function(String name, DartExpression... arguments) {
        return new DartCall(null, name, List.of(arguments), null, false);
    }
}
