package info.isaksson.erland.androidtoflutter.ir.dart;

import java.util.Objects;

public record DartName(String name) implements DartExpression {

    public static final DartName CONTEXT = new DartName("context");

    public DartName {
        Objects.requireNonNull(name, "name must not be null");
    }
}
