package info.isaksson.erland.androidtoflutter.ir.dart;

import java.util.List;

public record DartListLiteral(List<DartExpression> elements) implements DartExpression {

    public DartListLiteral {
        elements = elements == null ? List.of() : List.copyOf(elements);
    }
}
