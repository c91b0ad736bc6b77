package info.isaksson.erland.androidtoflutter.ir.dart;

public record DartReturn(DartExpression value) implements DartStatement {
}
