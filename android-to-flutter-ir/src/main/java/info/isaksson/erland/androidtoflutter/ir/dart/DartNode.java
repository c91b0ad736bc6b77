package info.isaksson.erland.androidtoflutter.ir.dart;

/**
 * Translated Dart statement/expression tree, produced from a Java method-body tree.
 */
public sealed interface DartNode permits DartStatement, DartExpression {
}
