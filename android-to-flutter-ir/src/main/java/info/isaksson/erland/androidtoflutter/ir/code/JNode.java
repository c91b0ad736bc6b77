package info.isaksson.erland.androidtoflutter.ir.code;

/**
 * Parsed Java method-body tree. Each node owns its children; there is no sharing.
 */
public sealed interface JNode permits JStatement, JExpression {
}
