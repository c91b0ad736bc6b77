package info.isaksson.erland.androidtoflutter.ir.code;

public sealed interface JExpression extends JNode
        permits JCall, JNew, JLiteral, JName, JFieldAccess, JBinary, JUnary, JTernary, JLambda, JCast,
                JClassLiteral, JUnsupported {
}
