package info.isaksson.erland.androidtoflutter.ir.dart;

public sealed interface DartExpression extends DartNode
        permits DartCall, DartLiteral, DartName, DartFieldAccess, DartBinary, DartUnary, DartTernary, DartLambda,
                DartListLiteral, DartUntranslated {
}
