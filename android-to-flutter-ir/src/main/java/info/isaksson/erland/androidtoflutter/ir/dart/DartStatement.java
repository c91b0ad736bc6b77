package info.isaksson.erland.androidtoflutter.ir.dart;

public sealed interface DartStatement extends DartNode
        permits DartBlock, DartAssign, DartIf, DartLoop, DartExpressionStmt, DartReturn, DartJump, DartUntranslated {
}
