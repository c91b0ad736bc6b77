package info.isaksson.erland.androidtoflutter.ir.code;

public sealed interface JStatement extends JNode
        permits JBlock, JAssign, JIf, JLoop, JExpressionStmt, JReturn, JJump, JUnsupported {
}
