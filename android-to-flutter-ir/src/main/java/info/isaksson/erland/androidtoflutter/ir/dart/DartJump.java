package info.isaksson.erland.androidtoflutter.ir.dart;

public record DartJump(Kind kind) implements DartStatement {

    public enum Kind {
        BREAK,
        CONTINUE
    }
}
