package info.isaksson.erland.androidtoflutter.ir.code;

public record JJump(Kind kind) implements JStatement {

    public enum Kind {
        BREAK,
        CONTINUE
    }
}
