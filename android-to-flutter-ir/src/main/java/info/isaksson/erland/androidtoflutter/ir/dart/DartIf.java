package info.isaksson.erland.androidtoflutter.ir.dart;

import java.util.Objects;

public record DartIf(DartExpression condition, DartStatement thenBranch, DartStatement elseBranch) implements DartStatement {

    public DartIf {
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(thenBranch, "thenBranch must not be null");
    }
}
