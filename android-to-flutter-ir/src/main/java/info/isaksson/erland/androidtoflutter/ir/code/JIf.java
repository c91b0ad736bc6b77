package info.isaksson.erland.androidtoflutter.ir.code;

import java.util.Objects;

/** Conditional; {@code elseBranch} is null when absent. */
public record JIf(JExpression condition, JStatement thenBranch, JStatement elseBranch) implements JStatement {

    public JIf {
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(thenBranch, "thenBranch must not be null");
    }
}
