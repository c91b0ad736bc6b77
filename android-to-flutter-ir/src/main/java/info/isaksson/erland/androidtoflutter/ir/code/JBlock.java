package info.isaksson.erland.androidtoflutter.ir.code;

import java.util.List;

public record JBlock(List<JStatement> statements) implements JStatement {

    public JBlock {
        statements = statements == null ? List.of() : List.copyOf(statements);
    }
}
