package info.isaksson.erland.androidtoflutter.ir.dart;

import java.util.List;

public record DartBlock(List<DartStatement> statements) implements DartStatement {

    public DartBlock {
        statements = statements == null ? List.of() : List.copyOf(statements);
    }
}
