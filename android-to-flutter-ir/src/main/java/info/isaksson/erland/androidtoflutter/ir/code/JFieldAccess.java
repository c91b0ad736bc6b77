package info.isaksson.erland.androidtoflutter.ir.code;

import java.util.Objects;

public record JFieldAccess(JExpression scope, String name) implements JExpression {

    public JFieldAccess {
        Objects.requireNonNull(scope, "scope must not be null");
        Objects.requireNonNull(name, "name must not be null");
    }

    /** Dotted form when the scope is a chain of names, e.g. {@code R.id.login}; else null. */
    public String qualifiedName() {
        String prefix;
        if (scope instanceof JName n) {
            prefix = n.name();
        } else if (scope instanceof JFieldAccess f) {
            prefix = f.qualifiedName();
        } else {
            return null;
        }
        return prefix == null ? null : prefix + "." + name;
    }
}
