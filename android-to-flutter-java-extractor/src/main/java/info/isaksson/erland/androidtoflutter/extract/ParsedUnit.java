package info.isaksson.erland.androidtoflutter.extract;

import com.github.javaparser.ast.CompilationUnit;

import java.util.Objects;

/** A parsed Java source: its display name (relative path) and compilation unit. */
public record ParsedUnit(String name, CompilationUnit cu) {

    public ParsedUnit {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(cu, "cu must not be null");
    }
}
