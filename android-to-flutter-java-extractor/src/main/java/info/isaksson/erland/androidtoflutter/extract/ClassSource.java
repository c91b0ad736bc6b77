package info.isaksson.erland.androidtoflutter.extract;

import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;

import java.util.Objects;

/**
 * Facts recorded for one class declared in the scanned sources. The declaration is only read
 * after indexing.
 */
public final class ClassSource {

    public final String simpleName;
    public final String qualifiedName;

    /** Declared superclass as a simple name without type arguments, or null. */
    public final String superclass;

    /** Relative path of the declaring file. */
    public final String unitName;

    public final boolean overridesOnDraw;

    /** First layout inflated by the class ({@code inflate(R.layout.x, ...)} or {@code XBinding.inflate}), or null. */
    public final String inflatedLayout;

    /** Layout passed to {@code setContentView}, directly or through a view binding, or null. */
    public final String contentLayout;

    public final ClassOrInterfaceDeclaration declaration;

    ClassSource(String simpleName,
                String qualifiedName,
                String superclass,
                String unitName,
                boolean overridesOnDraw,
                String inflatedLayout,
                String contentLayout,
                ClassOrInterfaceDeclaration declaration) {
        this.simpleName = Objects.requireNonNull(simpleName, "simpleName must not be null");
        this.qualifiedName = Objects.requireNonNull(qualifiedName, "qualifiedName must not be null");
        this.superclass = superclass;
        this.unitName = unitName;
        this.overridesOnDraw = overridesOnDraw;
        this.inflatedLayout = inflatedLayout;
        this.contentLayout = contentLayout;
        this.declaration = Objects.requireNonNull(declaration, "declaration must not be null");
    }

    @Override public String toString() {
        return qualifiedName + (superclass == null ? "" : " extends " + superclass);
    }
}
