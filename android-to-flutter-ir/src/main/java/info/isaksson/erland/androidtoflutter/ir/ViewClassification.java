package info.isaksson.erland.androidtoflutter.ir;

import java.util.List;
import java.util.Objects;

/**
 * Archetype assigned to a custom view class plus the widget kind used in its place.
 *
 * @param className          simple class name as referenced by the markup tag
 * @param archetype          structural bucket
 * @param placeholderKind    widget kind the mapper emits
 * @param superclassChain    class followed by its ancestors, ending at the first class not in source
 * @param terminalPrimitive  last entry of the chain when it is a known framework view, else null
 * @param inflatedLayout     layout id inflated by the class, or null
 */
public record ViewClassification(String className,
                                 ViewArchetype archetype,
                                 WidgetKind placeholderKind,
                                 List<String> superclassChain,
                                 String terminalPrimitive,
                                 String inflatedLayout) {

    public ViewClassification {
        Objects.requireNonNull(className, "className must not be null");
        Objects.requireNonNull(archetype, "archetype must not be null");
        Objects.requireNonNull(placeholderKind, "placeholderKind must not be null");
        superclassChain = superclassChain == null ? List.of() : List.copyOf(superclassChain);
    }
}
