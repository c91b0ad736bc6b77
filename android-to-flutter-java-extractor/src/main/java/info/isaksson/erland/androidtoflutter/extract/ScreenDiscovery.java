package info.isaksson.erland.androidtoflutter.extract;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Pairs screen classes with their layouts: activities through {@code setContentView} (layout
 * id or view binding) and fragments through {@code inflater.inflate(R.layout.x, ...)}.
 */
public final class ScreenDiscovery {

    private ScreenDiscovery() {}

    /** A class and the layout it shows. */
    public record ScreenPairing(String className, String qualifiedName, String layoutId) {

        public ScreenPairing {
            Objects.requireNonNull(className, "className must not be null");
            Objects.requireNonNull(layoutId, "layoutId must not be null");
        }
    }

    /** Pairings ordered by qualified class name. */
    public static List<ScreenPairing> discover(ClassSourceIndex index) {
        Set<String> screens = new LinkedHashSet<>();
        for (ClassSource c : index.screenClasses()) screens.add(c.qualifiedName);

        List<ScreenPairing> out = new ArrayList<>();
        for (ClassSource c : index.classes()) {
            String layout = c.contentLayout;
            if (layout == null && screens.contains(c.qualifiedName)) layout = c.inflatedLayout;
            if (layout != null) out.add(new ScreenPairing(c.simpleName, c.qualifiedName, layout));
        }
        out.sort(Comparator.comparing(ScreenPairing::qualifiedName));
        return out;
    }
}
