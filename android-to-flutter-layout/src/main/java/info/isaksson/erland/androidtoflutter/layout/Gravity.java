package info.isaksson.erland.androidtoflutter.layout;

import info.isaksson.erland.androidtoflutter.ir.Alignment;
import info.isaksson.erland.androidtoflutter.ir.Orientation;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/** Parsing of {@code gravity} / {@code layout_gravity} flag lists such as {@code center_vertical|end}. */
public final class Gravity {

    private Gravity() {}

    public static Set<String> tokens(String gravity) {
        Set<String> out = new LinkedHashSet<>();
        if (gravity == null) return out;
        for (String t : gravity.toLowerCase(Locale.ROOT).split("\\|")) {
            String s = t.trim();
            if (!s.isEmpty()) out.add(s);
        }
        return out;
    }

    /** Horizontal component: START, CENTER, END or NONE. */
    public static Alignment horizontal(Set<String> tokens) {
        if (tokens.contains("center") || tokens.contains("center_horizontal")) return Alignment.CENTER;
        if (tokens.contains("end") || tokens.contains("right")) return Alignment.END;
        if (tokens.contains("start") || tokens.contains("left")) return Alignment.START;
        if (tokens.contains("fill") || tokens.contains("fill_horizontal")) return Alignment.STRETCH;
        return Alignment.NONE;
    }

    /** Vertical component: START (top), CENTER, END (bottom) or NONE. */
    public static Alignment vertical(Set<String> tokens) {
        if (tokens.contains("center") || tokens.contains("center_vertical")) return Alignment.CENTER;
        if (tokens.contains("bottom")) return Alignment.END;
        if (tokens.contains("top")) return Alignment.START;
        if (tokens.contains("fill") || tokens.contains("fill_vertical")) return Alignment.STRETCH;
        return Alignment.NONE;
    }

    /** Component of {@code gravity} along the cross axis of a container with the given main axis. */
    public static Alignment crossAxis(String gravity, Orientation mainAxis) {
        Set<String> t = tokens(gravity);
        return mainAxis == Orientation.HORIZONTAL ? vertical(t) : horizontal(t);
    }

    public static Alignment mainAxis(String gravity, Orientation mainAxis) {
        Set<String> t = tokens(gravity);
        return mainAxis == Orientation.HORIZONTAL ? horizontal(t) : vertical(t);
    }

    /**
     * Flutter {@code Alignment} constant for a gravity in a stacking container, e.g.
     * {@code bottom|end} → {@code Alignment.bottomRight}. Null when no gravity is set.
     */
    public static String stackAlignment(String gravity) {
        Set<String> t = tokens(gravity);
        if (t.isEmpty()) return null;
        Alignment h = horizontal(t);
        Alignment v = vertical(t);
        String vertical = switch (v) {
            case START -> "top";
            case END -> "bottom";
            default -> "center";
        };
        String horizontal = switch (h) {
            case START -> "Left";
            case END -> "Right";
            default -> "Center";
        };
        if (vertical.equals("center") && horizontal.equals("Center")) return "Alignment.center";
        return "Alignment." + vertical + horizontal;
    }
}
