package info.isaksson.erland.androidtoflutter.resources;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Values from {@code res/values}: colors, strings and dimensions, with reference resolution.
 *
 * <p>References may chain ({@code @color/primary} → {@code @color/blue_500}); chains longer
 * than {@value #MAX_DEPTH} are treated as unresolvable.</p>
 */
public final class ResourceTable {

    public static final ResourceTable EMPTY = new ResourceTable(null, null, null);

    static final int MAX_DEPTH = 8;

    private static final Map<String, Long> FRAMEWORK_COLORS = Map.of(
            "white", 0xFFFFFFFFL,
            "black", 0xFF000000L,
            "transparent", 0x00000000L,
            "darker_gray", 0xFFAAAAAAL,
            "holo_red_dark", 0xFFCC0000L,
            "holo_blue_dark", 0xFF0099CCL,
            "holo_green_dark", 0xFF669900L
    );

    private final Map<String, String> colors;
    private final Map<String, String> strings;
    private final Map<String, String> dimens;

    public ResourceTable(Map<String, String> colors, Map<String, String> strings, Map<String, String> dimens) {
        this.colors = freeze(colors);
        this.strings = freeze(strings);
        this.dimens = freeze(dimens);
    }

    private static Map<String, String> freeze(Map<String, String> m) {
        return m == null ? Collections.emptyMap() : Collections.unmodifiableMap(new TreeMap<>(m));
    }

    public Map<String, String> colors() {
        return colors;
    }

    public Map<String, String> strings() {
        return strings;
    }

    public Map<String, String> dimens() {
        return dimens;
    }

    /**
     * Text for an attribute value: literals are returned as-is, {@code @string/x} is resolved.
     * Empty when a string reference cannot be resolved.
     */
    public Optional<String> text(String raw) {
        if (raw == null) return Optional.empty();
        String v = raw;
        for (int depth = 0; depth < MAX_DEPTH; depth++) {
            if (!isReference(v, "string")) {
                return Optional.of(unescapeAndroid(v));
            }
            v = strings.get(refName(v));
            if (v == null) return Optional.empty();
        }
        return Optional.empty();
    }

    /** ARGB value of a literal color or a color reference. */
    public Optional<Long> color(String raw) {
        if (raw == null) return Optional.empty();
        String v = raw.trim();
        for (int depth = 0; depth < MAX_DEPTH; depth++) {
            if (v.startsWith("#")) return parseColor(v);
            if (v.startsWith("@android:color/")) {
                return Optional.ofNullable(FRAMEWORK_COLORS.get(refName(v)));
            }
            if (!isReference(v, "color")) return Optional.empty();
            v = colors.get(refName(v));
            if (v == null) return Optional.empty();
            v = v.trim();
        }
        return Optional.empty();
    }

    /** Logical pixels of a literal dimension or a dimension reference. */
    public Optional<Double> dimension(String raw) {
        if (raw == null) return Optional.empty();
        String v = raw.trim();
        for (int depth = 0; depth < MAX_DEPTH; depth++) {
            if (!isReference(v, "dimen")) return parseDimension(v);
            v = dimens.get(refName(v));
            if (v == null) return Optional.empty();
            v = v.trim();
        }
        return Optional.empty();
    }

    public static boolean isReference(String value, String type) {
        return value != null && (value.startsWith("@" + type + "/") || value.startsWith("@+" + type + "/"));
    }

    static String refName(String ref) {
        int slash = ref.lastIndexOf('/');
        return slash >= 0 ? ref.substring(slash + 1) : ref;
    }

    /** Parses {@code #RGB}, {@code #ARGB}, {@code #RRGGBB} and {@code #AARRGGBB}. */
    public static Optional<Long> parseColor(String hex) {
        if (hex == null) return Optional.empty();
        String h = hex.trim();
        if (!h.startsWith("#")) return Optional.empty();
        h = h.substring(1);
        try {
            switch (h.length()) {
                case 3:
                    return Optional.of(0xFF000000L | Long.parseLong(doubleDigits(h), 16));
                case 4:
                    return Optional.of(Long.parseLong(doubleDigits(h), 16));
                case 6:
                    return Optional.of(0xFF000000L | Long.parseLong(h, 16));
                case 8:
                    return Optional.of(Long.parseLong(h, 16));
                default:
                    return Optional.empty();
            }
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static String doubleDigits(String h) {
        StringBuilder sb = new StringBuilder();
        for (char c : h.toCharArray()) sb.append(c).append(c);
        return sb.toString();
    }

    /**
     * Parses {@code 16dp}, {@code 14sp}, {@code 2px}, {@code 1.5dip}, {@code 3pt}; a bare number
     * is taken as logical pixels. Points are converted at 160/72 dp per pt.
     */
    public static Optional<Double> parseDimension(String raw) {
        if (raw == null) return Optional.empty();
        String v = raw.trim().toLowerCase(Locale.ROOT);
        double factor = 1.0;
        for (String unit : new String[]{"dip", "dp", "sp", "px", "pt"}) {
            if (v.endsWith(unit)) {
                v = v.substring(0, v.length() - unit.length()).trim();
                if (unit.equals("pt")) factor = 160.0 / 72.0;
                break;
            }
        }
        try {
            return Optional.of(Double.parseDouble(v) * factor);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /** Undoes Android string escaping ({@code \'}, {@code \"}, {@code \n}). */
    static String unescapeAndroid(String s) {
        if (s.indexOf('\\') < 0) return s;
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' && i + 1 < s.length()) {
                char n = s.charAt(++i);
                switch (n) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    default -> sb.append(n);
                }
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
