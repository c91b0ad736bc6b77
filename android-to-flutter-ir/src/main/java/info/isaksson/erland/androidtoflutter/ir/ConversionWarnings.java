package info.isaksson.erland.androidtoflutter.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects warnings while one screen is translated. Not thread-safe; each screen owns its own
 * instance.
 *
 * <p>Final output is sorted by (code, message, contextString).</p>
 */
public final class ConversionWarnings {

    public static final String PARSE_ERROR = "PARSE_ERROR";
    public static final String UNRESOLVED_INCLUDE = "UNRESOLVED_INCLUDE";
    public static final String INCLUDE_CYCLE = "INCLUDE_CYCLE";
    public static final String EMPTY_VIEW_STUB = "EMPTY_VIEW_STUB";
    public static final String RELATIVE_REF_DROPPED = "RELATIVE_REF_DROPPED";
    public static final String RELATIVE_CYCLE = "RELATIVE_CYCLE";
    public static final String CONSTRAINT_DROPPED = "CONSTRAINT_DROPPED";
    public static final String UNKNOWN_TAG = "UNKNOWN_TAG";
    public static final String INFLATE_CYCLE = "INFLATE_CYCLE";
    public static final String UNRESOLVED_RESOURCE = "UNRESOLVED_RESOURCE";
    public static final String UNTRANSLATED_STATEMENT = "UNTRANSLATED_STATEMENT";
    public static final String UNRESOLVED_HANDLER = "UNRESOLVED_HANDLER";
    public static final String SCREEN_FAILED = "SCREEN_FAILED";

    private final List<ConversionWarning> warnings = new ArrayList<>();

    public void warn(String code, String message) {
        warn(code, message, null);
    }

    public void warn(String code, String message, Map<String, String> context) {
        warnings.add(new ConversionWarning(code, message, context == null ? Collections.emptyMap() : context));
    }

    public void warn(String code, String message, String k1, String v1) {
        Map<String, String> ctx = new LinkedHashMap<>();
        ctx.put(k1, String.valueOf(v1));
        warn(code, message, ctx);
    }

    public void warn(String code, String message, String k1, String v1, String k2, String v2) {
        Map<String, String> ctx = new LinkedHashMap<>();
        ctx.put(k1, String.valueOf(v1));
        ctx.put(k2, String.valueOf(v2));
        warn(code, message, ctx);
    }

    public void addAll(List<ConversionWarning> other) {
        if (other != null) warnings.addAll(other);
    }

    public int size() {
        return warnings.size();
    }

    public long count(String code) {
        return warnings.stream().filter(w -> w.code.equals(code)).count();
    }

    public List<ConversionWarning> toDeterministicList() {
        List<ConversionWarning> out = new ArrayList<>(warnings);
        out.sort(Comparator
                .comparing((ConversionWarning w) -> w.code)
                .thenComparing(w -> w.message)
                .thenComparing(w -> contextString(w.context)));
        return Collections.unmodifiableList(out);
    }

    private static String contextString(Map<String, String> ctx) {
        if (ctx == null || ctx.isEmpty()) return "";
        List<String> keys = new ArrayList<>(ctx.keySet());
        keys.sort(String::compareTo);
        StringBuilder sb = new StringBuilder();
        for (String k : keys) {
            sb.append(k).append('=').append(ctx.get(k)).append(';');
        }
        return sb.toString();
    }
}
