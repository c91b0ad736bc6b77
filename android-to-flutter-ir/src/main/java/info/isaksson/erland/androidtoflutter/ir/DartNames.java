package info.isaksson.erland.androidtoflutter.ir;

import java.util.Locale;

/**
 * Naming conventions shared by the widget mapper, the statement translator and the emitter,
 * so that a view id always yields the same handler, controller and state field names.
 */
public final class DartNames {

    private DartNames() {}

    /** {@code login_button} → {@code loginButton}. */
    public static String camel(String raw) {
        String p = pascal(raw);
        if (p.isEmpty()) return p;
        return Character.toLowerCase(p.charAt(0)) + p.substring(1);
    }

    /** {@code login_button} → {@code LoginButton}; non-identifier characters split words. */
    public static String pascal(String raw) {
        if (raw == null) return "";
        StringBuilder sb = new StringBuilder();
        boolean upper = true;
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (!Character.isLetterOrDigit(c)) {
                upper = true;
                continue;
            }
            sb.append(upper ? Character.toUpperCase(c) : c);
            upper = false;
        }
        if (sb.length() > 0 && Character.isDigit(sb.charAt(0))) sb.insert(0, 'V');
        return sb.toString();
    }

    /** Stub click handler for a view without an extracted listener. */
    public static String handlerName(String viewId) {
        return "_on" + pascal(viewId) + "Pressed";
    }

    /** Dart method translated from the Java method {@code javaMethod}. */
    public static String methodName(String javaMethod) {
        return "_" + camel(javaMethod);
    }

    public static String controllerName(String viewId) {
        return "_" + camel(viewId) + "Controller";
    }

    /** State field for a toggled view property, e.g. {@code _statusText}. */
    public static String stateField(String viewId, String suffix) {
        return "_" + camel(viewId) + suffix;
    }

    /** {@code LoginActivity} → {@code ConvertedLogin}. */
    public static String screenClassName(String activityClass) {
        String base = activityClass == null ? "" : activityClass;
        int dot = base.lastIndexOf('.');
        if (dot >= 0) base = base.substring(dot + 1);
        if (base.endsWith("Activity")) base = base.substring(0, base.length() - "Activity".length());
        base = pascal(base);
        return "Converted" + (base.isEmpty() ? "Screen" : base);
    }

    /** Screen name for a layout translated without an owning class. */
    public static String screenNameForLayout(String layoutId) {
        String p = pascal(layoutId);
        return "Converted" + (p.isEmpty() ? "Screen" : p);
    }

    /** Dart file name for a screen class, {@code ConvertedLogin} → {@code converted_login.dart}. */
    public static String fileName(String screenClass) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < screenClass.length(); i++) {
            char c = screenClass.charAt(i);
            if (Character.isUpperCase(c) && i > 0) sb.append('_');
            sb.append(Character.toLowerCase(c));
        }
        return sb.toString().toLowerCase(Locale.ROOT) + ".dart";
    }

    public static String imageAsset(String resourceName) {
        return "assets/images/" + resourceName + ".png";
    }
}
