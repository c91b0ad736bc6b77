package info.isaksson.erland.androidtoflutter.translate;

import java.util.Map;

/** Java declared types to Dart declaration types. */
public final class TypeMapper {

    private static final Map<String, String> TYPES = Map.ofEntries(
            Map.entry("int", "int"),
            Map.entry("long", "int"),
            Map.entry("short", "int"),
            Map.entry("byte", "int"),
            Map.entry("Integer", "int"),
            Map.entry("Long", "int"),
            Map.entry("Short", "int"),
            Map.entry("Byte", "int"),
            Map.entry("float", "double"),
            Map.entry("double", "double"),
            Map.entry("Float", "double"),
            Map.entry("Double", "double"),
            Map.entry("boolean", "bool"),
            Map.entry("Boolean", "bool"),
            Map.entry("String", "String"),
            Map.entry("CharSequence", "String"),
            Map.entry("char", "String"),
            Map.entry("Character", "String")
    );

    private TypeMapper() {}

    /** Dart type for a local declaration; {@code var} when there is no direct counterpart. */
    public static String declarationType(String javaType) {
        String mapped = TYPES.get(strip(javaType));
        return mapped == null ? "var" : mapped;
    }

    /** Dart type for a method parameter; {@code dynamic} when there is no direct counterpart. */
    public static String parameterType(String javaType) {
        String mapped = TYPES.get(strip(javaType));
        return mapped == null ? "dynamic" : mapped;
    }

    private static String strip(String javaType) {
        if (javaType == null) return "";
        String t = javaType.trim();
        if (t.startsWith("final ")) t = t.substring("final ".length()).trim();
        if (t.startsWith("java.lang.")) t = t.substring("java.lang.".length());
        return t;
    }
}
