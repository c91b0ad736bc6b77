package info.isaksson.erland.androidtoflutter.io;

import java.io.IOException;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Deterministic discovery of Android source files with exclude rules.
 *
 * <p>Results are sorted by their path relative to the scanned root, using '/' separators.</p>
 */
public final class SourceScanner {

    public static final String JAVA = ".java";
    public static final String XML = ".xml";

    private SourceScanner() {}

    /** Java sources under {@code sourceRoot}. */
    public static List<Path> scan(Path sourceRoot, List<String> excludeGlobs, boolean includeTests) throws IOException {
        return scan(sourceRoot, JAVA, excludeGlobs, includeTests);
    }

    /**
     * Scan for files ending in {@code extension} under {@code sourceRoot}.
     *
     * @param excludeGlobs glob patterns matched against the relative path; a pattern without
     *                     wildcards excludes everything below that directory
     * @param includeTests whether to descend into {@code test}, {@code androidTest} and similar folders
     */
    public static List<Path> scan(Path sourceRoot, String extension, List<String> excludeGlobs, boolean includeTests)
            throws IOException {
        Objects.requireNonNull(sourceRoot, "sourceRoot");
        Objects.requireNonNull(extension, "extension");
        if (!Files.isDirectory(sourceRoot)) return List.of();

        final String suffix = extension.toLowerCase(Locale.ROOT);
        final List<Predicate<String>> excludes = compileExcludeMatchers(excludeGlobs);

        try (Stream<Path> stream = Files.walk(sourceRoot)) {
            List<Path> out = new ArrayList<>();
            stream
                .filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(suffix))
                .filter(p -> {
                    String rel = normalizeRel(sourceRoot, p);
                    return (includeTests || !looksLikeTestPath(rel))
                            && !isGeneratedOrBuildDir(rel)
                            && !matchesAny(rel, excludes);
                })
                .forEach(out::add);

            out.sort(Comparator.comparing(p -> normalizeRel(sourceRoot, p)));
            return out;
        }
    }

    /** Path of {@code file} relative to {@code root} with '/' separators; the file itself when not below root. */
    public static String relativeName(Path root, Path file) {
        try {
            return normalizeRel(root, file);
        } catch (IllegalArgumentException e) {
            return file.toString().replace('\\', '/');
        }
    }

    private static boolean matchesAny(String rel, List<Predicate<String>> matchers) {
        for (Predicate<String> m : matchers) {
            if (m.test(rel)) return true;
        }
        return false;
    }

    private static List<Predicate<String>> compileExcludeMatchers(List<String> excludeGlobs) {
        if (excludeGlobs == null || excludeGlobs.isEmpty()) return Collections.emptyList();

        FileSystem fs = FileSystems.getDefault();
        List<Predicate<String>> out = new ArrayList<>();
        for (String raw : excludeGlobs) {
            if (raw == null || raw.isBlank()) continue;
            String pattern = raw.trim().replace("\\", "/");
            if (!pattern.contains("*") && !pattern.contains("?") && !pattern.contains("[") && !pattern.endsWith("/")) {
                pattern = pattern + "/**";
            }
            final var matcher = fs.getPathMatcher("glob:" + pattern);
            out.add(rel -> matcher.matches(Path.of(rel)));
        }
        return out;
    }

    private static boolean looksLikeTestPath(String rel) {
        return rel.startsWith("src/test/")
                || rel.startsWith("src/androidTest/")
                || rel.startsWith("test/")
                || rel.startsWith("androidTest/")
                || rel.contains("/test/")
                || rel.contains("/androidTest/");
    }

    private static boolean isGeneratedOrBuildDir(String rel) {
        return rel.startsWith("build/")
                || rel.contains("/build/")
                || rel.startsWith("target/")
                || rel.startsWith("generated/")
                || rel.contains("/generated/")
                || rel.startsWith(".git/")
                || rel.startsWith(".gradle/")
                || rel.startsWith(".idea/");
    }

    private static String normalizeRel(Path root, Path p) {
        return root.relativize(p).toString().replace("\\", "/");
    }
}
