package info.isaksson.erland.androidtoflutter.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Options for a conversion run.
 *
 * <p>Mirrors the CLI flags in a structured form.</p>
 */
public final class ConversionOptions {

    /** Also scan {@code src/test} style directories for Java sources. */
    public boolean includeTests = false;

    /** Glob patterns, relative to the Java source root, of files to skip. */
    public List<String> excludeGlobs = new ArrayList<>();

    /** Worker threads used by {@link AndroidToFlutterService#translateAll}. */
    public int threads = Runtime.getRuntime().availableProcessors();

    /**
     * Layout ids to translate. Empty means every discovered screen, or every layout when no
     * screen class was found.
     */
    public List<String> layouts = new ArrayList<>();

    /**
     * If true, callers may treat untranslated statements as an error condition.
     * (The service never throws for them.)
     */
    public boolean failOnUntranslated = false;
}
