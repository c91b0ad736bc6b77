package info.isaksson.erland.androidtoflutter;

import info.isaksson.erland.androidtoflutter.core.AndroidToFlutterService;
import info.isaksson.erland.androidtoflutter.core.ConversionOptions;
import info.isaksson.erland.androidtoflutter.core.ConversionResult;
import info.isaksson.erland.androidtoflutter.core.ScreenResult;
import info.isaksson.erland.androidtoflutter.ir.ScreenJson;
import info.isaksson.erland.androidtoflutter.report.ReportGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * CLI entrypoint: translates the layouts and Activity classes of an Android module into Dart
 * widget files, plus a markdown report and optional JSON snapshots.
 */
public final class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    private static final AndroidToFlutterService SERVICE = new AndroidToFlutterService();

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Testable entrypoint that returns an exit code instead of calling System.exit.
     */
    public static int run(String[] args) {
        CliArgs parsed;
        try {
            parsed = CliArgs.parse(args);
        } catch (IllegalArgumentException ex) {
            System.err.println("Error: " + ex.getMessage());
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        if (parsed.help) {
            CliArgs.printHelp();
            return 0;
        }

        if (parsed.project == null && parsed.res == null) {
            System.err.println("Error: --project or --res is required.");
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        final Path resDir = resolveResDir(parsed);
        final Path javaDir = resolveJavaDir(parsed);
        if (!Files.isDirectory(resDir)) {
            System.err.println("Error: resource directory does not exist: " + resDir);
            return 1;
        }
        if (parsed.java != null && !Files.isDirectory(javaDir)) {
            System.err.println("Error: --java must be a directory: " + javaDir);
            return 1;
        }

        final Path outDir = Paths.get(parsed.output).toAbsolutePath().normalize();
        final Path reportOut = parsed.report != null
                ? Paths.get(parsed.report).toAbsolutePath().normalize()
                : outDir.resolve("report.md");
        try {
            Files.createDirectories(outDir);
            Files.createDirectories(reportOut.getParent());
        } catch (IOException e) {
            System.err.println("Error: could not create output directory.");
            System.err.println(e.getMessage());
            return 2;
        }

        final ConversionResult res;
        try {
            res = SERVICE.convert(resDir, javaDir, toCoreOptions(parsed));
        } catch (RuntimeException | IOException e) {
            System.err.println("Error: conversion failed.");
            System.err.println(e.getMessage());
            return 2;
        }

        final List<Path> written = new ArrayList<>();
        try {
            for (ScreenResult s : res.screens) {
                if (s.failed()) continue;
                Path file = outDir.resolve(s.fileName);
                Files.writeString(file, s.dartCode, StandardCharsets.UTF_8);
                written.add(file);
                log.debug("Wrote {}", file);
            }
        } catch (IOException e) {
            System.err.println("Error: could not write Dart files to: " + outDir);
            System.err.println(e.getMessage());
            return 2;
        }

        // Optional: per-screen JSON snapshots
        if (parsed.writeIr != null) {
            final Path irDir = Paths.get(parsed.writeIr).toAbsolutePath().normalize();
            try {
                for (ScreenResult s : res.screens) {
                    ScreenJson.write(s.snapshot(), irDir.resolve(snapshotName(s.fileName)));
                }
            } catch (IOException e) {
                System.err.println("Error: could not write snapshots to: " + irDir);
                System.err.println(e.getMessage());
                return 2;
            }
        }

        try {
            ReportGenerator.writeMarkdown(reportOut, resDir, javaDir, outDir, res,
                    parsed.includeTests, parsed.excludes, parsed.failOnUntranslated);
        } catch (IOException e) {
            System.err.println("Error: could not write report to: " + reportOut);
            System.err.println(e.getMessage());
            return 2;
        }

        // Exit code rules
        if (parsed.failOnUntranslated && res.untranslatedCount() > 0) {
            System.err.println("Untranslated statements present (" + res.untranslatedCount()
                    + ") and --fail-on-untranslated is set.");
            System.err.println("See report: " + reportOut);
            return 3;
        }

        System.out.println(
                "android-to-flutter\n" +
                "- Resources: " + resDir + "\n" +
                "- Java: " + (javaDir == null ? "(none)" : javaDir) + "\n" +
                "- Output: " + outDir + "\n" +
                "- Report: " + reportOut + "\n" +
                "- Screens: " + res.screens.size() + " (" + res.failedCount() + " failed)\n" +
                "- Dart files: " + written.size() + "\n" +
                "- Parse errors: " + res.parseErrors.size() + "\n" +
                "- Warnings: " + res.warningCount() + "\n" +
                "- Untranslated statements: " + res.untranslatedCount()
        );
        return 0;
    }

    private static ConversionOptions toCoreOptions(CliArgs parsed) {
        ConversionOptions o = new ConversionOptions();
        o.includeTests = parsed.includeTests;
        o.excludeGlobs = new ArrayList<>(parsed.excludes);
        o.layouts = new ArrayList<>(parsed.layouts);
        if (parsed.threads != null) o.threads = parsed.threads;
        o.failOnUntranslated = parsed.failOnUntranslated;
        return o;
    }

    static Path resolveResDir(CliArgs parsed) {
        if (parsed.res != null) return Paths.get(parsed.res).toAbsolutePath().normalize();
        return Paths.get(parsed.project).toAbsolutePath().normalize().resolve("src/main/res");
    }

    /** Null when no Java sources are available; layouts are then translated alone. */
    static Path resolveJavaDir(CliArgs parsed) {
        if (parsed.java != null) return Paths.get(parsed.java).toAbsolutePath().normalize();
        if (parsed.project == null) return null;
        Path p = Paths.get(parsed.project).toAbsolutePath().normalize().resolve("src/main/java");
        return Files.isDirectory(p) ? p : null;
    }

    static String snapshotName(String dartFileName) {
        int idx = dartFileName.lastIndexOf('.');
        String base = idx <= 0 ? dartFileName : dartFileName.substring(0, idx);
        return base + ".screen.json";
    }

    /** Minimal CLI argument parsing without external dependencies. */
    static final class CliArgs {
        boolean help = false;
        String project;
        String res;
        String java;
        String output = "./output";
        String report;
        String writeIr;
        Integer threads;
        boolean includeTests = false;
        boolean failOnUntranslated = false;
        final List<String> layouts = new ArrayList<>();
        final List<String> excludes = new ArrayList<>();

        static CliArgs parse(String[] args) {
            CliArgs out = new CliArgs();

            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                if (a == null) continue;

                // support --exclude=glob
                if (a.startsWith("--exclude=")) {
                    out.excludes.add(a.substring("--exclude=".length()));
                    continue;
                }

                switch (a) {
                    case "--help":
                    case "-h":
                        out.help = true;
                        break;
                    case "--project":
                        out.project = requireValue(args, ++i, "--project");
                        break;
                    case "--res":
                        out.res = requireValue(args, ++i, "--res");
                        break;
                    case "--java":
                        out.java = requireValue(args, ++i, "--java");
                        break;
                    case "--output":
                        out.output = requireValue(args, ++i, "--output");
                        break;
                    case "--layout":
                        out.layouts.add(requireValue(args, ++i, "--layout"));
                        break;
                    case "--report":
                        out.report = requireValue(args, ++i, "--report");
                        break;
                    case "--write-ir":
                        out.writeIr = requireValue(args, ++i, "--write-ir");
                        break;
                    case "--threads":
                        out.threads = parsePositiveInt(requireValue(args, ++i, "--threads"), "--threads");
                        break;
                    case "--fail-on-untranslated":
                        out.failOnUntranslated = parseBoolean(requireValue(args, ++i, "--fail-on-untranslated"), "--fail-on-untranslated");
                        break;
                    case "--exclude":
                        out.excludes.add(requireValue(args, ++i, "--exclude"));
                        break;
                    case "--include-tests":
                        out.includeTests = true;
                        break;
                    default:
                        if (a.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown argument: " + a);
                        }
                        // allow a bare path as shorthand for --project
                        if (out.project == null) {
                            out.project = a;
                        } else {
                            throw new IllegalArgumentException("Unexpected extra argument: " + a);
                        }
                }
            }

            return out;
        }

        static String requireValue(String[] args, int index, String flag) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            String v = args[index];
            if (v == null || v.isBlank() || v.startsWith("--")) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + v);
            }
            return v;
        }

        static boolean parseBoolean(String v, String flag) {
            if (v == null) throw new IllegalArgumentException("Missing value for " + flag);
            String s = v.trim().toLowerCase();
            if (s.equals("true") || s.equals("1") || s.equals("yes")) return true;
            if (s.equals("false") || s.equals("0") || s.equals("no")) return false;
            throw new IllegalArgumentException("Invalid boolean for " + flag + ": " + v);
        }

        static int parsePositiveInt(String v, String flag) {
            int n;
            try {
                n = Integer.parseInt(v.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid number for " + flag + ": " + v);
            }
            if (n < 1) throw new IllegalArgumentException(flag + " must be at least 1: " + v);
            return n;
        }

        static void printHelp() {
            System.out.println(
                    "android-to-flutter\n" +
                    "\n" +
                    "Usage:\n" +
                    "  java -jar android-to-flutter.jar --project <dir> [--output <dir>] [options]\n" +
                    "  java -jar android-to-flutter.jar --res <dir> [--java <dir>] [--output <dir>] [options]\n" +
                    "\n" +
                    "Options:\n" +
                    "  --project <dir>        Android module root; uses src/main/res and src/main/java\n" +
                    "  --res <dir>            Resource directory (overrides --project)\n" +
                    "  --java <dir>           Java source root (overrides --project)\n" +
                    "  --output <dir>         Output folder for Dart files (default: ./output)\n" +
                    "  --layout <id>          Translate only this layout (repeatable). Default: every\n" +
                    "                         screen discovered through setContentView/inflate.\n" +
                    "  --exclude <glob>       Exclude Java paths matching glob (repeatable), relative to\n" +
                    "                         the Java source root. Also supports --exclude=<glob>.\n" +
                    "  --include-tests        Include common test folders (default: excluded)\n" +
                    "  --threads <n>          Worker threads (default: available processors)\n" +
                    "  --write-ir <dir>       Write one JSON snapshot per screen into <dir>\n" +
                    "  --report <file>        Markdown report path (default: <output>/report.md)\n" +
                    "  --fail-on-untranslated <bool>  Exit with code 3 when any statement could not\n" +
                    "                         be translated. Default: false.\n" +
                    "  -h, --help             Show help\n" +
                    "\n" +
                    "Exit codes: 0 success, 1 usage error, 2 I/O error, 3 untranslated statements.\n" +
                    "\n" +
                    "Examples:\n" +
                    "  java -jar target/android-to-flutter.jar --project samples/mini --output out\n" +
                    "  java -jar target/android-to-flutter.jar samples/mini --layout activity_login\n"
            );
        }
    }
}
