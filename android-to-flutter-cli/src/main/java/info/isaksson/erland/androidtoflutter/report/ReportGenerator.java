package info.isaksson.erland.androidtoflutter.report;

import info.isaksson.erland.androidtoflutter.core.ConversionResult;
import info.isaksson.erland.androidtoflutter.core.ScreenResult;
import info.isaksson.erland.androidtoflutter.ir.Behavior;
import info.isaksson.erland.androidtoflutter.ir.ConversionWarning;
import info.isaksson.erland.androidtoflutter.ir.DialogSpec;
import info.isaksson.erland.androidtoflutter.ir.NavigationAction;
import info.isaksson.erland.androidtoflutter.ir.TranslatedHandler;
import info.isaksson.erland.androidtoflutter.ir.TransientMessage;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Human-readable markdown report of a conversion run.
 *
 * <p>Screens are listed in request order; warning tallies are sorted by code.</p>
 */
public final class ReportGenerator {

    private ReportGenerator() {}

    public static void writeMarkdown(Path reportPath,
                                     Path resDir,
                                     Path javaDir,
                                     Path outputDir,
                                     ConversionResult result,
                                     boolean includeTests,
                                     List<String> excludes,
                                     boolean failOnUntranslated) throws IOException {
        Files.writeString(reportPath,
                toMarkdown(resDir, javaDir, outputDir, result, includeTests, excludes, failOnUntranslated),
                StandardCharsets.UTF_8);
    }

    public static String toMarkdown(Path resDir,
                                    Path javaDir,
                                    Path outputDir,
                                    ConversionResult result,
                                    boolean includeTests,
                                    List<String> excludes,
                                    boolean failOnUntranslated) {
        StringBuilder report = new StringBuilder();
        report.append("# android-to-flutter report\n\n");

        report.append("## Summary\n\n");
        report.append("- Resources: `").append(resDir).append("`\n");
        report.append("- Java: ").append(javaDir == null ? "_(none)_" : "`" + javaDir + "`").append("\n");
        report.append("- Output: `").append(outputDir).append("`\n");
        report.append("- Screens: **").append(result.screens.size()).append("**\n");
        report.append("- Failed screens: **").append(result.failedCount()).append("**\n");
        report.append("- Parse errors: **").append(result.parseErrors.size()).append("**\n");
        report.append("- Warnings: **").append(result.warningCount()).append("**\n");
        report.append("- Untranslated statements: **").append(result.untranslatedCount()).append("**\n");
        report.append("- Include tests: **").append(includeTests).append("**\n");
        report.append("- Fail on untranslated: **").append(failOnUntranslated).append("**\n");
        List<String> ex = excludes == null ? List.of() : excludes;
        report.append("- Excludes: ").append(ex.isEmpty() ? "_(none)_" : "`" + String.join("`, `", ex) + "`").append("\n\n");

        report.append("## Screens\n\n");
        if (result.screens.isEmpty()) {
            report.append("_(none)_\n");
        } else {
            report.append("| Screen | Layout | Class | File | Handlers | Untranslated | Warnings |\n");
            report.append("|---|---|---|---|---:|---:|---:|\n");
            for (ScreenResult s : result.screens) {
                report.append("| `").append(s.screenName).append("` | `")
                        .append(s.request.layoutId()).append("` | ")
                        .append(s.request.className() == null ? "_(none)_" : "`" + s.request.className() + "`").append(" | ")
                        .append(s.failed() ? "_(failed)_" : "`" + s.fileName + "`").append(" | ")
                        .append(s.failed() ? 0 : s.model.handlers.size()).append(" | ")
                        .append(s.untranslatedCount).append(" | ")
                        .append(s.warnings.size()).append(" |\n");
            }
        }

        report.append("\n## Behaviors\n\n");
        boolean anyBehavior = false;
        for (ScreenResult s : result.screens) {
            if (s.failed()) continue;
            for (var e : s.model.bindings.entries.entrySet()) {
                for (Behavior b : e.getValue()) {
                    String line = describe(b);
                    if (line == null) continue;
                    anyBehavior = true;
                    report.append("- `").append(s.screenName).append("` / `").append(e.getKey()).append("`: ")
                            .append(line).append("\n");
                }
            }
        }
        if (!anyBehavior) report.append("_(none)_\n");

        report.append("\n## Untranslated statements\n\n");
        boolean anyUntranslated = false;
        for (ScreenResult s : result.screens) {
            if (s.failed()) continue;
            for (TranslatedHandler h : s.model.handlers) {
                if (h.untranslated() == 0) continue;
                anyUntranslated = true;
                report.append("- `").append(s.screenName).append("#").append(h.name()).append("`: ")
                        .append(h.untranslated())
                        .append(h.sourceMethod() == null ? "" : " (from `" + h.sourceMethod() + "`)")
                        .append("\n");
            }
        }
        if (!anyUntranslated) report.append("_(none)_\n");

        report.append("\n## Warnings by code\n\n");
        Map<String, Integer> byCode = new TreeMap<>();
        for (ScreenResult s : result.screens) {
            for (ConversionWarning w : s.warnings) byCode.merge(w.code, 1, Integer::sum);
        }
        if (byCode.isEmpty()) {
            report.append("_(none)_\n");
        } else {
            report.append("| Code | Count |\n");
            report.append("|---|---:|\n");
            for (var e : byCode.entrySet()) {
                report.append("| `").append(e.getKey()).append("` | ").append(e.getValue()).append(" |\n");
            }
            report.append("\n");
            for (ScreenResult s : result.screens) {
                if (s.warnings.isEmpty()) continue;
                report.append("### ").append(s.screenName).append("\n\n");
                for (ConversionWarning w : s.warnings) {
                    report.append("- ").append(w).append("\n");
                }
                report.append("\n");
            }
        }

        report.append("\n## Parse errors\n\n");
        if (result.parseErrors.isEmpty()) {
            report.append("_(none)_\n");
        } else {
            for (String pe : result.parseErrors) {
                report.append("- ").append(pe).append("\n");
            }
        }
        return report.toString();
    }

    private static String describe(Behavior b) {
        if (b instanceof NavigationAction nav) {
            return "navigates to `" + nav.targetScreenName() + "`";
        }
        if (b instanceof DialogSpec dialog) {
            return "shows dialog" + (dialog.title() == null ? "" : " \"" + dialog.title() + "\"");
        }
        if (b instanceof TransientMessage msg) {
            return "shows message" + (msg.text() == null ? "" : " \"" + msg.text() + "\"");
        }
        return null;
    }
}
