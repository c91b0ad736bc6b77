package info.isaksson.erland.androidtoflutter.report;

import info.isaksson.erland.androidtoflutter.core.AndroidToFlutterService;
import info.isaksson.erland.androidtoflutter.core.ConversionOptions;
import info.isaksson.erland.androidtoflutter.core.ConversionResult;
import info.isaksson.erland.androidtoflutter.core.ProjectContext;
import info.isaksson.erland.androidtoflutter.testutil.TestPaths;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ReportGeneratorTest {

    @Test
    void writesMarkdownWithExpectedSections(@TempDir Path tmp) throws Exception {
        Path res = TestPaths.samplesMini().resolve("src/main/res");
        Path java = TestPaths.samplesMini().resolve("src/main/java");
        ConversionResult result = new AndroidToFlutterService().convert(res, java, new ConversionOptions());

        Path reportOut = tmp.resolve("report.md");
        ReportGenerator.writeMarkdown(reportOut, res, java, tmp, result, false, List.of("**/gen/**"), true);

        String md = Files.readString(reportOut);
        assertTrue(md.contains("# android-to-flutter report"));
        assertTrue(md.contains("## Summary"));
        assertTrue(md.contains("- Screens: **2**"), md);
        assertTrue(md.contains("- Excludes: `**/gen/**`"), md);
        assertTrue(md.contains("- Fail on untranslated: **true**"), md);
        assertTrue(md.contains("| `ConvertedHome` | `activity_home` | `HomeActivity` | `converted_home.dart` |"), md);
        assertTrue(md.contains("## Behaviors"));
        assertTrue(md.contains("shows dialog \"Log out\""), md);
        assertTrue(md.contains("navigates to `ForgotPasswordActivity`"), md);
        assertTrue(md.contains("## Warnings by code"));
        assertTrue(md.contains("## Parse errors\n\n_(none)_"), md);
    }

    @Test
    void emptyRunStillHasEverySection(@TempDir Path tmp) throws Exception {
        AndroidToFlutterService service = new AndroidToFlutterService();
        ProjectContext ctx = service.loadProject(tmp, null, new ConversionOptions());
        ConversionResult empty = service.translateAll(ctx, List.of(), new ConversionOptions());

        String md = ReportGenerator.toMarkdown(Path.of("res"), null, Path.of("out"), empty, false, List.of(), false);

        assertTrue(md.contains("- Java: _(none)_"));
        assertTrue(md.contains("## Screens\n\n_(none)_"), md);
        assertTrue(md.contains("## Untranslated statements\n\n_(none)_"), md);
        assertTrue(md.contains("## Warnings by code\n\n_(none)_"), md);
    }
}
