package info.isaksson.erland.androidtoflutter;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CliArgsTest {

    @Test
    void parsesEveryFlag() {
        Main.CliArgs a = Main.CliArgs.parse(new String[] {
                "--project", "app",
                "--res", "app/res",
                "--java", "app/java",
                "--output", "out",
                "--layout", "activity_login",
                "--layout", "activity_home",
                "--exclude", "**/generated/**",
                "--exclude=**/*Test.java",
                "--include-tests",
                "--threads", "3",
                "--write-ir", "ir",
                "--report", "out/r.md",
                "--fail-on-untranslated", "yes"
        });

        assertEquals("app", a.project);
        assertEquals("app/res", a.res);
        assertEquals("app/java", a.java);
        assertEquals("out", a.output);
        assertEquals(List.of("activity_login", "activity_home"), a.layouts);
        assertEquals(List.of("**/generated/**", "**/*Test.java"), a.excludes);
        assertTrue(a.includeTests);
        assertEquals(3, a.threads);
        assertEquals("ir", a.writeIr);
        assertEquals("out/r.md", a.report);
        assertTrue(a.failOnUntranslated);
        assertFalse(a.help);
    }

    @Test
    void defaultsAndBareProjectPath() {
        Main.CliArgs a = Main.CliArgs.parse(new String[] {"samples/mini"});

        assertEquals("samples/mini", a.project);
        assertEquals("./output", a.output);
        assertNull(a.threads);
        assertNull(a.report);
        assertFalse(a.failOnUntranslated);
        assertTrue(a.layouts.isEmpty());
    }

    @Test
    void projectDirectoryExpandsToConventionalFolders() {
        Main.CliArgs a = Main.CliArgs.parse(new String[] {"--project", "app"});
        Path root = Path.of("app").toAbsolutePath().normalize();

        assertEquals(root.resolve("src/main/res"), Main.resolveResDir(a));
        // app/src/main/java does not exist here
        assertNull(Main.resolveJavaDir(a));

        Main.CliArgs explicit = Main.CliArgs.parse(new String[] {"--res", "r", "--java", "j"});
        assertEquals(Path.of("r").toAbsolutePath().normalize(), Main.resolveResDir(explicit));
        assertEquals(Path.of("j").toAbsolutePath().normalize(), Main.resolveJavaDir(explicit));
    }

    @Test
    void rejectsInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--bogus"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--output"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--layout", "--threads"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--threads", "0"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--threads", "many"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--fail-on-untranslated", "maybe"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"a", "b"}));
    }

    @Test
    void snapshotNamesFollowDartFileNames() {
        assertEquals("converted_login.screen.json", Main.snapshotName("converted_login.dart"));
        assertEquals("plain.screen.json", Main.snapshotName("plain"));
    }
}
