package info.isaksson.erland.androidtoflutter;

import info.isaksson.erland.androidtoflutter.ir.ScreenJson;
import info.isaksson.erland.androidtoflutter.ir.ScreenSnapshot;
import info.isaksson.erland.androidtoflutter.testutil.TestPaths;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class MainSmokeTest {

    @TempDir
    Path tmp;

    @Test
    void convertsSampleProject() throws Exception {
        Path outDir = tmp.resolve("out");
        Path irDir = tmp.resolve("ir");

        int code = Main.run(new String[] {
                "--project", TestPaths.samplesMini().toString(),
                "--output", outDir.toString(),
                "--write-ir", irDir.toString(),
                "--threads", "2"
        });
        assertEquals(0, code);

        Path login = outDir.resolve("converted_login.dart");
        Path home = outDir.resolve("converted_home.dart");
        assertTrue(Files.exists(login), "Dart file must be written: " + login);
        assertTrue(Files.exists(home), "Dart file must be written: " + home);

        String dart = Files.readString(login);
        assertTrue(dart.contains("import 'package:flutter/material.dart';"));
        assertTrue(dart.contains("class ConvertedLogin extends StatefulWidget {"), dart);
        assertTrue(dart.contains("obscureText: true"), dart);
        // long argument lists are broken one argument per line
        assertTrue(dart.replaceAll("\\(\\s+", "(").contains("Text('Mini Notes',"), dart);
        assertTrue(dart.contains("_onLoginButtonPressed"), dart);
        assertTrue(dart.contains("_openForgotPassword"), dart);
        assertTrue(dart.contains("Navigator.push("), dart);

        String homeDart = Files.readString(home);
        assertTrue(homeDart.contains("CustomPaint("), homeDart);
        assertTrue(homeDart.contains("showDialog("), homeDart);

        String report = Files.readString(outDir.resolve("report.md"));
        assertTrue(report.contains("# android-to-flutter report"));
        assertTrue(report.contains("## Screens"));
        assertTrue(report.contains("`ConvertedLogin`"), report);
        assertTrue(report.contains("navigates to `HomeActivity`"), report);

        ScreenSnapshot snapshot = ScreenJson.read(irDir.resolve("converted_login.screen.json"));
        assertEquals("ConvertedLogin", snapshot.screenName);
        assertEquals("activity_login", snapshot.layoutId);
        assertEquals("LoginActivity", snapshot.className);
        assertNotNull(snapshot.widgetTree);
    }

    @Test
    void layoutFlagTranslatesOnlyThatLayout() throws Exception {
        Path outDir = tmp.resolve("out");

        int code = Main.run(new String[] {
                TestPaths.samplesMini().toString(),
                "--output", outDir.toString(),
                "--layout", "view_profile_card"
        });
        assertEquals(0, code);

        try (Stream<Path> s = Files.list(outDir)) {
            assertEquals("converted_view_profile_card.dart,report.md",
                    s.map(p -> p.getFileName().toString()).sorted().collect(Collectors.joining(",")));
        }
        assertTrue(Files.readString(outDir.resolve("converted_view_profile_card.dart")).contains("Card("));
    }

    @Test
    void failOnUntranslatedReturnsThree() throws Exception {
        Path project = tmp.resolve("app");
        Path layout = Files.createDirectories(project.resolve("src/main/res/layout"));
        Path pkg = Files.createDirectories(project.resolve("src/main/java/com/example"));
        Files.writeString(layout.resolve("activity_main.xml"), """
                <LinearLayout xmlns:android="http://schemas.android.com/apk/res/android"
                    android:orientation="vertical">
                    <Button android:id="@+id/track" android:text="Track" />
                </LinearLayout>
                """);
        Files.writeString(pkg.resolve("MainActivity.java"), """
                package com.example;

                public class MainActivity extends AppCompatActivity {
                    @Override
                    protected void onCreate(Bundle state) {
                        super.onCreate(state);
                        setContentView(R.layout.activity_main);
                        findViewById(R.id.track).setOnClickListener(v -> analytics.track("tap"));
                    }
                }
                """);
        Path outDir = tmp.resolve("out");

        assertEquals(0, Main.run(new String[] {"--project", project.toString(), "--output", outDir.toString()}));
        assertTrue(Files.readString(outDir.resolve("converted_main.dart")).contains("// untranslated: analytics.track(\"tap\")"));

        int code = Main.run(new String[] {
                "--project", project.toString(),
                "--output", outDir.toString(),
                "--fail-on-untranslated", "true"
        });
        assertEquals(3, code);
        assertTrue(Files.readString(outDir.resolve("report.md")).contains("## Untranslated statements"));
    }

    @Test
    void usageErrorsReturnOne() {
        assertEquals(1, Main.run(new String[] {}));
        assertEquals(1, Main.run(new String[] {"--unknown"}));
        assertEquals(1, Main.run(new String[] {"--project", tmp.resolve("missing").toString(),
                "--output", tmp.resolve("out").toString()}));
        assertEquals(0, Main.run(new String[] {"--help"}));
    }
}
