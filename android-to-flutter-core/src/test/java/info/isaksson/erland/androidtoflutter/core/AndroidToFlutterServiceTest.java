package info.isaksson.erland.androidtoflutter.core;

import info.isaksson.erland.androidtoflutter.ir.ConversionWarnings;
import info.isaksson.erland.androidtoflutter.ir.ScreenJson;
import info.isaksson.erland.androidtoflutter.ir.ScreenSnapshot;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end translation of a small Android module: two activities, an included header,
 * a custom drawn view and one unparsable layout.
 */
public class AndroidToFlutterServiceTest {

    @TempDir
    Path root;

    private Path res;
    private Path java;

    private void writeProject() throws Exception {
        res = root.resolve("src/main/res");
        java = root.resolve("src/main/java");
        Path layout = Files.createDirectories(res.resolve("layout"));
        Path values = Files.createDirectories(res.resolve("values"));
        Path pkg = Files.createDirectories(java.resolve("com/example"));

        Files.writeString(values.resolve("strings.xml"), """
                <resources>
                    <string name="app_name">My App</string>
                    <string name="email_hint">Email</string>
                    <string name="login">Log in</string>
                </resources>
                """);

        Files.writeString(layout.resolve("header.xml"), """
                <TextView xmlns:android="http://schemas.android.com/apk/res/android"
                    android:id="@+id/title"
                    android:layout_width="match_parent"
                    android:layout_height="wrap_content"
                    android:text="@string/app_name" />
                """);

        Files.writeString(layout.resolve("activity_login.xml"), """
                <LinearLayout xmlns:android="http://schemas.android.com/apk/res/android"
                    android:layout_width="match_parent"
                    android:layout_height="match_parent"
                    android:orientation="vertical">
                    <include layout="@layout/header" />
                    <EditText
                        android:id="@+id/email_input"
                        android:layout_width="match_parent"
                        android:layout_height="wrap_content"
                        android:hint="@string/email_hint" />
                    <TextView
                        android:id="@+id/status_text"
                        android:layout_width="wrap_content"
                        android:layout_height="wrap_content"
                        android:text="Ready" />
                    <Button
                        android:id="@+id/login_button"
                        android:layout_width="wrap_content"
                        android:layout_height="wrap_content"
                        android:text="@string/login" />
                    <TextView
                        android:id="@+id/terms_link"
                        android:layout_width="wrap_content"
                        android:layout_height="wrap_content"
                        android:text="Terms"
                        android:onClick="openTerms" />
                </LinearLayout>
                """);

        Files.writeString(layout.resolve("activity_home.xml"), """
                <FrameLayout xmlns:android="http://schemas.android.com/apk/res/android"
                    android:layout_width="match_parent"
                    android:layout_height="match_parent">
                    <com.example.GaugeView
                        android:id="@+id/gauge"
                        android:layout_width="match_parent"
                        android:layout_height="200dp" />
                    <Button
                        android:id="@+id/logout"
                        android:layout_width="wrap_content"
                        android:layout_height="wrap_content"
                        android:text="Log out" />
                </FrameLayout>
                """);

        Files.writeString(layout.resolve("broken.xml"), "<LinearLayout>\n  <TextView>\n");

        Files.writeString(pkg.resolve("LoginActivity.java"), """
                package com.example;

                public class LoginActivity extends AppCompatActivity {
                    private EditText emailInput;
                    private TextView status;

                    @Override
                    protected void onCreate(Bundle savedInstanceState) {
                        super.onCreate(savedInstanceState);
                        setContentView(R.layout.activity_login);
                        emailInput = findViewById(R.id.email_input);
                        status = findViewById(R.id.status_text);
                        Button login = findViewById(R.id.login_button);
                        login.setOnClickListener(v -> {
                            if (emailInput.getText().toString().isEmpty()) {
                                status.setText("Email required");
                                return;
                            }
                            startActivity(new Intent(LoginActivity.this, HomeActivity.class));
                        });
                    }

                    public void openTerms(View v) {
                        Toast.makeText(this, "Terms", Toast.LENGTH_SHORT).show();
                    }
                }
                """);

        Files.writeString(pkg.resolve("HomeActivity.java"), """
                package com.example;

                public class HomeActivity extends AppCompatActivity {
                    @Override
                    protected void onCreate(Bundle savedInstanceState) {
                        super.onCreate(savedInstanceState);
                        setContentView(R.layout.activity_home);
                        findViewById(R.id.logout).setOnClickListener(v -> finish());
                    }
                }
                """);

        Files.writeString(pkg.resolve("GaugeView.java"), """
                package com.example;

                public class GaugeView extends View {
                    public GaugeView(Context context, AttributeSet attrs) {
                        super(context, attrs);
                    }

                    @Override
                    protected void onDraw(Canvas canvas) {
                        canvas.drawColor(0);
                    }
                }
                """);
    }

    private final AndroidToFlutterService service = new AndroidToFlutterService();

    @Test
    void loadProjectPairsScreensAndRecordsParseErrors() throws Exception {
        writeProject();
        ProjectContext ctx = service.loadProject(res, java, new ConversionOptions());

        assertEquals(List.of("HomeActivity", "LoginActivity"),
                ctx.pairings.stream().map(p -> p.className()).collect(Collectors.toList()));
        assertEquals(3, ctx.javaFiles.size());
        assertTrue(ctx.layouts.lookup("header").isPresent());
        assertTrue(ctx.layouts.lookup("broken").isEmpty());
        assertEquals(1, ctx.parseErrors.size(), ctx.parseErrors.toString());
        assertTrue(ctx.parseErrors.get(0).startsWith("layout/broken.xml"), ctx.parseErrors.get(0));
        assertEquals("My App", ctx.resources.text("@string/app_name").orElseThrow());
    }

    @Test
    void translatesDiscoveredScreensEndToEnd() throws Exception {
        writeProject();
        ConversionResult result = service.convert(res, java, new ConversionOptions());

        assertEquals(2, result.screens.size());
        assertEquals(0, result.failedCount());
        assertEquals(1, result.parseErrors.size());

        ScreenResult home = result.screens.get(0);
        assertEquals("ConvertedHome", home.screenName);
        assertEquals("converted_home.dart", home.fileName);
        assertTrue(home.dartCode.contains("CustomPaint("), home.dartCode);

        ScreenResult login = result.screens.get(1);
        assertEquals("ConvertedLogin", login.screenName);
        assertEquals("LoginActivity", login.request.className());
        String dart = login.dartCode;
        assertTrue(dart.startsWith("// Converted from layout activity_login and LoginActivity.\n"), dart);
        assertTrue(dart.contains("class ConvertedLogin extends StatefulWidget {"), dart);
        assertTrue(dart.contains("Text('My App')"), dart);
        assertTrue(dart.contains("_emailInputController"), dart);
        assertTrue(dart.contains("hintText: 'Email'"), dart);
        assertTrue(dart.contains("onPressed: () => _onLoginButtonPressed(context)"), dart);
        assertTrue(dart.contains("_openTerms(context)"), dart);
        assertTrue(dart.contains("Navigator.push("), dart);
        assertTrue(dart.contains("String _statusTextText = 'Ready';"), dart);
        assertEquals(0, login.untranslatedCount);
    }

    @Test
    void snapshotCarriesRenderedHandlerBodies() throws Exception {
        writeProject();
        ConversionResult result = service.convert(res, java, new ConversionOptions());
        ScreenSnapshot snapshot = result.screens.get(1).snapshot();

        assertEquals("ConvertedLogin", snapshot.screenName);
        assertEquals("activity_login", snapshot.layoutId);
        List<String> names = snapshot.handlers.stream().map(ScreenSnapshot.Handler::name).collect(Collectors.toList());
        assertEquals(List.of("_onLoginButtonPressed", "_openTerms"), names);
        ScreenSnapshot.Handler login = snapshot.handlers.get(0);
        assertEquals("login_button", login.viewId());
        assertTrue(login.code().contains("Navigator.push("), login.code());
        assertFalse(login.code().startsWith(" "), login.code());
    }

    @Test
    void requestedLayoutsKeepTheirOwnerOrTranslateAlone() throws Exception {
        writeProject();
        ProjectContext ctx = service.loadProject(res, java, new ConversionOptions());

        List<ScreenRequest> requests = service.screenRequests(ctx, List.of("header", "activity_login", "header"));
        assertEquals(List.of(ScreenRequest.layoutOnly("header"), new ScreenRequest("activity_login", "LoginActivity")),
                requests);

        ScreenResult header = service.translateScreen(ctx, requests.get(0));
        assertEquals("ConvertedHeader", header.screenName);
        assertTrue(header.dartCode.contains("class ConvertedHeader extends StatelessWidget {"), header.dartCode);
        assertTrue(header.model.handlers.isEmpty());
    }

    @Test
    void withoutJavaSourcesEveryParsedLayoutIsAScreen() throws Exception {
        writeProject();
        ProjectContext ctx = service.loadProject(res, null, new ConversionOptions());

        assertTrue(ctx.pairings.isEmpty());
        assertEquals(List.of("activity_home", "activity_login", "header"),
                service.screenRequests(ctx, List.of()).stream().map(ScreenRequest::layoutId).collect(Collectors.toList()));
    }

    @Test
    void failingScreenDoesNotAffectTheOthers() throws Exception {
        writeProject();
        ProjectContext ctx = service.loadProject(res, java, new ConversionOptions());

        ConversionResult result = service.translateAll(ctx,
                List.of(ScreenRequest.layoutOnly("missing"), new ScreenRequest("activity_home", "HomeActivity")),
                new ConversionOptions());

        ScreenResult missing = result.screens.get(0);
        assertTrue(missing.failed());
        assertNull(missing.dartCode);
        assertEquals(ConversionWarnings.SCREEN_FAILED, missing.warnings.get(0).code);
        assertEquals("missing", missing.warnings.get(0).context.get("layout"));
        assertEquals("ConvertedMissing", missing.snapshot().screenName);

        assertFalse(result.screens.get(1).failed());
        assertEquals(1, result.failedCount());
    }

    @Test
    void parallelTranslationEqualsSequentialTranslation() throws Exception {
        writeProject();
        ProjectContext ctx = service.loadProject(res, java, new ConversionOptions());
        List<ScreenRequest> requests = List.of(
                new ScreenRequest("activity_login", "LoginActivity"),
                new ScreenRequest("activity_home", "HomeActivity"),
                ScreenRequest.layoutOnly("header"),
                new ScreenRequest("activity_login", "LoginActivity"));

        ConversionOptions sequential = new ConversionOptions();
        sequential.threads = 1;
        ConversionOptions parallel = new ConversionOptions();
        parallel.threads = 4;

        ConversionResult a = service.translateAll(ctx, requests, sequential);
        ConversionResult b = service.translateAll(ctx, requests, parallel);

        assertEquals(requests.size(), b.screens.size());
        for (int i = 0; i < requests.size(); i++) {
            assertEquals(requests.get(i), b.screens.get(i).request);
            assertEquals(a.screens.get(i).dartCode, b.screens.get(i).dartCode);
            assertEquals(ScreenJson.toJsonString(a.screens.get(i).snapshot()),
                    ScreenJson.toJsonString(b.screens.get(i).snapshot()));
        }
    }

    @Test
    void missingResourceDirectoryIsAnIoError() {
        assertThrows(java.io.IOException.class,
                () -> service.loadProject(root.resolve("nope"), null, new ConversionOptions()));
        assertThrows(IllegalArgumentException.class, () -> service.loadProject(null, null, null));
    }
}
