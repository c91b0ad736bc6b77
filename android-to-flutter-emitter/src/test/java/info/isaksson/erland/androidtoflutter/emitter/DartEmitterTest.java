package info.isaksson.erland.androidtoflutter.emitter;

import info.isaksson.erland.androidtoflutter.ir.BindingTable;
import info.isaksson.erland.androidtoflutter.ir.ScreenModel;
import info.isaksson.erland.androidtoflutter.ir.StateBinding;
import info.isaksson.erland.androidtoflutter.ir.TranslatedHandler;
import info.isaksson.erland.androidtoflutter.ir.WidgetDescriptor;
import info.isaksson.erland.androidtoflutter.ir.WidgetKind;
import info.isaksson.erland.androidtoflutter.ir.WidgetProperty;
import info.isaksson.erland.androidtoflutter.ir.WidgetWrapper;
import info.isaksson.erland.androidtoflutter.ir.dart.DartAssign;
import info.isaksson.erland.androidtoflutter.ir.dart.DartBlock;
import info.isaksson.erland.androidtoflutter.ir.dart.DartCall;
import info.isaksson.erland.androidtoflutter.ir.dart.DartExpression;
import info.isaksson.erland.androidtoflutter.ir.dart.DartExpressionStmt;
import info.isaksson.erland.androidtoflutter.ir.dart.DartFieldAccess;
import info.isaksson.erland.androidtoflutter.ir.dart.DartLambda;
import info.isaksson.erland.androidtoflutter.ir.dart.DartLiteral;
import info.isaksson.erland.androidtoflutter.ir.dart.DartName;
import info.isaksson.erland.androidtoflutter.ir.dart.DartUntranslated;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DartEmitterTest {

    private final DartEmitter emitter = new DartEmitter();

    private static WidgetDescriptor welcomeTree() {
        return WidgetDescriptor.builder(WidgetKind.COLUMN)
                .property("mainAxisAlignment", WidgetProperty.symbol("MainAxisAlignment.center"))
                .child(WidgetDescriptor.builder(WidgetKind.TEXT).viewId("greeting")
                        .property("text", WidgetProperty.string("Hello"))
                        .wrap(WidgetWrapper.of(WidgetWrapper.Kind.CENTER))
                        .build())
                .child(WidgetDescriptor.builder(WidgetKind.ELEVATED_BUTTON).viewId("go_button")
                        .property("label", WidgetProperty.string("Go"))
                        .property("onPressed", WidgetProperty.handler("_onGoButtonPressed"))
                        .build())
                .build();
    }

    @Test
    void screenWithoutStateIsStatelessWithHandlerStubs() {
        ScreenModel model = new ScreenModel("ConvertedWelcome", "activity_welcome", "WelcomeActivity",
                welcomeTree(), BindingTable.EMPTY, List.of());

        String dart = emitter.emitScreen(model);

        assertTrue(dart.startsWith("// Converted from layout activity_welcome and WelcomeActivity.\n"), dart);
        assertTrue(dart.contains("import 'package:flutter/material.dart';"));
        assertTrue(dart.contains("class ConvertedWelcome extends StatelessWidget {"), dart);
        assertTrue(dart.contains("appBar: AppBar(title: const Text('Welcome'))"), dart);
        assertTrue(dart.contains("mainAxisAlignment: MainAxisAlignment.center"), dart);
        assertTrue(dart.contains("Center(child: Text('Hello'))"), dart);
        assertTrue(dart.contains("onPressed: () => _onGoButtonPressed(context)"), dart);
        assertTrue(dart.contains("  void _onGoButtonPressed(BuildContext context) {}"), dart);
        assertFalse(dart.contains("StatefulWidget"));
        assertTrue(dart.endsWith("}\n"));
    }

    @Test
    void textFieldsAndStateTogglesMakeTheScreenStateful() {
        WidgetDescriptor tree = WidgetDescriptor.builder(WidgetKind.COLUMN)
                .child(WidgetDescriptor.builder(WidgetKind.TEXT_FIELD).viewId("email_input")
                        .property("hintText", WidgetProperty.string("Email"))
                        .build())
                .child(WidgetDescriptor.builder(WidgetKind.TEXT).viewId("status_text")
                        .property("text", WidgetProperty.string("Ready"))
                        .build())
                .child(WidgetDescriptor.builder(WidgetKind.LINEAR_PROGRESS_INDICATOR).viewId("progress")
                        .wrap(WidgetWrapper.of(WidgetWrapper.Kind.VISIBILITY, "visible", WidgetProperty.bool(false)))
                        .build())
                .child(WidgetDescriptor.builder(WidgetKind.ELEVATED_BUTTON).viewId("login_button")
                        .property("label", WidgetProperty.string("Log in"))
                        .property("onPressed", WidgetProperty.handler("_onLoginButtonPressed"))
                        .build())
                .build();

        DartBlock body = new DartBlock(List.of(
                new DartAssign(new DartName("email"), "=",
                        new DartFieldAccess(new DartName("_emailInputController"), "text"), "String"),
                setState("_statusTextText", DartLiteral.string("Signing in")),
                setState("_progressVisible", new DartLiteral(DartLiteral.Kind.BOOLEAN, "true")),
                new DartUntranslated("analytics.track(\"login\");", List.of())));
        TranslatedHandler login = new TranslatedHandler("_onLoginButtonPressed", "login_button", List.of(), body,
                List.of(new StateBinding("status_text", StateBinding.Property.TEXT),
                        new StateBinding("progress", StateBinding.Property.VISIBLE)),
                1, "LoginActivity#onCreate");
        ScreenModel model = new ScreenModel("ConvertedLogin", "activity_login", "LoginActivity",
                tree, BindingTable.EMPTY, List.of(login));

        String dart = emitter.emitScreen(model);

        assertTrue(dart.contains("// 1 statement(s) could not be translated"), dart);
        assertTrue(dart.contains("class ConvertedLogin extends StatefulWidget {"), dart);
        assertTrue(dart.contains("State<ConvertedLogin> createState() => _ConvertedLoginState();"), dart);
        assertTrue(dart.contains("  final TextEditingController _emailInputController = TextEditingController();"), dart);
        assertTrue(dart.contains("  String _statusTextText = 'Ready';"), dart);
        assertTrue(dart.contains("  bool _progressVisible = false;"), dart);
        assertTrue(dart.contains("    _emailInputController.dispose();\n    super.dispose();"), dart);
        assertTrue(dart.contains("controller: _emailInputController"), dart);
        assertTrue(dart.contains("Text(_statusTextText)"), dart);
        assertTrue(dart.contains("visible: _progressVisible"), dart);
        assertFalse(dart.contains("visible: false"), dart);
        assertTrue(dart.contains("  void _onLoginButtonPressed(BuildContext context) {\n"
                + "    String email = _emailInputController.text;\n"
                + "    setState(() {\n"
                + "      _statusTextText = 'Signing in';\n"
                + "    });\n"), dart);
        assertTrue(dart.contains("    // untranslated: analytics.track(\"login\");\n  }"), dart);
    }

    @Test
    void checkedToggleUpdatesItsStateField() {
        WidgetDescriptor tree = WidgetDescriptor.builder(WidgetKind.CHECKBOX).viewId("remember")
                .property("title", WidgetProperty.string("Remember me"))
                .property("value", WidgetProperty.bool(true))
                .property("onChanged", WidgetProperty.handler("_onRememberPressed"))
                .build();
        TranslatedHandler reset = new TranslatedHandler("_reset", null, List.of("String reason"),
                new DartBlock(List.of(setState("_rememberChecked", new DartLiteral(DartLiteral.Kind.BOOLEAN, "false")))),
                List.of(new StateBinding("remember", StateBinding.Property.CHECKED)), 0, "SettingsActivity#reset");
        ScreenModel model = new ScreenModel("ConvertedSettings", "activity_settings", "SettingsActivity",
                tree, BindingTable.EMPTY, List.of(reset));

        String dart = emitter.emitScreen(model);

        assertTrue(dart.contains("  bool _rememberChecked = true;"), dart);
        assertTrue(dart.contains("value: _rememberChecked"), dart);
        assertTrue(dart.contains("_rememberChecked = value ?? false;"), dart);
        assertTrue(dart.contains("_onRememberPressed(context);"), dart);
        assertTrue(dart.contains("  void _reset(BuildContext context, String reason) {"), dart);
        assertTrue(dart.contains("  void _onRememberPressed(BuildContext context) {}"), dart);
    }

    @Test
    void customDrawnViewsGetPainterStubs() {
        WidgetDescriptor tree = WidgetDescriptor.builder(WidgetKind.STACK)
                .child(WidgetDescriptor.builder(WidgetKind.CUSTOM_PAINT).sourceTag("com.example.Gauge")
                        .property("painter", WidgetProperty.symbol("GaugePainter")).build())
                .child(WidgetDescriptor.builder(WidgetKind.IMAGE).build())
                .build();
        ScreenModel model = new ScreenModel("ConvertedDashboard", "activity_dashboard", null,
                tree, BindingTable.EMPTY, List.of());

        String dart = emitter.emitScreen(model);

        assertTrue(dart.startsWith("// Converted from layout activity_dashboard.\n"), dart);
        assertTrue(dart.contains("CustomPaint(painter: GaugePainter())"), dart);
        assertTrue(dart.contains("Container(color: Colors.grey)"), dart);
        assertTrue(dart.contains("class GaugePainter extends CustomPainter {\n"
                + "  @override\n"
                + "  void paint(Canvas canvas, Size size) {}\n"), dart);
        assertTrue(dart.contains("bool shouldRepaint(covariant CustomPainter oldDelegate) => false;"), dart);
    }

    @Test
    void emissionIsDeterministicAndWritesUtf8(@TempDir Path dir) throws Exception {
        ScreenModel model = new ScreenModel("ConvertedWelcome", "activity_welcome", "WelcomeActivity",
                welcomeTree(), BindingTable.EMPTY, List.of());

        String first = emitter.emitScreen(model);
        assertEquals(first, emitter.emitScreen(model));

        Path out = dir.resolve("lib/screens/converted_welcome.dart");
        emitter.emitScreen(model, out);
        assertEquals(first, Files.readString(out, StandardCharsets.UTF_8));
    }

    @Test
    void titleSplitsWords() {
        assertEquals("User Profile", DartEmitter.title("ConvertedUserProfile"));
        assertEquals("Converted", DartEmitter.title("Converted"));
        assertEquals("Main", DartEmitter.title("Main"));
    }

    private static DartExpressionStmt setState(String field, DartExpression value) {
        DartAssign assign = new DartAssign(new DartName(field), "=", value, null);
        return new DartExpressionStmt(DartCall.function("setState", new DartLambda(List.of(), new DartBlock(List.of(assign)))));
    }
}
