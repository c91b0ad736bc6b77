package info.isaksson.erland.androidtoflutter.extract;

import info.isaksson.erland.androidtoflutter.ir.BindingTable;
import info.isaksson.erland.androidtoflutter.ir.ClickBinding;
import info.isaksson.erland.androidtoflutter.ir.ConversionWarnings;
import info.isaksson.erland.androidtoflutter.ir.DialogSpec;
import info.isaksson.erland.androidtoflutter.ir.NavigationAction;
import info.isaksson.erland.androidtoflutter.ir.StateBinding;
import info.isaksson.erland.androidtoflutter.ir.TranslatedHandler;
import info.isaksson.erland.androidtoflutter.ir.TransientMessage;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class BehaviorExtractorTest {

    private static final String LOGIN = """
            package com.example;

            public class LoginActivity extends AppCompatActivity implements View.OnClickListener {
                private EditText emailInput;
                private TextView status;

                @Override
                protected void onCreate(Bundle savedInstanceState) {
                    super.onCreate(savedInstanceState);
                    setContentView(R.layout.activity_login);
                    emailInput = findViewById(R.id.email_input);
                    status = (TextView) findViewById(R.id.status_text);
                    Button login = findViewById(R.id.login_button);
                    login.setOnClickListener(v -> {
                        String email = emailInput.getText().toString();
                        if (email.isEmpty()) {
                            status.setText("Email required");
                            return;
                        }
                        Toast.makeText(this, "Welcome", Toast.LENGTH_LONG).show();
                        startActivity(new Intent(LoginActivity.this, HomeActivity.class));
                    });
                    findViewById(R.id.help_button).setOnClickListener(this);
                    findViewById(R.id.about_button).setOnClickListener(this);
                    findViewById(R.id.reset_button).setOnClickListener(new View.OnClickListener() {
                        @Override
                        public void onClick(View view) {
                            view.setEnabled(false);
                            clearForm();
                        }
                    });
                }

                @Override
                public void onClick(View v) {
                    switch (v.getId()) {
                        case R.id.help_button:
                            new AlertDialog.Builder(this)
                                    .setTitle("Help")
                                    .setMessage("Enter your email")
                                    .setPositiveButton("OK", null)
                                    .show();
                            break;
                        case R.id.about_button:
                            showAbout();
                            break;
                    }
                }

                private void clearForm() {
                    status.setText("");
                }

                private void showAbout() {
                    Log.d("Login", "about");
                }

                public void openTerms(View v) {
                    Intent intent = new Intent(this, TermsActivity.class);
                    startActivity(intent);
                }

                @Override
                protected void onDestroy() {
                    Toast.makeText(this, R.string.bye, Toast.LENGTH_SHORT).show();
                    super.onDestroy();
                }
            }
            """;

    private static ClassSource classSource(String source, String name) {
        ParsedUnit unit = new ParsedUnit("Screen.java", new JavaSourceParser().parse(source));
        return ClassSourceIndex.build(List.of(unit)).find(name).orElseThrow();
    }

    private final ConversionWarnings warnings = new ConversionWarnings();

    private BehaviorExtraction extractLogin() {
        BehaviorExtractor extractor = new BehaviorExtractor(
                Map.of("terms_link", "openTerms"),
                Set.of("email_input", "status_text", "login_button", "help_button", "about_button", "reset_button", "terms_link"),
                name -> name.equals("bye") ? Optional.of("Goodbye") : Optional.empty());
        return extractor.extract(classSource(LOGIN, "LoginActivity"), warnings);
    }

    @Test
    void clickListenersOfEveryShapeAreBound() {
        BindingTable bindings = extractLogin().bindings;

        assertEquals(Optional.of(new ClickBinding("login_button", "_onLoginButtonPressed")), bindings.clickBinding("login_button"));
        assertEquals(Optional.of(new ClickBinding("help_button", "_onHelpButtonPressed")), bindings.clickBinding("help_button"));
        assertEquals(Optional.of(new ClickBinding("about_button", "_onAboutButtonPressed")), bindings.clickBinding("about_button"));
        assertEquals(Optional.of(new ClickBinding("reset_button", "_onResetButtonPressed")), bindings.clickBinding("reset_button"));
        assertEquals(Optional.of(new ClickBinding("terms_link", "_openTerms")), bindings.clickBinding("terms_link"));
        assertEquals(0, warnings.count(ConversionWarnings.UNRESOLVED_HANDLER));
    }

    @Test
    void behaviorsAreKeyedByViewIdOrMethodNameInSourceOrder() {
        BehaviorExtraction result = extractLogin();
        BindingTable bindings = result.bindings;

        List<?> login = bindings.get("login_button");
        assertEquals(3, login.size());
        assertInstanceOf(ClickBinding.class, login.get(0));
        TransientMessage welcome = (TransientMessage) login.get(1);
        assertEquals("Welcome", welcome.text());
        assertTrue(welcome.longDuration());
        NavigationAction home = (NavigationAction) login.get(2);
        assertEquals("HomeActivity", home.targetScreenName());
        assertTrue(home.originatingCallSite().startsWith("LoginActivity#onCreate:"), home.originatingCallSite());

        assertEquals(new DialogSpec("Help", "Enter your email", "OK", null), bindings.get("help_button").get(1));
        assertEquals("TermsActivity", ((NavigationAction) bindings.get("terms_link").get(1)).targetScreenName());

        TransientMessage bye = (TransientMessage) bindings.get("onDestroy").get(0);
        assertEquals("Goodbye", bye.text());
        assertFalse(bye.longDuration());

        assertEquals(List.of("HomeActivity", "TermsActivity"),
                result.navigations.stream().map(NavigationAction::targetScreenName).collect(Collectors.toList()));
        assertEquals(1, result.dialogs.size());
        assertEquals(2, result.messages.size());
    }

    @Test
    void handlerBodiesAndCalledHelpersAreTranslated() {
        BehaviorExtraction result = extractLogin();
        Map<String, TranslatedHandler> byName = result.handlers.stream()
                .collect(Collectors.toMap(TranslatedHandler::name, h -> h));

        assertEquals(Set.of("_onLoginButtonPressed", "_onHelpButtonPressed", "_onAboutButtonPressed",
                "_onResetButtonPressed", "_openTerms", "_clearForm", "_showAbout"), byName.keySet());

        TranslatedHandler login = byName.get("_onLoginButtonPressed");
        assertEquals("login_button", login.viewId());
        assertEquals(List.of(new StateBinding("status_text", StateBinding.Property.TEXT)), login.stateBindings());
        assertEquals(0, login.untranslated());

        TranslatedHandler reset = byName.get("_onResetButtonPressed");
        assertEquals(List.of(new StateBinding("reset_button", StateBinding.Property.ENABLED)), reset.stateBindings());

        TranslatedHandler clear = byName.get("_clearForm");
        assertNull(clear.viewId());
        assertEquals(List.of(new StateBinding("status_text", StateBinding.Property.TEXT)), clear.stateBindings());

        assertEquals(1, byName.get("_onHelpButtonPressed").body().statements().size());
        assertEquals(0, warnings.count(ConversionWarnings.UNTRANSLATED_STATEMENT), warnings.toDeterministicList().toString());
    }

    @Test
    void viewBindingAccessAndMethodReferences() {
        String source = """
                package com.example;

                public class SignupActivity extends AppCompatActivity {
                    private ActivitySignupBinding binding;

                    @Override
                    protected void onCreate(Bundle savedInstanceState) {
                        super.onCreate(savedInstanceState);
                        binding = ActivitySignupBinding.inflate(getLayoutInflater());
                        setContentView(binding.getRoot());
                        binding.tvSignup.setOnClickListener(this::goBack);
                        binding.btnSubmit.setOnClickListener(v -> binding.progress.setVisibility(View.VISIBLE));
                        unknownView.setOnClickListener(v -> finish());
                    }

                    private void goBack(View v) {
                        finish();
                    }
                }
                """;
        BehaviorExtractor extractor = new BehaviorExtractor(Map.of("footer", "missingMethod"),
                Set.of("tvSignup", "btn_submit", "progress"), null);
        BehaviorExtraction result = extractor.extract(classSource(source, "SignupActivity"), warnings);

        assertEquals(Optional.of(new ClickBinding("tvSignup", "_goBack")), result.bindings.clickBinding("tvSignup"));
        assertEquals(Optional.of(new ClickBinding("btn_submit", "_onBtnSubmitPressed")), result.bindings.clickBinding("btn_submit"));

        TranslatedHandler submit = result.handlers.stream()
                .filter(h -> h.name().equals("_onBtnSubmitPressed")).findFirst().orElseThrow();
        assertEquals(List.of(new StateBinding("progress", StateBinding.Property.VISIBLE)), submit.stateBindings());

        assertEquals(2, warnings.count(ConversionWarnings.UNRESOLVED_HANDLER), warnings.toDeterministicList().toString());
    }

    @Test
    void mutuallyAliasedListenerLocalsAreReportedNotFollowedForever() {
        String source = """
                package com.example;

                public class LoopActivity extends AppCompatActivity {
                    void one() {
                        View.OnClickListener l = k;
                        findViewById(R.id.b).setOnClickListener(l);
                        findViewById(R.id.ok).setOnClickListener(v -> finish());
                    }

                    void two() {
                        View.OnClickListener k = l;
                    }
                }
                """;
        BehaviorExtractor extractor = new BehaviorExtractor(Map.of(), Set.of("b", "ok"), null);
        BehaviorExtraction result = extractor.extract(classSource(source, "LoopActivity"), warnings);

        assertTrue(result.bindings.clickBinding("b").isEmpty());
        assertEquals(Optional.of(new ClickBinding("ok", "_onOkPressed")), result.bindings.clickBinding("ok"));
        assertEquals(1, warnings.count(ConversionWarnings.UNRESOLVED_HANDLER), warnings.toDeterministicList().toString());
    }
}
