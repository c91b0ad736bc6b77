package info.isaksson.erland.androidtoflutter.extract;

import info.isaksson.erland.androidtoflutter.io.SourceScanner;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ScreenDiscoveryTest {

    @Test
    void pairsActivitiesAndFragmentsWithTheirLayouts() throws Exception {
        Path root = Files.createTempDirectory("a2f-screens-");
        Path pkg = root.resolve("com/example");
        Files.createDirectories(pkg);

        Files.writeString(pkg.resolve("LoginActivity.java"), """
                package com.example;

                public class LoginActivity extends AppCompatActivity {
                    @Override
                    protected void onCreate(Bundle savedInstanceState) {
                        super.onCreate(savedInstanceState);
                        setContentView(R.layout.activity_login);
                    }
                }
                """, StandardCharsets.UTF_8);

        Files.writeString(pkg.resolve("HomeFragment.java"), """
                package com.example;

                public class HomeFragment extends Fragment {
                    @Override
                    public View onCreateView(LayoutInflater inflater, ViewGroup container, Bundle state) {
                        return inflater.inflate(R.layout.fragment_home, container, false);
                    }
                }
                """, StandardCharsets.UTF_8);

        Files.writeString(pkg.resolve("ProfileActivity.java"), """
                package com.example;

                public class ProfileActivity extends BaseActivity {
                    private ActivityProfileBinding binding;

                    @Override
                    protected void onCreate(Bundle savedInstanceState) {
                        super.onCreate(savedInstanceState);
                        binding = ActivityProfileBinding.inflate(getLayoutInflater());
                        setContentView(binding.getRoot());
                    }
                }
                """, StandardCharsets.UTF_8);

        Files.writeString(pkg.resolve("BaseActivity.java"), """
                package com.example;

                public abstract class BaseActivity extends AppCompatActivity {
                }
                """, StandardCharsets.UTF_8);

        Files.writeString(pkg.resolve("ProfileHeader.java"), """
                package com.example;

                public class ProfileHeader extends FrameLayout {
                    public ProfileHeader(Context context) {
                        super(context);
                        inflate(context, R.layout.view_profile_header, this);
                    }
                }
                """, StandardCharsets.UTF_8);

        Files.writeString(pkg.resolve("Broken.java"), "public class Broken extends {", StandardCharsets.UTF_8);

        List<Path> files = SourceScanner.scan(root, List.of(), false);
        JavaSourceParser.Result parsed = new JavaSourceParser().parseAll(root, files);
        assertEquals(1, parsed.parseErrors.size(), "parseErrors: " + parsed.parseErrors);
        assertTrue(parsed.parseErrors.get(0).startsWith("com/example/Broken.java: parse error"));

        ClassSourceIndex index = ClassSourceIndex.build(parsed.units);
        assertEquals(List.of("BaseActivity", "HomeFragment", "LoginActivity", "ProfileActivity"),
                index.screenClasses().stream().map(c -> c.simpleName).toList());

        List<ScreenDiscovery.ScreenPairing> pairings = ScreenDiscovery.discover(index);
        assertEquals(List.of(
                new ScreenDiscovery.ScreenPairing("HomeFragment", "com.example.HomeFragment", "fragment_home"),
                new ScreenDiscovery.ScreenPairing("LoginActivity", "com.example.LoginActivity", "activity_login"),
                new ScreenDiscovery.ScreenPairing("ProfileActivity", "com.example.ProfileActivity", "activity_profile")
        ), pairings);

        assertEquals("view_profile_header", index.find("ProfileHeader").orElseThrow().inflatedLayout);
        assertEquals(List.of("ProfileActivity", "BaseActivity", "AppCompatActivity"),
                index.superclassChain("com.example.ProfileActivity"));
    }
}
