package info.isaksson.erland.androidtoflutter.markup;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LayoutDirectoryLoaderTest {

    @Test
    void loadsAllLayoutsAndRecordsParseErrors(@TempDir Path res) throws Exception {
        Path layout = Files.createDirectories(res.resolve("layout"));
        Path land = Files.createDirectories(res.resolve("layout-land"));
        Files.writeString(layout.resolve("main.xml"), "<LinearLayout/>", StandardCharsets.UTF_8);
        Files.writeString(layout.resolve("broken.xml"), "<LinearLayout>", StandardCharsets.UTF_8);
        Files.writeString(land.resolve("main.xml"), "<FrameLayout/>", StandardCharsets.UTF_8);
        Files.writeString(land.resolve("extra.xml"), "<TextView/>", StandardCharsets.UTF_8);

        LayoutDirectoryLoader.Result result = new LayoutDirectoryLoader(new MarkupParser()).load(res);

        assertEquals(List.of("extra", "main"), List.copyOf(result.registry.documentIds()));
        assertEquals("LinearLayout", result.registry.lookup("main").orElseThrow().tag);
        assertEquals(1, result.parseErrors.size());
        assertTrue(result.parseErrors.get(0).startsWith("layout/broken.xml: parse error"), result.parseErrors.toString());
    }

    @Test
    void missingDirectoryYieldsEmptyRegistry(@TempDir Path res) throws Exception {
        LayoutDirectoryLoader.Result result = new LayoutDirectoryLoader(null).load(res.resolve("nope"));
        assertEquals(0, result.registry.size());
        assertTrue(result.parseErrors.isEmpty());
    }
}
