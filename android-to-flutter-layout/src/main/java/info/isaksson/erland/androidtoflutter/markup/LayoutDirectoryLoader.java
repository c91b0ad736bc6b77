package info.isaksson.erland.androidtoflutter.markup;

import info.isaksson.erland.androidtoflutter.ir.MarkupNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads all layout documents below an Android {@code res} directory into an
 * {@link InMemoryDocumentRegistry}.
 *
 * <p>{@code res/layout} wins over qualified variants ({@code layout-land}, {@code layout-v21});
 * among variants the lexicographically first directory wins. Unparsable documents are
 * recorded in {@link Result#parseErrors} and skipped.</p>
 */
public final class LayoutDirectoryLoader {

    private static final Logger log = LoggerFactory.getLogger(LayoutDirectoryLoader.class);

    private final MarkupParser parser;

    public LayoutDirectoryLoader(MarkupParser parser) {
        this.parser = parser == null ? new MarkupParser() : parser;
    }

    public Result load(Path resDir) throws IOException {
        Map<String, MarkupNode> docs = new LinkedHashMap<>();
        Map<String, Path> files = new LinkedHashMap<>();
        List<String> errors = new ArrayList<>();
        if (resDir == null || !Files.isDirectory(resDir)) {
            return new Result(new InMemoryDocumentRegistry(docs), files, errors);
        }

        for (Path dir : layoutDirectories(resDir)) {
            List<Path> xmlFiles;
            try (Stream<Path> s = Files.list(dir)) {
                xmlFiles = s.filter(Files::isRegularFile)
                        .filter(p -> p.getFileName().toString().endsWith(".xml"))
                        .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                        .collect(Collectors.toList());
            }
            for (Path f : xmlFiles) {
                String id = MarkupParser.documentIdOf(f);
                if (docs.containsKey(id)) continue;
                String rel = resDir.relativize(f).toString().replace('\\', '/');
                try {
                    docs.put(id, parser.parse(f));
                    files.put(id, f);
                } catch (MarkupParseException e) {
                    errors.add(rel + ": parse error (" + e.getMessage() + ")");
                    log.warn("Skipping unparsable layout {}: {}", rel, e.getMessage());
                } catch (IOException e) {
                    errors.add(rel + ": io error (" + e.getMessage() + ")");
                    log.warn("Could not read layout {}: {}", rel, e.getMessage());
                }
            }
        }
        log.info("Loaded {} layout documents from {}", docs.size(), resDir);
        return new Result(new InMemoryDocumentRegistry(docs), files, errors);
    }

    private static List<Path> layoutDirectories(Path resDir) throws IOException {
        try (Stream<Path> s = Files.list(resDir)) {
            return s.filter(Files::isDirectory)
                    .filter(p -> {
                        String n = p.getFileName().toString();
                        return n.equals("layout") || n.startsWith("layout-");
                    })
                    .sorted(Comparator.comparing((Path p) -> !p.getFileName().toString().equals("layout"))
                            .thenComparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        }
    }

    public static final class Result {
        public final InMemoryDocumentRegistry registry;
        /** Source file per document id. */
        public final Map<String, Path> files;
        public final List<String> parseErrors;

        Result(InMemoryDocumentRegistry registry, Map<String, Path> files, List<String> parseErrors) {
            this.registry = registry;
            this.files = Map.copyOf(files);
            this.parseErrors = List.copyOf(parseErrors);
        }
    }
}
