package info.isaksson.erland.androidtoflutter.extract;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseProblemException;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import info.isaksson.erland.androidtoflutter.io.SourceScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses Java sources into {@link CompilationUnit}s. Failures never abort a batch; they are
 * collected as {@code "<file>: parse error (N problems)"} strings.
 */
public final class JavaSourceParser {

    private static final Logger log = LoggerFactory.getLogger(JavaSourceParser.class);

    private final JavaParser parser;

    public JavaSourceParser() {
        ParserConfiguration cfg = new ParserConfiguration();
        cfg.setCharacterEncoding(StandardCharsets.UTF_8);
        cfg.setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        this.parser = new JavaParser(cfg);
    }

    /** Parsed units plus one message per file that could not be read or parsed. */
    public static final class Result {
        public final List<ParsedUnit> units = new ArrayList<>();
        public final List<String> parseErrors = new ArrayList<>();
    }

    public Result parseAll(Path sourceRoot, List<Path> javaFiles) {
        Result result = new Result();
        for (Path f : javaFiles) {
            String rel = SourceScanner.relativeName(sourceRoot, f);
            try {
                String code = Files.readString(f, StandardCharsets.UTF_8);
                result.units.add(new ParsedUnit(rel, parse(code)));
            } catch (ParseProblemException e) {
                log.warn("Skipping {}: {} parse problem(s)", rel, e.getProblems().size());
                result.parseErrors.add(rel + ": parse error (" + e.getProblems().size() + " problems)");
            } catch (IOException e) {
                log.warn("Skipping {}: {}", rel, e.getMessage());
                result.parseErrors.add(rel + ": IO error (" + e.getMessage() + ")");
            }
        }
        return result;
    }

    /**
     * Parse one source text.
     *
     * @throws ParseProblemException when the text is not a valid compilation unit
     */
    public CompilationUnit parse(String code) {
        ParseResult<CompilationUnit> r = parser.parse(code);
        if (!r.isSuccessful() || r.getResult().isEmpty()) {
            throw new ParseProblemException(r.getProblems());
        }
        return r.getResult().get();
    }
}
