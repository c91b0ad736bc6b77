package info.isaksson.erland.androidtoflutter.core;

import info.isaksson.erland.androidtoflutter.emitter.DartEmitter;
import info.isaksson.erland.androidtoflutter.extract.BehaviorExtraction;
import info.isaksson.erland.androidtoflutter.extract.BehaviorExtractor;
import info.isaksson.erland.androidtoflutter.extract.ClassSource;
import info.isaksson.erland.androidtoflutter.extract.ClassSourceIndex;
import info.isaksson.erland.androidtoflutter.extract.JavaSourceParser;
import info.isaksson.erland.androidtoflutter.extract.ScreenDiscovery;
import info.isaksson.erland.androidtoflutter.extract.ScreenDiscovery.ScreenPairing;
import info.isaksson.erland.androidtoflutter.io.SourceScanner;
import info.isaksson.erland.androidtoflutter.ir.ConversionWarnings;
import info.isaksson.erland.androidtoflutter.ir.DartNames;
import info.isaksson.erland.androidtoflutter.ir.MarkupNode;
import info.isaksson.erland.androidtoflutter.ir.ResolvedLayoutNode;
import info.isaksson.erland.androidtoflutter.ir.ScreenModel;
import info.isaksson.erland.androidtoflutter.ir.WidgetDescriptor;
import info.isaksson.erland.androidtoflutter.layout.LayoutResolver;
import info.isaksson.erland.androidtoflutter.markup.LayoutDirectoryLoader;
import info.isaksson.erland.androidtoflutter.markup.MarkupParser;
import info.isaksson.erland.androidtoflutter.resources.ResourceTable;
import info.isaksson.erland.androidtoflutter.resources.ResourceTableLoader;
import info.isaksson.erland.androidtoflutter.widget.MappingContext;
import info.isaksson.erland.androidtoflutter.widget.WidgetMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * API for translating an Android project's screens into Flutter widgets.
 *
 * <p>CLI and other wrappers should use this class instead of re-implementing the pipeline.
 * The service itself never writes files.</p>
 */
public final class AndroidToFlutterService {

    private static final Logger log = LoggerFactory.getLogger(AndroidToFlutterService.class);

    /** Load layouts and resources from {@code resDir}, and classes from {@code javaDir} when given. */
    public ProjectContext loadProject(Path resDir, Path javaDir, ConversionOptions options) throws IOException {
        if (resDir == null) throw new IllegalArgumentException("resDir must not be null");
        if (!Files.isDirectory(resDir)) throw new IOException("Resource directory not found: " + resDir);
        if (options == null) options = new ConversionOptions();

        List<String> parseErrors = new ArrayList<>();

        LayoutDirectoryLoader.Result layouts = new LayoutDirectoryLoader(new MarkupParser()).load(resDir);
        parseErrors.addAll(layouts.parseErrors);

        ResourceTableLoader resourceLoader = new ResourceTableLoader();
        ResourceTable resources = resourceLoader.load(resDir);
        parseErrors.addAll(resourceLoader.getParseErrors());

        ClassSourceIndex classes = ClassSourceIndex.EMPTY;
        List<Path> javaFiles = List.of();
        if (javaDir != null) {
            if (!Files.isDirectory(javaDir)) throw new IOException("Java source directory not found: " + javaDir);
            List<String> excludes = options.excludeGlobs == null ? List.of() : options.excludeGlobs;
            javaFiles = SourceScanner.scan(javaDir, excludes, options.includeTests);
            JavaSourceParser.Result parsed = new JavaSourceParser().parseAll(javaDir, javaFiles);
            parseErrors.addAll(parsed.parseErrors);
            classes = ClassSourceIndex.build(parsed.units);
        }

        List<ScreenPairing> pairings = ScreenDiscovery.discover(classes);
        log.info("Loaded {} layouts, {} classes, {} screen pairings ({} parse errors)",
                layouts.registry.size(), classes.size(), pairings.size(), parseErrors.size());
        return new ProjectContext(layouts.registry, layouts.files, resources, classes, pairings, javaFiles, parseErrors);
    }

    /**
     * Screens to translate for the given layout ids.
     *
     * <p>An empty list selects every discovered screen pairing, or every layout when no class
     * pairs with one. A requested layout is paired with the first class that shows it.</p>
     */
    public List<ScreenRequest> screenRequests(ProjectContext ctx, List<String> layoutIds) {
        if (ctx == null) throw new IllegalArgumentException("ctx must not be null");
        List<ScreenRequest> out = new ArrayList<>();
        if (layoutIds == null || layoutIds.isEmpty()) {
            if (!ctx.pairings.isEmpty()) {
                for (ScreenPairing p : ctx.pairings) out.add(new ScreenRequest(p.layoutId(), p.className()));
            } else {
                for (String id : new TreeSet<>(ctx.layouts.documentIds())) out.add(ScreenRequest.layoutOnly(id));
            }
            return out;
        }
        for (String id : new LinkedHashSet<>(layoutIds)) {
            String owner = null;
            for (ScreenPairing p : ctx.pairings) {
                if (p.layoutId().equals(id)) {
                    owner = p.className();
                    break;
                }
            }
            out.add(new ScreenRequest(id, owner));
        }
        return out;
    }

    /**
     * Translate one screen.
     *
     * @throws IllegalArgumentException when the layout or the paired class is unknown
     */
    public ScreenResult translateScreen(ProjectContext ctx, ScreenRequest request) {
        if (ctx == null) throw new IllegalArgumentException("ctx must not be null");
        if (request == null) throw new IllegalArgumentException("request must not be null");

        MarkupNode markup = ctx.layouts.lookup(request.layoutId())
                .orElseThrow(() -> new IllegalArgumentException("Unknown layout: " + request.layoutId()));
        ClassSource cls = null;
        if (request.className() != null) {
            cls = ctx.classes.find(request.className())
                    .orElseThrow(() -> new IllegalArgumentException("Unknown class: " + request.className()));
        }

        ConversionWarnings warnings = new ConversionWarnings();
        LayoutResolver resolver = new LayoutResolver(ctx.layouts);
        ResolvedLayoutNode resolved = resolver.resolve(markup, warnings);

        Map<String, String> xmlClickHandlers = new LinkedHashMap<>();
        Set<String> viewIds = new LinkedHashSet<>();
        collectViews(resolved, xmlClickHandlers, viewIds);

        BehaviorExtraction behavior = BehaviorExtraction.EMPTY;
        if (cls != null) {
            BehaviorExtractor extractor = new BehaviorExtractor(xmlClickHandlers, viewIds,
                    name -> ctx.resources.text("@string/" + name));
            behavior = extractor.extract(cls, warnings);
        }

        MappingContext mapping = MappingContext.builder()
                .resources(ctx.resources)
                .bindings(behavior.bindings)
                .customViews(ctx.classifier::classify)
                .layouts(id -> ctx.layouts.lookup(id).map(m -> resolver.resolve(m, warnings)))
                .warnings(warnings)
                .build();
        WidgetDescriptor tree = new WidgetMapper(mapping).map(resolved);

        String screenName = screenName(request);
        ScreenModel model = new ScreenModel(screenName, request.layoutId(), request.className(), tree,
                behavior.bindings, behavior.handlers);
        String dart = new DartEmitter().emitScreen(model);

        log.debug("Translated {} ({} handlers, {} warnings, {} untranslated)",
                screenName, model.handlers.size(), warnings.size(), model.untranslatedCount());
        return new ScreenResult(request, screenName, DartNames.fileName(screenName), dart, model,
                warnings.toDeterministicList());
    }

    /**
     * Translate screens on a fixed thread pool of {@code options.threads} workers.
     *
     * <p>Results come back in request order. A screen that throws is recorded as a failed
     * result carrying a {@code SCREEN_FAILED} warning; the other screens are unaffected.</p>
     */
    public ConversionResult translateAll(ProjectContext ctx, List<ScreenRequest> requests, ConversionOptions options) {
        if (ctx == null) throw new IllegalArgumentException("ctx must not be null");
        if (requests == null) requests = List.of();
        if (options == null) options = new ConversionOptions();

        int threads = Math.max(1, Math.min(options.threads, requests.size()));
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        List<ScreenResult> results = new ArrayList<>();
        try {
            List<Future<ScreenResult>> futures = new ArrayList<>();
            for (ScreenRequest r : requests) {
                futures.add(pool.submit(() -> translateScreen(ctx, r)));
            }
            for (int i = 0; i < futures.size(); i++) {
                results.add(await(futures.get(i), requests.get(i)));
            }
        } finally {
            pool.shutdownNow();
        }

        ConversionResult result = new ConversionResult(results, ctx.parseErrors);
        log.info("Translated {} screens on {} threads ({} failed, {} untranslated statements)",
                results.size(), threads, result.failedCount(), result.untranslatedCount());
        return result;
    }

    /** Load the project and translate the screens selected by {@code options.layouts}. */
    public ConversionResult convert(Path resDir, Path javaDir, ConversionOptions options) throws IOException {
        if (options == null) options = new ConversionOptions();
        ProjectContext ctx = loadProject(resDir, javaDir, options);
        return translateAll(ctx, screenRequests(ctx, options.layouts), options);
    }

    static String screenName(ScreenRequest request) {
        return request.className() != null
                ? DartNames.screenClassName(request.className())
                : DartNames.screenNameForLayout(request.layoutId());
    }

    private static ScreenResult await(Future<ScreenResult> future, ScreenRequest request) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return failed(request, cause);
        } catch (CancellationException e) {
            return failed(request, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return failed(request, e);
        }
    }

    private static ScreenResult failed(ScreenRequest request, Throwable cause) {
        log.warn("Screen {} failed: {}", request.layoutId(), cause.toString());
        ConversionWarnings warnings = new ConversionWarnings();
        String message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        warnings.warn(ConversionWarnings.SCREEN_FAILED, message,
                "layout", request.layoutId(), "class", Optional.ofNullable(request.className()).orElse(""));
        String screenName = screenName(request);
        return new ScreenResult(request, screenName, DartNames.fileName(screenName), null, null,
                warnings.toDeterministicList());
    }

    private static void collectViews(ResolvedLayoutNode node, Map<String, String> onClick, Set<String> ids) {
        String id = node.id();
        if (id != null) {
            ids.add(id);
            String method = node.attr("onClick");
            if (method != null && !method.isBlank()) onClick.putIfAbsent(id, method.trim());
        }
        for (ResolvedLayoutNode child : node.children) collectViews(child, onClick, ids);
    }
}
