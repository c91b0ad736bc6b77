package info.isaksson.erland.androidtoflutter.core;

import info.isaksson.erland.androidtoflutter.extract.ClassSourceIndex;
import info.isaksson.erland.androidtoflutter.extract.CustomViewClassifier;
import info.isaksson.erland.androidtoflutter.extract.ScreenDiscovery.ScreenPairing;
import info.isaksson.erland.androidtoflutter.markup.DocumentRegistry;
import info.isaksson.erland.androidtoflutter.resources.ResourceTable;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Everything loaded once per project and shared read-only by all screen translations:
 * layout documents, resources, parsed classes and the discovered screen pairings.
 */
public final class ProjectContext {

    public final DocumentRegistry layouts;
    /** Source file per layout document id. */
    public final Map<String, Path> layoutFiles;
    public final ResourceTable resources;
    public final ClassSourceIndex classes;
    public final CustomViewClassifier classifier;
    public final List<ScreenPairing> pairings;
    /** Java files that were parsed, empty when no Java root was given. */
    public final List<Path> javaFiles;
    /** One message per layout, resource or Java file that could not be read or parsed. */
    public final List<String> parseErrors;

    ProjectContext(DocumentRegistry layouts,
                   Map<String, Path> layoutFiles,
                   ResourceTable resources,
                   ClassSourceIndex classes,
                   List<ScreenPairing> pairings,
                   List<Path> javaFiles,
                   List<String> parseErrors) {
        this.layouts = layouts;
        this.layoutFiles = Map.copyOf(layoutFiles);
        this.resources = resources;
        this.classes = classes;
        this.classifier = new CustomViewClassifier(classes);
        this.pairings = List.copyOf(pairings);
        this.javaFiles = List.copyOf(javaFiles);
        this.parseErrors = List.copyOf(parseErrors);
    }
}
