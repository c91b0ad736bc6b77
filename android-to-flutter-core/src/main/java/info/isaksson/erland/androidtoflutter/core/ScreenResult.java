package info.isaksson.erland.androidtoflutter.core;

import info.isaksson.erland.androidtoflutter.emitter.DartExpressionPrinter;
import info.isaksson.erland.androidtoflutter.ir.ConversionWarning;
import info.isaksson.erland.androidtoflutter.ir.ScreenModel;
import info.isaksson.erland.androidtoflutter.ir.ScreenSnapshot;
import info.isaksson.erland.androidtoflutter.ir.TranslatedHandler;

import java.util.ArrayList;
import java.util.List;

/** Outcome of translating one screen. */
public final class ScreenResult {

    public final ScreenRequest request;

    /** Dart widget class name. */
    public final String screenName;

    /** Dart file name relative to the output directory, e.g. {@code converted_login.dart}. */
    public final String fileName;

    /** Generated Dart source; null when the screen failed. */
    public final String dartCode;

    /** Null when the screen failed. */
    public final ScreenModel model;

    /** Warnings in deterministic order. */
    public final List<ConversionWarning> warnings;

    public final int untranslatedCount;

    ScreenResult(ScreenRequest request,
                 String screenName,
                 String fileName,
                 String dartCode,
                 ScreenModel model,
                 List<ConversionWarning> warnings) {
        this.request = request;
        this.screenName = screenName;
        this.fileName = fileName;
        this.dartCode = dartCode;
        this.model = model;
        this.warnings = List.copyOf(warnings);
        this.untranslatedCount = model == null ? 0 : model.untranslatedCount();
    }

    public boolean failed() {
        return model == null;
    }

    /** Serializable view of the translated screen; handler bodies are rendered as Dart text. */
    public ScreenSnapshot snapshot() {
        if (model == null) {
            return new ScreenSnapshot(null, screenName, request.layoutId(), request.className(),
                    null, null, null, warnings);
        }
        List<ScreenSnapshot.Handler> handlers = new ArrayList<>();
        for (TranslatedHandler h : model.handlers) {
            String code = String.join("\n", DartExpressionPrinter.blockBody(h.body(), 0));
            handlers.add(new ScreenSnapshot.Handler(h.name(), h.viewId(), h.untranslated(), code));
        }
        return new ScreenSnapshot(null, model.screenName, model.layoutId, model.className,
                model.widgetTree, model.bindings, handlers, warnings);
    }

    @Override public String toString() {
        return "ScreenResult{" + screenName + (failed() ? ", failed" : "") + ", warnings=" + warnings.size() + "}";
    }
}
