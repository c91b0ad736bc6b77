package info.isaksson.erland.androidtoflutter.core;

import java.util.List;

/** Conversion result container for programmatic usage. */
public final class ConversionResult {

    /** One entry per requested screen, in request order. */
    public final List<ScreenResult> screens;

    /** Layout, resource and Java files that could not be read or parsed. */
    public final List<String> parseErrors;

    ConversionResult(List<ScreenResult> screens, List<String> parseErrors) {
        this.screens = List.copyOf(screens);
        this.parseErrors = List.copyOf(parseErrors);
    }

    public int untranslatedCount() {
        int n = 0;
        for (ScreenResult s : screens) n += s.untranslatedCount;
        return n;
    }

    public int warningCount() {
        int n = 0;
        for (ScreenResult s : screens) n += s.warnings.size();
        return n;
    }

    public long failedCount() {
        return screens.stream().filter(ScreenResult::failed).count();
    }
}
