package info.isaksson.erland.androidtoflutter.ir.dart;

import java.util.List;
import java.util.Objects;

/**
 * Source construct without a translation rule. {@code rawText} is the original source,
 * verbatim; {@code partialTranslations} holds the translated sub-parts.
 */
public record DartUntranslated(String rawText, List<DartNode> partialTranslations)
        implements DartStatement, DartExpression {

    public DartUntranslated {
        Objects.requireNonNull(rawText, "rawText must not be null");
        partialTranslations = partialTranslations == null ? List.of() : List.copyOf(partialTranslations);
    }
}
