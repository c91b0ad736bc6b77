package info.isaksson.erland.androidtoflutter.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Serializable view of one translated screen: widget tree, bindings, rendered handler bodies
 * and warnings. Used for {@code --write-ir} output and golden comparisons.
 */
@JsonPropertyOrder({"schemaVersion", "screenName", "layoutId", "className", "widgetTree", "bindings", "handlers", "warnings"})
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class ScreenSnapshot {

    public static final String SCHEMA_VERSION = "1.0";

    public final String schemaVersion;
    public final String screenName;
    public final String layoutId;
    public final String className;
    public final WidgetDescriptor widgetTree;
    public final BindingTable bindings;
    public final List<Handler> handlers;
    public final List<ConversionWarning> warnings;

    @JsonCreator
    public ScreenSnapshot(
            @JsonProperty("schemaVersion") String schemaVersion,
            @JsonProperty("screenName") String screenName,
            @JsonProperty("layoutId") String layoutId,
            @JsonProperty("className") String className,
            @JsonProperty("widgetTree") WidgetDescriptor widgetTree,
            @JsonProperty("bindings") BindingTable bindings,
            @JsonProperty("handlers") List<Handler> handlers,
            @JsonProperty("warnings") List<ConversionWarning> warnings
    ) {
        this.schemaVersion = schemaVersion == null ? SCHEMA_VERSION : schemaVersion;
        this.screenName = Objects.requireNonNull(screenName, "screenName must not be null");
        this.layoutId = layoutId;
        this.className = className;
        this.widgetTree = widgetTree;
        this.bindings = bindings == null ? BindingTable.EMPTY : bindings;
        List<Handler> hs = handlers == null ? new ArrayList<>() : new ArrayList<>(handlers);
        hs.sort(Comparator.comparing(Handler::name));
        this.handlers = List.copyOf(hs);
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /** A translated handler with its rendered Dart body. */
    @JsonPropertyOrder({"name", "viewId", "untranslated", "code"})
    public record Handler(String name, String viewId, int untranslated, String code) {
    }
}
