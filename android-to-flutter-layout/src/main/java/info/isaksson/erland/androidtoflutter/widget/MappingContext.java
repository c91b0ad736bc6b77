package info.isaksson.erland.androidtoflutter.widget;

import info.isaksson.erland.androidtoflutter.ir.BindingTable;
import info.isaksson.erland.androidtoflutter.ir.ConversionWarnings;
import info.isaksson.erland.androidtoflutter.ir.ResolvedLayoutNode;
import info.isaksson.erland.androidtoflutter.ir.ViewClassification;
import info.isaksson.erland.androidtoflutter.resources.ResourceTable;

import java.util.Optional;
import java.util.function.Function;

/**
 * Read-only collaborators the {@link WidgetMapper} consults, plus the screen's warning sink.
 */
public final class MappingContext {

    public final ResourceTable resources;
    public final BindingTable bindings;
    /** Tag or class name → classification; empty when no class source is available. */
    public final Function<String, Optional<ViewClassification>> customViews;
    /** Layout id → resolved layout, used for layouts inflated by composite custom views. */
    public final Function<String, Optional<ResolvedLayoutNode>> layouts;
    public final ConversionWarnings warnings;

    private MappingContext(Builder b) {
        this.resources = b.resources;
        this.bindings = b.bindings;
        this.customViews = b.customViews;
        this.layouts = b.layouts;
        this.warnings = b.warnings;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Context without resources, bindings or class sources. */
    public static MappingContext empty(ConversionWarnings warnings) {
        return builder().warnings(warnings).build();
    }

    public static final class Builder {
        private ResourceTable resources = ResourceTable.EMPTY;
        private BindingTable bindings = BindingTable.EMPTY;
        private Function<String, Optional<ViewClassification>> customViews = name -> Optional.empty();
        private Function<String, Optional<ResolvedLayoutNode>> layouts = id -> Optional.empty();
        private ConversionWarnings warnings = new ConversionWarnings();

        private Builder() {}

        public Builder resources(ResourceTable resources) {
            if (resources != null) this.resources = resources;
            return this;
        }

        public Builder bindings(BindingTable bindings) {
            if (bindings != null) this.bindings = bindings;
            return this;
        }

        public Builder customViews(Function<String, Optional<ViewClassification>> customViews) {
            if (customViews != null) this.customViews = customViews;
            return this;
        }

        public Builder layouts(Function<String, Optional<ResolvedLayoutNode>> layouts) {
            if (layouts != null) this.layouts = layouts;
            return this;
        }

        public Builder warnings(ConversionWarnings warnings) {
            if (warnings != null) this.warnings = warnings;
            return this;
        }

        public MappingContext build() {
            return new MappingContext(this);
        }
    }
}
