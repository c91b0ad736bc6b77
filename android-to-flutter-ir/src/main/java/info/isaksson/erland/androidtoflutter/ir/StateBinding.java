package info.isaksson.erland.androidtoflutter.ir;

import java.util.Objects;

/**
 * A view property that a handler changes at runtime. The emitter turns each binding into a
 * state field read by the widget tree.
 */
public record StateBinding(String viewId, Property property) {

    public enum Property {
        TEXT("Text", "String", "''"),
        VISIBLE("Visible", "bool", "true"),
        ENABLED("Enabled", "bool", "true"),
        CHECKED("Checked", "bool", "false");

        private final String suffix;
        private final String dartType;
        private final String initialValue;

        Property(String suffix, String dartType, String initialValue) {
            this.suffix = suffix;
            this.dartType = dartType;
            this.initialValue = initialValue;
        }

        public String suffix() {
            return suffix;
        }

        public String dartType() {
            return dartType;
        }

        /** Dart source of the field's initial value when the layout says nothing. */
        public String initialValue() {
            return initialValue;
        }
    }

    public StateBinding {
        Objects.requireNonNull(viewId, "viewId must not be null");
        Objects.requireNonNull(property, "property must not be null");
    }

    public String fieldName() {
        return DartNames.stateField(viewId, property.suffix());
    }
}
