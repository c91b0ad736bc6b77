package info.isaksson.erland.androidtoflutter.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** A non-fatal, deterministic note about degraded fidelity. */
@JsonPropertyOrder({"code", "message", "context"})
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class ConversionWarning {

    /** Stable code, see {@link ConversionWarnings} constants. */
    public final String code;

    public final String message;

    /** Structured context such as document id, view id or call site. */
    public final Map<String, String> context;

    @JsonCreator
    public ConversionWarning(
            @JsonProperty("code") String code,
            @JsonProperty("message") String message,
            @JsonProperty("context") Map<String, String> context
    ) {
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        if (context == null || context.isEmpty()) {
            this.context = Collections.emptyMap();
        } else {
            this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
        }
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConversionWarning)) return false;
        ConversionWarning that = (ConversionWarning) o;
        return code.equals(that.code) && message.equals(that.message) && context.equals(that.context);
    }

    @Override public int hashCode() {
        return Objects.hash(code, message, context);
    }

    @Override public String toString() {
        return code + ": " + message + (context.isEmpty() ? "" : " " + context);
    }
}
