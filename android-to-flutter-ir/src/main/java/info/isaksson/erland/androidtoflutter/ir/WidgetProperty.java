package info.isaksson.erland.androidtoflutter.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/** A literal property value of a widget descriptor or wrapper. */
@JsonPropertyOrder({"type", "value"})
public final class WidgetProperty {

    public enum Type {
        /** Plain text; the emitter quotes and escapes it. */
        STRING,
        NUMBER,
        BOOLEAN,
        /** A Dart constant expression such as {@code MainAxisAlignment.center}. */
        SYMBOL,
        /** 32-bit ARGB color written as {@code 0xAARRGGBB}. */
        COLOR,
        /** Name of a handler method on the screen's state class. */
        HANDLER
    }

    public final Type type;
    public final String value;

    @JsonCreator
    public WidgetProperty(
            @JsonProperty("type") Type type,
            @JsonProperty("value") String value
    ) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    public static WidgetProperty string(String value) {
        return new WidgetProperty(Type.STRING, value);
    }

    public static WidgetProperty integer(long value) {
        return new WidgetProperty(Type.NUMBER, Long.toString(value));
    }

    /** A double rounded to four decimals and always carrying a decimal point. */
    public static WidgetProperty number(double value) {
        return new WidgetProperty(Type.NUMBER, formatDouble(value));
    }

    public static WidgetProperty bool(boolean value) {
        return new WidgetProperty(Type.BOOLEAN, Boolean.toString(value));
    }

    public static WidgetProperty symbol(String dartExpression) {
        return new WidgetProperty(Type.SYMBOL, dartExpression);
    }

    public static WidgetProperty color(long argb) {
        return new WidgetProperty(Type.COLOR, String.format("0x%08X", argb & 0xFFFFFFFFL));
    }

    public static WidgetProperty handler(String methodName) {
        return new WidgetProperty(Type.HANDLER, methodName);
    }

    static String formatDouble(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) return "0.0";
        String s = BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_UP).stripTrailingZeros().toPlainString();
        if (s.equals("-0")) s = "0";
        return s.contains(".") ? s : s + ".0";
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WidgetProperty)) return false;
        WidgetProperty that = (WidgetProperty) o;
        return type == that.type && value.equals(that.value);
    }

    @Override public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override public String toString() {
        return type + ":" + value;
    }
}
