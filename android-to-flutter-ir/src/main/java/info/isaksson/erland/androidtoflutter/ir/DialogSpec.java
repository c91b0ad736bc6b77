package info.isaksson.erland.androidtoflutter.ir;

/** Texts of an alert dialog built with a builder chain. Absent parts are null. */
public record DialogSpec(String title, String message, String positiveLabel, String negativeLabel) implements Behavior {
}
