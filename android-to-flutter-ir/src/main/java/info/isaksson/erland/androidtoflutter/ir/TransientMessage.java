package info.isaksson.erland.androidtoflutter.ir;

/** A toast or snackbar. {@code text} is the literal text, or the source expression when not a literal. */
public record TransientMessage(String text, boolean longDuration, String originatingCallSite) implements Behavior {
}
