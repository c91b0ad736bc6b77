package info.isaksson.erland.androidtoflutter.ir;

import java.util.Objects;

/** A click listener on {@code viewId}, translated into the Dart method {@code handlerMethodName}. */
public record ClickBinding(String viewId, String handlerMethodName) implements Behavior {

    public ClickBinding {
        Objects.requireNonNull(viewId, "viewId must not be null");
        Objects.requireNonNull(handlerMethodName, "handlerMethodName must not be null");
    }
}
