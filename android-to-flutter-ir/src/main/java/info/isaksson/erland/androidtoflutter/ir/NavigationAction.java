package info.isaksson.erland.androidtoflutter.ir;

import java.util.Objects;

/**
 * A screen launch.
 *
 * @param targetScreenName    class name of the launched screen as written in the source
 * @param originatingCallSite {@code Class#method:line}
 */
public record NavigationAction(String targetScreenName, String originatingCallSite) implements Behavior {

    public NavigationAction {
        Objects.requireNonNull(targetScreenName, "targetScreenName must not be null");
    }
}
