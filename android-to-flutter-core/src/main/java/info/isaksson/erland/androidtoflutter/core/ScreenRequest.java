package info.isaksson.erland.androidtoflutter.core;

import java.util.Objects;

/**
 * One screen to translate: a layout, optionally paired with the Activity or Fragment class
 * that inflates it.
 *
 * @param layoutId  layout document id, e.g. {@code activity_login}
 * @param className simple name of the owning class, or null
 */
public record ScreenRequest(String layoutId, String className) {

    public ScreenRequest {
        Objects.requireNonNull(layoutId, "layoutId must not be null");
    }

    public static ScreenRequest layoutOnly(String layoutId) {
        return new ScreenRequest(layoutId, null);
    }
}
