package info.isaksson.erland.androidtoflutter.ir;

import info.isaksson.erland.androidtoflutter.ir.dart.DartBlock;

import java.util.List;
import java.util.Objects;

/**
 * A Java method body translated into a Dart method of the screen's widget class.
 *
 * <p>Every translated method takes {@code BuildContext context} as its first parameter;
 * {@code parameters} lists the remaining Dart parameter declarations.</p>
 *
 * @param name          Dart method name, e.g. {@code _onLoginClicked}
 * @param viewId        view the method handles clicks for, null for event methods and helpers
 * @param parameters    extra parameter declarations such as {@code String name}
 * @param body          translated body
 * @param stateBindings view properties the body toggles, in first-use order
 * @param untranslated  number of untranslated nodes in the body
 * @param sourceMethod  {@code Class#method} the body came from
 */
public record TranslatedHandler(String name,
                                String viewId,
                                List<String> parameters,
                                DartBlock body,
                                List<StateBinding> stateBindings,
                                int untranslated,
                                String sourceMethod) {

    public TranslatedHandler {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(body, "body must not be null");
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        stateBindings = stateBindings == null ? List.of() : List.copyOf(stateBindings);
    }
}
