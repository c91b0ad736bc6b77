package info.isaksson.erland.androidtoflutter.ir;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Everything the emitter needs for one screen: the mapped widget tree, the bindings and the
 * translated handler methods. Handlers are kept sorted by name.
 */
public final class ScreenModel {

    /** Dart widget class name, e.g. {@code ConvertedLogin}. */
    public final String screenName;

    public final String layoutId;

    /** Source class paired with the layout, or null for a layout translated alone. */
    public final String className;

    public final WidgetDescriptor widgetTree;
    public final BindingTable bindings;
    public final List<TranslatedHandler> handlers;

    public ScreenModel(String screenName,
                       String layoutId,
                       String className,
                       WidgetDescriptor widgetTree,
                       BindingTable bindings,
                       List<TranslatedHandler> handlers) {
        this.screenName = Objects.requireNonNull(screenName, "screenName must not be null");
        this.layoutId = layoutId;
        this.className = className;
        this.widgetTree = Objects.requireNonNull(widgetTree, "widgetTree must not be null");
        this.bindings = bindings == null ? BindingTable.EMPTY : bindings;
        List<TranslatedHandler> hs = handlers == null ? new ArrayList<>() : new ArrayList<>(handlers);
        hs.sort(Comparator.comparing(TranslatedHandler::name));
        this.handlers = List.copyOf(hs);
    }

    /** Union of the handlers' state bindings, in handler order then first-use order. */
    public List<StateBinding> stateBindings() {
        Set<StateBinding> out = new LinkedHashSet<>();
        for (TranslatedHandler h : handlers) out.addAll(h.stateBindings());
        return List.copyOf(out);
    }

    public int untranslatedCount() {
        int n = 0;
        for (TranslatedHandler h : handlers) n += h.untranslated();
        return n;
    }

    @Override public String toString() {
        return "ScreenModel{" + screenName + ", layout=" + layoutId + ", handlers=" + handlers.size() + "}";
    }
}
