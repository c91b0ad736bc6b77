package info.isaksson.erland.androidtoflutter.extract;

import info.isaksson.erland.androidtoflutter.ir.BindingTable;
import info.isaksson.erland.androidtoflutter.ir.DialogSpec;
import info.isaksson.erland.androidtoflutter.ir.NavigationAction;
import info.isaksson.erland.androidtoflutter.ir.TranslatedHandler;
import info.isaksson.erland.androidtoflutter.ir.TransientMessage;

import java.util.List;

/** Behaviors found in one class, in source order, plus the translated handler methods. */
public final class BehaviorExtraction {

    public static final BehaviorExtraction EMPTY =
            new BehaviorExtraction(BindingTable.EMPTY, List.of(), List.of(), List.of(), List.of());

    public final BindingTable bindings;
    public final List<NavigationAction> navigations;
    public final List<DialogSpec> dialogs;
    public final List<TransientMessage> messages;
    public final List<TranslatedHandler> handlers;

    public BehaviorExtraction(BindingTable bindings,
                              List<NavigationAction> navigations,
                              List<DialogSpec> dialogs,
                              List<TransientMessage> messages,
                              List<TranslatedHandler> handlers) {
        this.bindings = bindings == null ? BindingTable.EMPTY : bindings;
        this.navigations = navigations == null ? List.of() : List.copyOf(navigations);
        this.dialogs = dialogs == null ? List.of() : List.copyOf(dialogs);
        this.messages = messages == null ? List.of() : List.copyOf(messages);
        this.handlers = handlers == null ? List.of() : List.copyOf(handlers);
    }
}
