package info.isaksson.erland.androidtoflutter.ir;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/** A UI behavior attached to a view id or event name in the {@link BindingTable}. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ClickBinding.class, name = "click"),
        @JsonSubTypes.Type(value = NavigationAction.class, name = "navigation"),
        @JsonSubTypes.Type(value = DialogSpec.class, name = "dialog"),
        @JsonSubTypes.Type(value = TransientMessage.class, name = "message")
})
public sealed interface Behavior permits ClickBinding, NavigationAction, DialogSpec, TransientMessage {
}
