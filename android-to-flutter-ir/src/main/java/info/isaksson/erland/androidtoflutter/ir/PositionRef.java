package info.isaksson.erland.androidtoflutter.ir;

import java.util.Objects;

/** One {anchor-relation, target-id} pair of a relatively positioned view. */
public record PositionRef(AnchorRelation relation, String targetId) {

    public PositionRef {
        Objects.requireNonNull(relation, "relation must not be null");
        Objects.requireNonNull(targetId, "targetId must not be null");
    }
}
