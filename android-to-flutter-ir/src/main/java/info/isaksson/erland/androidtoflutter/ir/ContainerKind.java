package info.isaksson.erland.androidtoflutter.ir;

/** Layout model a resolved node applies to its own children. */
public enum ContainerKind {
    LINEAR,
    RELATIVE,
    CONSTRAINT,
    FRAME,
    /** Leaf views and tags without known layout semantics. */
    NONE
}
