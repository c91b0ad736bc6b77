package info.isaksson.erland.androidtoflutter.ir;

/** Alignment of a node within its parent. */
public enum Alignment {
    START,
    CENTER,
    END,
    STRETCH,
    NONE
}
