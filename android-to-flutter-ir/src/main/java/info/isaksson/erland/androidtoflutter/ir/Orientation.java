package info.isaksson.erland.androidtoflutter.ir;

/** Main axis of a resolved container. */
public enum Orientation {
    VERTICAL,
    HORIZONTAL,
    NONE
}
