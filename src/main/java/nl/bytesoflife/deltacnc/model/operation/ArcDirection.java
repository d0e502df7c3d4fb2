package nl.bytesoflife.deltacnc.model.operation;

public enum ArcDirection {
    /** Clockwise, G2. */
    CW,
    /** Counter-clockwise, G3. */
    CCW
}
