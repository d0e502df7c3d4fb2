package nl.bytesoflife.deltacnc.model.operation;

public enum PathPointKind {
    START,
    STRAIGHT,
    ARC
}
