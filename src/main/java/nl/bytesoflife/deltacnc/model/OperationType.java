package nl.bytesoflife.deltacnc.model;

/**
 * Selects the body of one generation call: drilling or cutting.
 */
public enum OperationType {
    DRILL,
    CUT
}
