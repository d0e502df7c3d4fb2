package nl.bytesoflife.deltacnc.model;

/**
 * Thrown when an operation, pattern or parameter set violates its invariants.
 * Raised before any output is produced.
 */
public class InvalidOperationException extends IllegalArgumentException {

    public InvalidOperationException(String message) {
        super(message);
    }
}
