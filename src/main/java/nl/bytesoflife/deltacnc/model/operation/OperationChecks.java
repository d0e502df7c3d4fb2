package nl.bytesoflife.deltacnc.model.operation;

import nl.bytesoflife.deltacnc.model.InvalidOperationException;

final class OperationChecks {

    private OperationChecks() {
    }

    static void requireSource(String sourceId) {
        if (sourceId == null || sourceId.isBlank()) {
            throw new InvalidOperationException("Operation source id must not be blank");
        }
    }

    static void requireNonNull(Object value, String name) {
        if (value == null) {
            throw new InvalidOperationException("Missing " + name);
        }
    }

    static void requirePositive(String name, double value) {
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new InvalidOperationException("Pattern " + name + " must be > 0, got " + value);
        }
    }

    static void requireCount(String name, int count) {
        if (count < 1) {
            throw new InvalidOperationException("Pattern " + name + " must be >= 1, got " + count);
        }
    }
}
