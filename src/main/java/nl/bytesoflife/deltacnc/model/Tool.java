package nl.bytesoflife.deltacnc.model;

import java.util.Locale;

/**
 * The cutter selected for a job. Diameter in inches.
 */
public record Tool(String name, double diameter) {

    public Tool {
        if (name == null || name.isBlank()) {
            throw new InvalidOperationException("Tool name must not be blank");
        }
        if (!(diameter > 0)) {
            throw new InvalidOperationException("Tool diameter must be > 0, got " + diameter);
        }
    }

    public double radius() {
        return diameter / 2;
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "%s (D%.4f)", name, diameter);
    }
}
