package nl.bytesoflife.deltacnc.validation;

import java.util.Locale;

/**
 * One finding of a validation check.
 *
 * @param check    name of the check that raised it
 * @param sourceId operation the finding refers to, or null for job-level findings
 * @param x        location in inches, NaN when not applicable
 * @param y        location in inches, NaN when not applicable
 */
public record ValidationIssue(String check, Severity severity, String message, String sourceId, double x, double y) {

    public static ValidationIssue error(String check, String message) {
        return new ValidationIssue(check, Severity.ERROR, message, null, Double.NaN, Double.NaN);
    }

    public static ValidationIssue error(String check, String message, String sourceId, double x, double y) {
        return new ValidationIssue(check, Severity.ERROR, message, sourceId, x, y);
    }

    public static ValidationIssue warning(String check, String message, String sourceId, double x, double y) {
        return new ValidationIssue(check, Severity.WARNING, message, sourceId, x, y);
    }

    public boolean hasLocation() {
        return !Double.isNaN(x) && !Double.isNaN(y);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(severity).append("] ");
        sb.append(check).append(": ").append(message);
        if (hasLocation()) {
            sb.append(String.format(Locale.US, " at (%.4f, %.4f)", x, y));
        }
        return sb.toString();
    }
}
