package nl.bytesoflife.deltacnc.model;

import java.util.Locale;

/**
 * A position on the machine table in inches, origin at the stock corner.
 */
public record Point(double x, double y) {

    public Point {
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            throw new InvalidOperationException("Point coordinates must be finite: " + x + ", " + y);
        }
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "(%.4f, %.4f)", x, y);
    }
}
