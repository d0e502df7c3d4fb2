package nl.bytesoflife.deltacnc.gcode;

import java.util.Locale;

/**
 * Number rendering for emitted G-code. Inputs are inches; output is millimeters.
 * Positions and depths use 3 decimals, feed rates 1 decimal, spindle speed an integer.
 */
public final class GcodeFormat {

    public static final double MM_PER_INCH = 25.4;

    private GcodeFormat() {
    }

    public static double toMm(double inches) {
        return inches * MM_PER_INCH;
    }

    /**
     * Length in inches rendered as millimeters with 3 decimals.
     */
    public static String mm(double inches) {
        return String.format(Locale.US, "%.3f", clampNegativeZero(toMm(inches), 0.0005));
    }

    /**
     * Feed in inches/minute rendered as millimeters/minute with 1 decimal.
     */
    public static String feed(double inchesPerMinute) {
        return String.format(Locale.US, "%.1f", clampNegativeZero(toMm(inchesPerMinute), 0.05));
    }

    public static String rpm(int spindleSpeed) {
        return Integer.toString(spindleSpeed);
    }

    // Values that would print as -0.000 are printed as 0.000
    private static double clampNegativeZero(double value, double halfUnit) {
        return Math.abs(value) < halfUnit ? 0.0 : value;
    }
}
