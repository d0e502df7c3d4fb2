package nl.bytesoflife.deltacnc.gcode;

import nl.bytesoflife.deltacnc.model.InvalidOperationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Cumulative depths for multi-pass cutting and peck drilling.
 *
 * <p>The step count is {@code ceil(total / step)}. A quotient within 1e-9 of a whole
 * number is taken as that number, so 0.25 / 0.05 gives 5 steps and not 6.
 * The last depth is always exactly {@code total}. Schedules longer than
 * {@link #MAX_PASSES} steps are rejected.
 */
public final class PassSchedule {

    private static final double EPSILON = 1e-9;

    public static final int MAX_PASSES = 10_000;

    private PassSchedule() {
    }

    public static int passCount(double total, double step) {
        if (!(step > 0)) {
            throw new InvalidOperationException("Depth step must be > 0, got " + step);
        }
        if (!(total > 0)) {
            throw new InvalidOperationException("Total depth must be > 0, got " + total);
        }
        double quotient = total / step;
        if (!(quotient <= MAX_PASSES + EPSILON)) {
            throw new InvalidOperationException(String.format(Locale.US,
                    "Depth %.6f in steps of %.6f needs more than %d passes", total, step, MAX_PASSES));
        }
        double nearest = Math.rint(quotient);
        if (Math.abs(quotient - nearest) < EPSILON) {
            return Math.max(1, (int) nearest);
        }
        return (int) Math.ceil(quotient);
    }

    /**
     * Depth reached after pass {@code index} (0-based): {@code min((index + 1) * step, total)}.
     */
    public static double depthAt(int index, double total, double step) {
        int passes = passCount(total, step);
        if (index < 0 || index >= passes) {
            throw new IndexOutOfBoundsException("Pass " + index + " of " + passes);
        }
        if (index == passes - 1) {
            return total;
        }
        return Math.min((index + 1) * step, total);
    }

    public static List<Double> depths(double total, double step) {
        int passes = passCount(total, step);
        List<Double> depths = new ArrayList<>(passes);
        for (int i = 0; i < passes; i++) {
            depths.add(depthAt(i, total, step));
        }
        return Collections.unmodifiableList(depths);
    }
}
