package nl.bytesoflife.deltacnc.model;

/**
 * Feeds, speeds and depths for one generation call. All lengths in inches,
 * rates in inches per minute.
 *
 * @param spindleSpeed   spindle RPM
 * @param feedRate       cutting feed
 * @param plungeRate     Z plunge feed
 * @param peckingDepth   depth increment per drilling peck
 * @param passDepth      depth increment per cutting pass
 * @param materialDepth  total depth to reach
 * @param safetyHeight   Z for moves between operations
 * @param travelHeight   Z just above the stock, also the canned-cycle retract plane
 */
public record MachiningParams(
        int spindleSpeed,
        double feedRate,
        double plungeRate,
        double peckingDepth,
        double passDepth,
        double materialDepth,
        double safetyHeight,
        double travelHeight
) {
    public MachiningParams {
        if (spindleSpeed <= 0) {
            throw new InvalidOperationException("Spindle speed must be > 0, got " + spindleSpeed);
        }
        requirePositive("Feed rate", feedRate);
        requirePositive("Plunge rate", plungeRate);
        requirePositive("Pecking depth", peckingDepth);
        requirePositive("Pass depth", passDepth);
        requirePositive("Material depth", materialDepth);
        requirePositive("Travel height", travelHeight);
        if (!(safetyHeight >= travelHeight)) {
            throw new InvalidOperationException(
                    "Safety height (" + safetyHeight + ") must be >= travel height (" + travelHeight + ")");
        }
    }

    public MachiningParams withMaterialDepth(double depth) {
        return new MachiningParams(spindleSpeed, feedRate, plungeRate, peckingDepth, passDepth,
                depth, safetyHeight, travelHeight);
    }

    private static void requirePositive(String name, double value) {
        // NaN fails this check as well
        if (!(value > 0)) {
            throw new InvalidOperationException(name + " must be > 0, got " + value);
        }
    }
}
