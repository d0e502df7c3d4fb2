package nl.bytesoflife.deltacnc.gcode;

import nl.bytesoflife.deltacnc.model.MachineCapabilities;

/**
 * How drilling and circular cutting are encoded for one generation call,
 * resolved once from the machine's capability flags.
 */
public record EmissionStrategy(DrillMode drillMode, CutMode cutMode) {

    public enum DrillMode {
        /** One G83 block, further points only carry X/Y. */
        CANNED_CYCLE,
        /** Explicit G1 pecks with G0 retracts per point. */
        MANUAL_PECK
    }

    public enum CutMode {
        /** One o-word while loop per circle. */
        PARAMETRIC_LOOP,
        /** Every pass written out literally. */
        UNROLLED
    }

    public static EmissionStrategy from(MachineCapabilities capabilities) {
        return new EmissionStrategy(
                capabilities.supportsCannedCycles() ? DrillMode.CANNED_CYCLE : DrillMode.MANUAL_PECK,
                capabilities.supportsLoops() ? CutMode.PARAMETRIC_LOOP : CutMode.UNROLLED);
    }
}
