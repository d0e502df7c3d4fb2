package nl.bytesoflife.deltacnc.model;

/**
 * What the target controller understands, plus its travel limits in inches.
 *
 * @param supportsLoops         controller accepts parameterized while-loops (o-words)
 * @param supportsCannedCycles  controller accepts G83 peck drilling
 * @param maxX                  X travel from the origin
 * @param maxY                  Y travel from the origin
 */
public record MachineCapabilities(
        boolean supportsLoops,
        boolean supportsCannedCycles,
        double maxX,
        double maxY
) {
    public MachineCapabilities {
        if (!(maxX > 0) || !(maxY > 0)) {
            throw new InvalidOperationException("Machine travel must be > 0, got " + maxX + " x " + maxY);
        }
    }
}
