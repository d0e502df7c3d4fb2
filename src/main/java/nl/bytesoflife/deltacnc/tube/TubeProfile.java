package nl.bytesoflife.deltacnc.tube;

import nl.bytesoflife.deltacnc.model.InvalidOperationException;

/**
 * Cross-section of rectangular tube stock seen from the machined face.
 * The hollow interior is inset by the wall thickness on all four sides.
 *
 * @param outerWidth    outside width in inches
 * @param outerHeight   outside height in inches
 * @param wallThickness wall thickness in inches
 */
public record TubeProfile(double outerWidth, double outerHeight, double wallThickness) {

    public TubeProfile {
        if (!(outerWidth > 0) || !(outerHeight > 0)) {
            throw new InvalidOperationException(
                    "Tube outer size must be > 0, got " + outerWidth + " x " + outerHeight);
        }
        if (!(wallThickness > 0)) {
            throw new InvalidOperationException("Tube wall thickness must be > 0, got " + wallThickness);
        }
        if (wallThickness >= outerWidth / 2 || wallThickness >= outerHeight / 2) {
            throw new InvalidOperationException("Tube wall thickness " + wallThickness
                    + " leaves no void in a " + outerWidth + " x " + outerHeight + " profile");
        }
    }

    public VoidBounds voidBounds() {
        return new VoidBounds(
                wallThickness,
                wallThickness,
                outerWidth - wallThickness,
                outerHeight - wallThickness);
    }
}
