package nl.bytesoflife.deltacnc.model.geometry;

/**
 * A concrete circular cut with its finished diameter.
 */
public record ExpandedCircle(double x, double y, double diameter, String sourceId) {

    public double radius() {
        return diameter / 2;
    }
}
