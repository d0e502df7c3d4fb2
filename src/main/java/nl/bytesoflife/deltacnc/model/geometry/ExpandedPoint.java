package nl.bytesoflife.deltacnc.model.geometry;

import nl.bytesoflife.deltacnc.model.Point;

/**
 * A concrete drill location. No pattern metadata survives expansion.
 */
public record ExpandedPoint(double x, double y, String sourceId) {

    public Point position() {
        return new Point(x, y);
    }
}
