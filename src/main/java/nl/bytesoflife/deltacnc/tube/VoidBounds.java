package nl.bytesoflife.deltacnc.tube;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;

/**
 * The hollow rectangle of a tube, in inches.
 */
public record VoidBounds(double xMin, double yMin, double xMax, double yMax) {

    public double width() {
        return xMax - xMin;
    }

    public double height() {
        return yMax - yMin;
    }

    /**
     * True only when a disc of the given radius around (x, y) lies strictly inside.
     * Touching the boundary counts as material.
     */
    public boolean containsStrictly(double x, double y, double radius) {
        return x - radius > xMin && x + radius < xMax
                && y - radius > yMin && y + radius < yMax;
    }

    public Polygon toPolygon(GeometryFactory factory) {
        return factory.createPolygon(new Coordinate[]{
                new Coordinate(xMin, yMin),
                new Coordinate(xMax, yMin),
                new Coordinate(xMax, yMax),
                new Coordinate(xMin, yMax),
                new Coordinate(xMin, yMin)
        });
    }
}
