package nl.bytesoflife.deltacnc.model.operation;

import nl.bytesoflife.deltacnc.model.InvalidOperationException;
import nl.bytesoflife.deltacnc.model.Point;

/**
 * One vertex of a line cut. Arc vertices end an arc that started at the
 * previous vertex and carry the arc center.
 */
public record PathPoint(double x, double y, PathPointKind kind, Point arcCenter, ArcDirection arcDirection) {

    public PathPoint {
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            throw new InvalidOperationException("Path point coordinates must be finite: " + x + ", " + y);
        }
        if (kind == null) {
            throw new InvalidOperationException("Path point kind is required");
        }
        if (kind == PathPointKind.ARC && arcCenter == null) {
            throw new InvalidOperationException(
                    "Arc path point at (" + x + ", " + y + ") is missing its arc center");
        }
        if (arcDirection == null) {
            arcDirection = ArcDirection.CW;
        }
    }

    public static PathPoint start(double x, double y) {
        return new PathPoint(x, y, PathPointKind.START, null, null);
    }

    public static PathPoint straight(double x, double y) {
        return new PathPoint(x, y, PathPointKind.STRAIGHT, null, null);
    }

    public static PathPoint arc(double x, double y, Point center) {
        return new PathPoint(x, y, PathPointKind.ARC, center, ArcDirection.CW);
    }

    public static PathPoint arc(double x, double y, Point center, ArcDirection direction) {
        return new PathPoint(x, y, PathPointKind.ARC, center, direction);
    }

    public Point position() {
        return new Point(x, y);
    }

    /**
     * Same location and arc data, different kind. Used when a split path
     * needs a fresh start vertex.
     */
    public PathPoint withKind(PathPointKind newKind) {
        return new PathPoint(x, y, newKind, newKind == PathPointKind.ARC ? arcCenter : null, arcDirection);
    }
}
