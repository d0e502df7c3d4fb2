package nl.bytesoflife.deltacnc.model.geometry;

import nl.bytesoflife.deltacnc.model.operation.PathPoint;

import java.util.List;

/**
 * A concrete line cut. The first point is always a start vertex.
 */
public record ExpandedPath(String sourceId, List<PathPoint> points, boolean closed) {

    public ExpandedPath {
        points = List.copyOf(points);
    }

    public PathPoint first() {
        return points.get(0);
    }
}
