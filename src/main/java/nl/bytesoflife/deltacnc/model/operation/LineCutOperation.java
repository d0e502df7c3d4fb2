package nl.bytesoflife.deltacnc.model.operation;

import nl.bytesoflife.deltacnc.model.InvalidOperationException;

import java.util.List;

/**
 * A cut along an ordered path of straight and arc segments, optionally closed
 * back to its first vertex.
 */
public record LineCutOperation(String sourceId, List<PathPoint> points, boolean closed) {

    public LineCutOperation {
        OperationChecks.requireSource(sourceId);
        if (points == null || points.isEmpty()) {
            throw new InvalidOperationException("Line cut " + sourceId + " has no points");
        }
        points = List.copyOf(points);
        if (points.get(0).kind() != PathPointKind.START) {
            throw new InvalidOperationException("Line cut " + sourceId + " must begin with a start point");
        }
        for (int i = 1; i < points.size(); i++) {
            if (points.get(i).kind() == PathPointKind.START) {
                throw new InvalidOperationException(
                        "Line cut " + sourceId + " has a second start point at index " + i);
            }
        }
        if (closed && points.size() < 2) {
            throw new InvalidOperationException("Closed line cut " + sourceId + " needs at least 2 points");
        }
    }
}
