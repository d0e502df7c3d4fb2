package nl.bytesoflife.deltacnc.model.geometry;

import nl.bytesoflife.deltacnc.model.OperationType;

import java.util.List;

/**
 * The geometry of one job after expansion and optional void filtering.
 * Produced once per call and handed unchanged to both the G-code generator
 * and the preview renderer. List order is machining order.
 */
public record ExpandedGeometry(
        List<ExpandedPoint> drillPoints,
        List<ExpandedCircle> circles,
        List<ExpandedPath> paths
) {
    public ExpandedGeometry {
        drillPoints = List.copyOf(drillPoints);
        circles = List.copyOf(circles);
        paths = List.copyOf(paths);
    }

    public static ExpandedGeometry empty() {
        return new ExpandedGeometry(List.of(), List.of(), List.of());
    }

    /**
     * The part a program of the given type machines: drill points for drilling,
     * circles and paths for cutting.
     */
    public ExpandedGeometry select(OperationType type) {
        return type == OperationType.DRILL
                ? new ExpandedGeometry(drillPoints, List.of(), List.of())
                : new ExpandedGeometry(List.of(), circles, paths);
    }

    public boolean isEmpty() {
        return drillPoints.isEmpty() && circles.isEmpty() && paths.isEmpty();
    }

    @Override
    public String toString() {
        return "ExpandedGeometry{drillPoints=" + drillPoints.size()
                + ", circles=" + circles.size()
                + ", paths=" + paths.size() + "}";
    }
}
