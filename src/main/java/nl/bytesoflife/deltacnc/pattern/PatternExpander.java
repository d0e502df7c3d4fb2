package nl.bytesoflife.deltacnc.pattern;

import nl.bytesoflife.deltacnc.model.Axis;
import nl.bytesoflife.deltacnc.model.InvalidOperationException;
import nl.bytesoflife.deltacnc.model.Point;
import nl.bytesoflife.deltacnc.model.geometry.ExpandedCircle;
import nl.bytesoflife.deltacnc.model.geometry.ExpandedGeometry;
import nl.bytesoflife.deltacnc.model.geometry.ExpandedPath;
import nl.bytesoflife.deltacnc.model.geometry.ExpandedPoint;
import nl.bytesoflife.deltacnc.model.operation.CircularCutOperation;
import nl.bytesoflife.deltacnc.model.operation.DrillOperation;
import nl.bytesoflife.deltacnc.model.operation.LineCutOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns compact pattern descriptions into concrete coordinates.
 *
 * The order of the returned points is the machining traversal order, so callers
 * must not re-sort them.
 */
public class PatternExpander {

    private static final Logger log = LoggerFactory.getLogger(PatternExpander.class);

    /**
     * Points along one axis: point i is {@code start + i * spacing} on {@code axis},
     * the other coordinate fixed at the start value.
     */
    public List<ExpandedPoint> expandLinear(Point start, Axis axis, double spacing, int count, String sourceId) {
        requireCount(count, "count");
        requireSpacing(spacing, "spacing");

        List<ExpandedPoint> points = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            double offset = i * spacing;
            if (axis == Axis.X) {
                points.add(new ExpandedPoint(start.x() + offset, start.y(), sourceId));
            } else {
                points.add(new ExpandedPoint(start.x(), start.y() + offset, sourceId));
            }
        }
        return points;
    }

    /**
     * Row-major grid: rows (y) in the outer loop, columns (x) in the inner loop.
     * Row 0 is the start row.
     */
    public List<ExpandedPoint> expandGrid(Point start, double xSpacing, double ySpacing,
                                          int xCount, int yCount, String sourceId) {
        requireCount(xCount, "x count");
        requireCount(yCount, "y count");
        requireSpacing(xSpacing, "x spacing");
        requireSpacing(ySpacing, "y spacing");

        List<ExpandedPoint> points = new ArrayList<>(xCount * yCount);
        for (int row = 0; row < yCount; row++) {
            for (int col = 0; col < xCount; col++) {
                points.add(new ExpandedPoint(
                        start.x() + col * xSpacing,
                        start.y() + row * ySpacing,
                        sourceId));
            }
        }
        return points;
    }

    /**
     * Points evenly spaced on a circle, angles measured counter-clockwise from +X.
     */
    public List<ExpandedPoint> expandCircular(Point center, double radius, int count,
                                              double startAngleDeg, String sourceId) {
        requireCount(count, "count");
        if (!(radius > 0)) {
            throw new InvalidOperationException("Pattern radius must be > 0, got " + radius);
        }

        List<ExpandedPoint> points = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            double angle = Math.toRadians(startAngleDeg + i * 360.0 / count);
            points.add(new ExpandedPoint(
                    center.x() + radius * Math.cos(angle),
                    center.y() + radius * Math.sin(angle),
                    sourceId));
        }
        return points;
    }

    public List<ExpandedPoint> expandDrill(DrillOperation op) {
        if (op instanceof DrillOperation.Single single) {
            return List.of(new ExpandedPoint(single.position().x(), single.position().y(), single.sourceId()));
        } else if (op instanceof DrillOperation.LinearPattern linear) {
            return expandLinear(linear.start(), linear.axis(), linear.spacing(), linear.count(), linear.sourceId());
        } else if (op instanceof DrillOperation.GridPattern grid) {
            return expandGrid(grid.start(), grid.xSpacing(), grid.ySpacing(),
                    grid.xCount(), grid.yCount(), grid.sourceId());
        } else if (op instanceof DrillOperation.CircularPattern circular) {
            return expandCircular(circular.center(), circular.radius(), circular.count(),
                    circular.startAngleDeg(), circular.sourceId());
        }
        throw new IllegalStateException("Unhandled drill operation: " + op);
    }

    public List<ExpandedCircle> expandCircle(CircularCutOperation op) {
        if (op instanceof CircularCutOperation.Single single) {
            return List.of(new ExpandedCircle(
                    single.center().x(), single.center().y(), single.diameter(), single.sourceId()));
        } else if (op instanceof CircularCutOperation.LinearPattern linear) {
            List<ExpandedCircle> circles = new ArrayList<>(linear.count());
            for (ExpandedPoint center : expandLinear(linear.startCenter(), linear.axis(),
                    linear.spacing(), linear.count(), linear.sourceId())) {
                circles.add(new ExpandedCircle(center.x(), center.y(), linear.diameter(), linear.sourceId()));
            }
            return circles;
        }
        throw new IllegalStateException("Unhandled circular cut operation: " + op);
    }

    /**
     * Expand all operations of a job. Each list keeps its input order.
     */
    public ExpandedGeometry expand(List<DrillOperation> drills,
                                   List<CircularCutOperation> circles,
                                   List<LineCutOperation> lines) {
        List<ExpandedPoint> drillPoints = new ArrayList<>();
        for (DrillOperation op : drills) {
            drillPoints.addAll(expandDrill(op));
        }

        List<ExpandedCircle> expandedCircles = new ArrayList<>();
        for (CircularCutOperation op : circles) {
            expandedCircles.addAll(expandCircle(op));
        }

        List<ExpandedPath> paths = new ArrayList<>(lines.size());
        for (LineCutOperation op : lines) {
            paths.add(new ExpandedPath(op.sourceId(), op.points(), op.closed()));
        }

        ExpandedGeometry geometry = new ExpandedGeometry(drillPoints, expandedCircles, paths);
        log.debug("Expanded {} drill, {} circle and {} line operations into {}",
                drills.size(), circles.size(), lines.size(), geometry);
        return geometry;
    }

    private static void requireCount(int count, String name) {
        if (count < 1) {
            throw new InvalidOperationException("Pattern " + name + " must be >= 1, got " + count);
        }
    }

    private static void requireSpacing(double spacing, String name) {
        if (!(spacing > 0)) {
            throw new InvalidOperationException("Pattern " + name + " must be > 0, got " + spacing);
        }
    }
}
