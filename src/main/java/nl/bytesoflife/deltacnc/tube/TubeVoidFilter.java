package nl.bytesoflife.deltacnc.tube;

import nl.bytesoflife.deltacnc.model.Point;
import nl.bytesoflife.deltacnc.model.geometry.ExpandedCircle;
import nl.bytesoflife.deltacnc.model.geometry.ExpandedGeometry;
import nl.bytesoflife.deltacnc.model.geometry.ExpandedPath;
import nl.bytesoflife.deltacnc.model.geometry.ExpandedPoint;
import nl.bytesoflife.deltacnc.model.operation.PathPoint;
import nl.bytesoflife.deltacnc.model.operation.PathPointKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Removes geometry that would only cut air inside hollow tube stock.
 *
 * <p>Path splitting tests vertices, not segments: a segment whose endpoints are
 * both in material but which passes through the void is kept whole. See
 * {@code VoidCrossingCheck} for the validation warning that reports such segments.
 */
public class TubeVoidFilter {

    private static final Logger log = LoggerFactory.getLogger(TubeVoidFilter.class);

    private final VoidBounds bounds;

    public TubeVoidFilter(TubeProfile profile) {
        this.bounds = voidBounds(profile);
    }

    public static VoidBounds voidBounds(TubeProfile profile) {
        return profile.voidBounds();
    }

    public VoidBounds getBounds() {
        return bounds;
    }

    public boolean pointInVoid(Point point, double toolRadius) {
        return bounds.containsStrictly(point.x(), point.y(), toolRadius);
    }

    /**
     * Drop every drill point whose tool footprint sits entirely in the void.
     * Survivors keep their relative order.
     */
    public List<ExpandedPoint> filterDrillPoints(List<ExpandedPoint> points, double toolRadius) {
        List<ExpandedPoint> kept = new ArrayList<>(points.size());
        for (ExpandedPoint p : points) {
            if (!bounds.containsStrictly(p.x(), p.y(), toolRadius)) {
                kept.add(p);
            }
        }
        return kept;
    }

    /**
     * Drop every circular cut whose outer edge lies entirely in the void.
     */
    public List<ExpandedCircle> filterCircles(List<ExpandedCircle> circles) {
        List<ExpandedCircle> kept = new ArrayList<>(circles.size());
        for (ExpandedCircle c : circles) {
            if (!bounds.containsStrictly(c.x(), c.y(), c.radius())) {
                kept.add(c);
            }
        }
        return kept;
    }

    /**
     * Partition a point sequence into maximal runs of points outside the void.
     * A point in the void (zero radius) is dropped and ends the current run.
     */
    public List<List<Point>> splitPathAroundVoid(List<Point> points) {
        return splitRuns(points, Function.identity());
    }

    /**
     * Split one path around the void. An untouched path is returned as-is,
     * a split path becomes open runs of at least two vertices.
     *
     * <p>For a closed path whose first and last vertices are both in material, the
     * last run continues into the first one over the closing segment, so the two are
     * emitted as a single piece.
     */
    public List<ExpandedPath> splitPath(ExpandedPath path) {
        List<PathPoint> original = path.points();
        List<List<PathPoint>> runs = splitRuns(original, PathPoint::position);

        if (runs.size() == 1 && runs.get(0).size() == original.size()) {
            return List.of(path);
        }

        if (path.closed() && runs.size() > 1
                && runs.get(0).get(0) == original.get(0)
                && lastOf(runs.get(runs.size() - 1)) == lastOf(original)) {
            List<PathPoint> wrapped = new ArrayList<>(runs.remove(runs.size() - 1));
            // The closing segment into the old start is a straight move
            wrapped.add(runs.get(0).get(0).withKind(PathPointKind.STRAIGHT));
            wrapped.addAll(runs.get(0).subList(1, runs.get(0).size()));
            runs.set(0, wrapped);
        }

        List<ExpandedPath> pieces = new ArrayList<>(runs.size());
        for (List<PathPoint> run : runs) {
            if (run.size() < 2) {
                continue;
            }
            List<PathPoint> points = new ArrayList<>(run);
            points.set(0, run.get(0).withKind(PathPointKind.START));
            pieces.add(new ExpandedPath(path.sourceId(), points, false));
        }
        return pieces;
    }

    public ExpandedGeometry filter(ExpandedGeometry geometry, double toolRadius) {
        List<ExpandedPoint> drills = filterDrillPoints(geometry.drillPoints(), toolRadius);
        List<ExpandedCircle> circles = filterCircles(geometry.circles());

        List<ExpandedPath> paths = new ArrayList<>();
        for (ExpandedPath path : geometry.paths()) {
            paths.addAll(splitPath(path));
        }

        log.debug("Tube void filter kept {}/{} drill points, {}/{} circles, {} path pieces from {} paths",
                drills.size(), geometry.drillPoints().size(),
                circles.size(), geometry.circles().size(),
                paths.size(), geometry.paths().size());
        return new ExpandedGeometry(drills, circles, paths);
    }

    private static <T> T lastOf(List<T> items) {
        return items.get(items.size() - 1);
    }

    private <T> List<List<T>> splitRuns(List<T> items, Function<T, Point> position) {
        List<List<T>> runs = new ArrayList<>();
        List<T> current = new ArrayList<>();
        for (T item : items) {
            if (pointInVoid(position.apply(item), 0)) {
                if (!current.isEmpty()) {
                    runs.add(current);
                    current = new ArrayList<>();
                }
            } else {
                current.add(item);
            }
        }
        if (!current.isEmpty()) {
            runs.add(current);
        }
        return runs;
    }
}
