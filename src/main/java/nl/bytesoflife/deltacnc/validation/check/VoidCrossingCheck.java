package nl.bytesoflife.deltacnc.validation.check;

import nl.bytesoflife.deltacnc.job.CncJob;
import nl.bytesoflife.deltacnc.model.geometry.ExpandedGeometry;
import nl.bytesoflife.deltacnc.model.geometry.ExpandedPath;
import nl.bytesoflife.deltacnc.model.operation.PathPoint;
import nl.bytesoflife.deltacnc.tube.TubeVoidFilter;
import nl.bytesoflife.deltacnc.validation.ValidationIssue;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.Polygon;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reports line-cut segments that survive void splitting but still pass through the
 * tube void. Splitting only tests vertices, so these segments are generated as-is;
 * this check makes them visible without changing the generated program.
 * Arc segments are approximated by their chord.
 */
public class VoidCrossingCheck implements JobCheck {

    // Interiors intersect; touching the void boundary is not a crossing
    private static final String INTERIORS_INTERSECT = "T********";

    private final GeometryFactory factory = new GeometryFactory();

    @Override
    public String getName() {
        return "Tube void crossing";
    }

    @Override
    public List<ValidationIssue> check(CncJob job, ExpandedGeometry geometry) {
        List<ValidationIssue> issues = new ArrayList<>();
        if (!job.isTubeVoidActive()) return issues;

        TubeVoidFilter filter = new TubeVoidFilter(job.getMaterial().tubeProfile());
        Polygon voidArea = filter.getBounds().toPolygon(factory);

        for (ExpandedPath original : geometry.paths()) {
            for (ExpandedPath piece : filter.splitPath(original)) {
                List<PathPoint> points = piece.points();
                for (int i = 1; i < points.size(); i++) {
                    checkSegment(points.get(i - 1), points.get(i), piece.sourceId(), voidArea, issues);
                }
                if (piece.closed() && points.size() > 1) {
                    checkSegment(points.get(points.size() - 1), points.get(0), piece.sourceId(), voidArea, issues);
                }
            }
        }
        return issues;
    }

    private void checkSegment(PathPoint from, PathPoint to, String sourceId, Polygon voidArea,
                              List<ValidationIssue> issues) {
        LineString segment = factory.createLineString(new Coordinate[]{
                new Coordinate(from.x(), from.y()),
                new Coordinate(to.x(), to.y())
        });
        if (segment.relate(voidArea, INTERIORS_INTERSECT)) {
            issues.add(ValidationIssue.warning(getName(), String.format(Locale.US,
                    "Segment (%.3f, %.3f) -> (%.3f, %.3f) of %s crosses the tube void and will not be skipped",
                    from.x(), from.y(), to.x(), to.y(), sourceId),
                    sourceId, (from.x() + to.x()) / 2, (from.y() + to.y()) / 2));
        }
    }
}
