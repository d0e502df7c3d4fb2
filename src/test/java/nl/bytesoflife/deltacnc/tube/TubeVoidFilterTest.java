package nl.bytesoflife.deltacnc.tube;

import nl.bytesoflife.deltacnc.model.InvalidOperationException;
import nl.bytesoflife.deltacnc.model.Point;
import nl.bytesoflife.deltacnc.model.geometry.ExpandedCircle;
import nl.bytesoflife.deltacnc.model.geometry.ExpandedGeometry;
import nl.bytesoflife.deltacnc.model.geometry.ExpandedPath;
import nl.bytesoflife.deltacnc.model.geometry.ExpandedPoint;
import nl.bytesoflife.deltacnc.model.operation.PathPoint;
import nl.bytesoflife.deltacnc.model.operation.PathPointKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TubeVoidFilterTest {

    // 2 x 1 tube with 0.125 walls: void spans (0.125, 0.125) .. (1.875, 0.875)
    private final TubeProfile profile = new TubeProfile(2, 1, 0.125);
    private final TubeVoidFilter filter = new TubeVoidFilter(profile);

    @Test
    void voidBoundsAreInsetByWallThickness() {
        VoidBounds bounds = TubeVoidFilter.voidBounds(profile);
        assertEquals(0.125, bounds.xMin(), 1e-12);
        assertEquals(0.125, bounds.yMin(), 1e-12);
        assertEquals(1.875, bounds.xMax(), 1e-12);
        assertEquals(0.875, bounds.yMax(), 1e-12);
    }

    @Test
    void rejectsWallThatLeavesNoVoid() {
        assertThrows(InvalidOperationException.class, () -> new TubeProfile(2, 1, 0.5));
        assertThrows(InvalidOperationException.class, () -> new TubeProfile(2, 1, 0));
    }

    @Test
    void centerPointIsInVoidWithAndWithoutToolRadius() {
        assertTrue(filter.pointInVoid(new Point(1.0, 0.5), 0.05));
        assertTrue(filter.pointInVoid(new Point(1.0, 0.5), 0));
    }

    @Test
    void pointOnWallIsMaterial() {
        assertFalse(filter.pointInVoid(new Point(0.1, 0.1), 0.05));
        assertFalse(filter.pointInVoid(new Point(0.1, 0.1), 0));
    }

    @Test
    void toolEdgeFlushWithVoidBoundaryIsMaterial() {
        // x - r == xMin exactly
        assertFalse(filter.pointInVoid(new Point(0.25, 0.5), 0.125));
        // y + r == yMax exactly
        assertFalse(filter.pointInVoid(new Point(1.0, 0.75), 0.125));
        // just inside
        assertTrue(filter.pointInVoid(new Point(0.2501, 0.5), 0.125));
    }

    @Test
    void filterDrillPointsKeepsSurvivorOrder() {
        List<ExpandedPoint> points = List.of(
                new ExpandedPoint(0.1, 0.1, "a"),
                new ExpandedPoint(1.0, 0.5, "b"),
                new ExpandedPoint(1.95, 0.5, "c"),
                new ExpandedPoint(1.2, 0.4, "d"),
                new ExpandedPoint(0.5, 0.05, "e"));

        List<ExpandedPoint> kept = filter.filterDrillPoints(points, 0.05);

        assertEquals(List.of("a", "c", "e"), kept.stream().map(ExpandedPoint::sourceId).toList());
    }

    @Test
    void splitPathDropsVoidPointsAndSplitsRuns() {
        List<Point> path = List.of(
                new Point(0.05, 0.5),
                new Point(0.1, 0.5),
                new Point(1.0, 0.5),
                new Point(1.9, 0.5),
                new Point(1.95, 0.5));

        List<List<Point>> runs = filter.splitPathAroundVoid(path);

        assertEquals(2, runs.size());
        assertEquals(List.of(new Point(0.05, 0.5), new Point(0.1, 0.5)), runs.get(0));
        assertEquals(List.of(new Point(1.9, 0.5), new Point(1.95, 0.5)), runs.get(1));
    }

    @Test
    void segmentCrossingVoidWithoutInteriorVertexIsNotSplit() {
        // Both endpoints sit in the walls, the segment runs straight through the void
        List<Point> path = List.of(new Point(0.05, 0.5), new Point(1.95, 0.5));

        List<List<Point>> runs = filter.splitPathAroundVoid(path);

        assertEquals(1, runs.size());
        assertEquals(path, runs.get(0));
    }

    @Test
    void splitPathWithAllPointsInVoidYieldsNothing() {
        List<Point> path = List.of(new Point(0.5, 0.5), new Point(1.0, 0.5));
        assertTrue(filter.splitPathAroundVoid(path).isEmpty());
    }

    @Test
    void untouchedPathKeepsClosedFlag() {
        ExpandedPath path = new ExpandedPath("p", List.of(
                PathPoint.start(0.05, 0.05),
                PathPoint.straight(1.95, 0.05),
                PathPoint.straight(1.95, 0.95)), true);

        List<ExpandedPath> pieces = filter.splitPath(path);

        assertEquals(1, pieces.size());
        assertSame(path, pieces.get(0));
    }

    @Test
    void splitPiecesAreOpenAndStartWithStartVertex() {
        ExpandedPath path = new ExpandedPath("p", List.of(
                PathPoint.start(0.05, 0.5),
                PathPoint.straight(0.1, 0.5),
                PathPoint.straight(1.0, 0.5),
                PathPoint.arc(1.9, 0.5, new Point(1.9, 0.7)),
                PathPoint.straight(1.95, 0.5),
                PathPoint.straight(1.0, 0.6),
                PathPoint.straight(1.97, 0.6)), true);

        List<ExpandedPath> pieces = filter.splitPath(path);

        // The trailing run continues into the leading one over the closing segment
        assertEquals(2, pieces.size());
        for (ExpandedPath piece : pieces) {
            assertFalse(piece.closed());
            assertEquals(PathPointKind.START, piece.first().kind());
        }
        assertEquals(3, pieces.get(0).points().size());
        assertEquals(1.97, pieces.get(0).first().x(), 1e-12);
        assertEquals(1.9, pieces.get(1).first().x(), 1e-12);
        assertEquals(PathPointKind.STRAIGHT, pieces.get(1).points().get(1).kind());
    }

    @Test
    void closingWallSegmentSurvivesSplit() {
        // A -> B (void) -> C -> D, closing D -> A runs along the left wall
        ExpandedPath path = new ExpandedPath("p", List.of(
                PathPoint.start(0.05, 0.05),
                PathPoint.straight(1.0, 0.5),
                PathPoint.straight(1.95, 0.95),
                PathPoint.straight(0.05, 0.95)), true);

        List<ExpandedPath> pieces = filter.splitPath(path);

        assertEquals(1, pieces.size());
        ExpandedPath piece = pieces.get(0);
        assertFalse(piece.closed());
        assertEquals(List.of(new Point(1.95, 0.95), new Point(0.05, 0.95), new Point(0.05, 0.05)),
                piece.points().stream().map(PathPoint::position).toList());
        assertEquals(PathPointKind.START, piece.first().kind());
        assertEquals(PathPointKind.STRAIGHT, piece.points().get(2).kind());
    }

    @Test
    void openPathDoesNotWrapAround() {
        ExpandedPath path = new ExpandedPath("p", List.of(
                PathPoint.start(0.05, 0.05),
                PathPoint.straight(1.0, 0.5),
                PathPoint.straight(1.95, 0.95),
                PathPoint.straight(0.05, 0.95)), false);

        List<ExpandedPath> pieces = filter.splitPath(path);

        assertEquals(1, pieces.size());
        assertEquals(2, pieces.get(0).points().size());
        assertEquals(1.95, pieces.get(0).first().x(), 1e-12);
    }

    @Test
    void closedPathEndingInVoidDoesNotWrapAround() {
        ExpandedPath path = new ExpandedPath("p", List.of(
                PathPoint.start(0.05, 0.05),
                PathPoint.straight(1.95, 0.05),
                PathPoint.straight(1.0, 0.5)), true);

        List<ExpandedPath> pieces = filter.splitPath(path);

        assertEquals(1, pieces.size());
        assertEquals(List.of(new Point(0.05, 0.05), new Point(1.95, 0.05)),
                pieces.get(0).points().stream().map(PathPoint::position).toList());
    }

    @Test
    void circlesEntirelyInVoidAreDropped() {
        List<ExpandedCircle> circles = List.of(
                new ExpandedCircle(1.0, 0.5, 0.5, "inside"),
                new ExpandedCircle(1.0, 0.5, 0.75, "touches"),
                new ExpandedCircle(0.0625, 0.5, 0.1, "wall"));

        List<ExpandedCircle> kept = filter.filterCircles(circles);

        assertEquals(List.of("touches", "wall"), kept.stream().map(ExpandedCircle::sourceId).toList());
    }

    @Test
    void filterAppliesToAllGeometryKinds() {
        ExpandedGeometry geometry = new ExpandedGeometry(
                List.of(new ExpandedPoint(1.0, 0.5, "void"), new ExpandedPoint(0.05, 0.05, "wall")),
                List.of(new ExpandedCircle(1.0, 0.5, 0.2, "void-circle")),
                List.of(new ExpandedPath("line", List.of(PathPoint.start(0.5, 0.5), PathPoint.straight(1.5, 0.5)), false)));

        ExpandedGeometry filtered = filter.filter(geometry, 0.05);

        assertEquals(1, filtered.drillPoints().size());
        assertEquals("wall", filtered.drillPoints().get(0).sourceId());
        assertTrue(filtered.circles().isEmpty());
        assertTrue(filtered.paths().isEmpty());
    }
}
