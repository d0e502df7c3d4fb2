package nl.bytesoflife.deltacnc.job;

import nl.bytesoflife.deltacnc.model.Axis;
import nl.bytesoflife.deltacnc.model.InvalidOperationException;
import nl.bytesoflife.deltacnc.model.MachineCapabilities;
import nl.bytesoflife.deltacnc.model.MachiningParams;
import nl.bytesoflife.deltacnc.model.MaterialStock;
import nl.bytesoflife.deltacnc.model.OperationType;
import nl.bytesoflife.deltacnc.model.Point;
import nl.bytesoflife.deltacnc.model.Tool;
import nl.bytesoflife.deltacnc.model.geometry.ExpandedGeometry;
import nl.bytesoflife.deltacnc.model.geometry.ExpandedPath;
import nl.bytesoflife.deltacnc.model.operation.CircularCutOperation;
import nl.bytesoflife.deltacnc.model.operation.DrillOperation;
import nl.bytesoflife.deltacnc.model.operation.LineCutOperation;
import nl.bytesoflife.deltacnc.model.operation.PathPoint;
import nl.bytesoflife.deltacnc.model.operation.PathPointKind;
import nl.bytesoflife.deltacnc.tube.TubeProfile;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JobRunnerTest {

    private static final MachiningParams PARAMS = new MachiningParams(12000, 20, 5, 0.05, 0.1, 0.25, 0.5, 0.1);
    private static final MachineCapabilities MACHINE = new MachineCapabilities(true, true, 24, 24);

    // Void spans (0.25, 0.25) .. (3.75, 1.75)
    private static final MaterialStock TUBE = new MaterialStock("2x4 tube", 4, 2, 0.25, new TubeProfile(4, 2, 0.25));

    private final JobRunner runner = new JobRunner();

    @Test
    void drillPointsInsideVoidAreSkippedInBothOutputs() {
        CncJob job = tubeJob(true)
                .addDrill(new DrillOperation.LinearPattern("row", new Point(0.125, 1), Axis.X, 1, 4));

        JobResult result = runner.run(job, OperationType.DRILL);

        assertEquals(1, result.geometry().drillPoints().size());
        assertTrue(result.gcode().contains("; Drilling 1 holes"));
        assertTrue(result.gcode().contains("G99 G83 X3.175 Y25.400 Z-6.350 R2.540 Q1.270 F127.0"));
        assertEquals(1, countOccurrences(result.previewSvg(), "class=\"drill\""));
        assertTrue(result.previewSvg().contains("class=\"tube-void\""));
    }

    @Test
    void voidSkippingOffKeepsEverything() {
        CncJob job = tubeJob(false)
                .addDrill(new DrillOperation.LinearPattern("row", new Point(0.125, 1), Axis.X, 1, 4));

        JobResult result = runner.run(job, OperationType.DRILL);

        assertEquals(4, result.geometry().drillPoints().size());
        assertTrue(result.gcode().contains("; Drilling 4 holes"));
        assertEquals(4, countOccurrences(result.previewSvg(), "class=\"drill\""));
        assertFalse(result.previewSvg().contains("class=\"tube-void\""));
    }

    @Test
    void voidSkippingIsIgnoredForFlatStock() {
        CncJob job = new CncJob()
                .material(MaterialStock.sheet("ply", 4, 2, 0.25))
                .tool(new Tool("1/8 endmill", 0.125))
                .params(PARAMS)
                .capabilities(MACHINE)
                .skipTubeVoid(true)
                .addDrill(new DrillOperation.Single("center", 2, 1));

        assertFalse(job.isTubeVoidActive());
        assertNull(job.getActiveVoidBounds());
        assertEquals(1, runner.expandAndFilter(job).drillPoints().size());
    }

    @Test
    void lineCutIsSplitAroundVoid() {
        CncJob job = tubeJob(true).addLineCut(new LineCutOperation("slot", List.of(
                PathPoint.start(0.1, 1),
                PathPoint.straight(2, 1),
                PathPoint.straight(3.9, 1),
                PathPoint.straight(3.9, 1.9)), false));

        JobResult result = runner.run(job, OperationType.CUT);

        List<ExpandedPath> paths = result.geometry().paths();
        assertEquals(1, paths.size());
        assertEquals(PathPointKind.START, paths.get(0).first().kind());
        assertEquals(3.9, paths.get(0).first().x(), 1e-12);
        assertTrue(result.gcode().contains("; Line cut slot, 2 points, 3 passes"));
        assertEquals(1, countOccurrences(result.previewSvg(), "<polyline class=\"line-cut\""));
    }

    @Test
    void circleEntirelyInVoidIsDropped() {
        CncJob job = tubeJob(true)
                .addCircularCut(new CircularCutOperation.Single("inside", new Point(2, 1), 0.5))
                .addCircularCut(new CircularCutOperation.Single("on-wall", new Point(0.25, 1), 0.2));

        ExpandedGeometry geometry = runner.expandAndFilter(job);

        assertEquals(1, geometry.circles().size());
        assertEquals("on-wall", geometry.circles().get(0).sourceId());
    }

    @Test
    void outputsCoverOnlyTheRequestedOperationType() {
        CncJob job = tubeJob(false)
                .addDrill(new DrillOperation.Single("pin", 0.125, 1))
                .addCircularCut(new CircularCutOperation.Single("hole", new Point(2, 1), 0.5));

        JobResult cut = runner.run(job, OperationType.CUT);
        JobResult drill = runner.run(job, OperationType.DRILL);

        assertTrue(cut.geometry().drillPoints().isEmpty());
        assertEquals(1, cut.geometry().circles().size());
        assertEquals(0, countOccurrences(cut.previewSvg(), "class=\"drill\""));
        assertEquals(1, countOccurrences(cut.previewSvg(), "class=\"circle-cut\""));

        assertTrue(drill.geometry().circles().isEmpty());
        assertEquals(1, countOccurrences(drill.previewSvg(), "class=\"drill\""));
        assertEquals(0, countOccurrences(drill.previewSvg(), "class=\"circle-cut\""));
    }

    @Test
    void sameJobGivesSameOutput() {
        CncJob job = tubeJob(true)
                .addCircularCut(new CircularCutOperation.LinearPattern("holes", new Point(0.125, 1), 0.5, Axis.X, 1, 3));

        JobResult first = runner.run(job, OperationType.CUT);
        JobResult second = runner.run(job, OperationType.CUT);

        assertEquals(first.gcode(), second.gcode());
        assertEquals(first.previewSvg(), second.previewSvg());
    }

    @Test
    void cuttingWithoutToolFails() {
        CncJob job = tubeJob(true).tool(null)
                .addCircularCut(new CircularCutOperation.Single("hole", new Point(0.125, 1), 0.5));

        assertThrows(InvalidOperationException.class, () -> runner.run(job, OperationType.CUT));
    }

    @Test
    void incompleteJobIsRejected() {
        assertThrows(InvalidOperationException.class,
                () -> runner.run(new CncJob().params(PARAMS).capabilities(MACHINE), OperationType.DRILL));
        assertThrows(InvalidOperationException.class,
                () -> runner.run(new CncJob().material(TUBE).capabilities(MACHINE), OperationType.DRILL));
        assertThrows(InvalidOperationException.class,
                () -> runner.run(new CncJob().material(TUBE).params(PARAMS), OperationType.DRILL));
    }

    @Test
    void validateDelegatesToValidator() {
        CncJob job = tubeJob(true).tool(null);

        assertTrue(runner.validate(job).hasErrors());
    }

    private static CncJob tubeJob(boolean skipVoid) {
        return new CncJob()
                .material(TUBE)
                .tool(new Tool("1/8 endmill", 0.125))
                .params(PARAMS)
                .capabilities(MACHINE)
                .skipTubeVoid(skipVoid);
    }

    private static int countOccurrences(String text, String fragment) {
        int count = 0;
        int index = text.indexOf(fragment);
        while (index >= 0) {
            count++;
            index = text.indexOf(fragment, index + fragment.length());
        }
        return count;
    }
}
