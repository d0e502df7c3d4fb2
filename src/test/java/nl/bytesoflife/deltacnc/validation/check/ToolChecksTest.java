package nl.bytesoflife.deltacnc.validation.check;

import nl.bytesoflife.deltacnc.job.CncJob;
import nl.bytesoflife.deltacnc.model.Tool;
import nl.bytesoflife.deltacnc.model.geometry.ExpandedCircle;
import nl.bytesoflife.deltacnc.model.geometry.ExpandedGeometry;
import nl.bytesoflife.deltacnc.validation.Severity;
import nl.bytesoflife.deltacnc.validation.ValidationIssue;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ToolChecksTest {

    private final ToolSelectionCheck selection = new ToolSelectionCheck();
    private final ToolFitCheck fit = new ToolFitCheck();

    @Test
    void missingToolIsAnError() {
        List<ValidationIssue> issues = selection.check(new CncJob(), ExpandedGeometry.empty());

        assertEquals(1, issues.size());
        assertEquals(Severity.ERROR, issues.get(0).severity());
        assertEquals("No tool selected", issues.get(0).message());
    }

    @Test
    void selectedToolPasses() {
        assertTrue(selection.check(new CncJob().tool(new Tool("1/8 endmill", 0.125)), ExpandedGeometry.empty()).isEmpty());
    }

    @Test
    void toolLargerThanHoleIsWarned() {
        CncJob job = new CncJob().tool(new Tool("1/4 endmill", 0.25));
        ExpandedGeometry geometry = new ExpandedGeometry(List.of(), List.of(
                new ExpandedCircle(1, 1, 0.2, "small"),
                new ExpandedCircle(2, 1, 0.25, "exact"),
                new ExpandedCircle(3, 1, 0.5, "large")), List.of());

        List<ValidationIssue> issues = fit.check(job, geometry);

        assertEquals(2, issues.size());
        assertEquals("small", issues.get(0).sourceId());
        assertEquals("exact", issues.get(1).sourceId());
        assertEquals(Severity.WARNING, issues.get(0).severity());
    }

    @Test
    void fitCheckIsSilentWithoutTool() {
        ExpandedGeometry geometry = new ExpandedGeometry(List.of(),
                List.of(new ExpandedCircle(1, 1, 0.2, "small")), List.of());

        assertTrue(fit.check(new CncJob(), geometry).isEmpty());
    }
}
