package nl.bytesoflife.deltacnc.validation.check;

import nl.bytesoflife.deltacnc.gcode.GcodeGenerator;
import nl.bytesoflife.deltacnc.job.CncJob;
import nl.bytesoflife.deltacnc.model.geometry.ExpandedCircle;
import nl.bytesoflife.deltacnc.model.geometry.ExpandedGeometry;
import nl.bytesoflife.deltacnc.validation.ValidationIssue;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Warns about circular cuts the selected tool is too large for. Generation skips them.
 */
public class ToolFitCheck implements JobCheck {

    @Override
    public String getName() {
        return "Tool fit";
    }

    @Override
    public List<ValidationIssue> check(CncJob job, ExpandedGeometry geometry) {
        List<ValidationIssue> issues = new ArrayList<>();
        if (job.getTool() == null) return issues;

        double toolDiameter = job.getTool().diameter();
        for (ExpandedCircle c : geometry.circles()) {
            if (GcodeGenerator.cutRadius(c.diameter(), toolDiameter) <= 0) {
                issues.add(ValidationIssue.warning(getName(), String.format(Locale.US,
                        "Tool D%.4f does not fit circular cut D%.4f of %s; it will be skipped",
                        toolDiameter, c.diameter(), c.sourceId()), c.sourceId(), c.x(), c.y()));
            }
        }
        return issues;
    }
}
