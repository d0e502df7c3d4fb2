package nl.bytesoflife.deltacnc.validation.check;

import nl.bytesoflife.deltacnc.job.CncJob;
import nl.bytesoflife.deltacnc.model.geometry.ExpandedGeometry;
import nl.bytesoflife.deltacnc.validation.ValidationIssue;

import java.util.List;

public class ToolSelectionCheck implements JobCheck {

    @Override
    public String getName() {
        return "Tool selection";
    }

    @Override
    public List<ValidationIssue> check(CncJob job, ExpandedGeometry geometry) {
        if (job.getTool() == null) {
            return List.of(ValidationIssue.error(getName(), "No tool selected"));
        }
        return List.of();
    }
}
