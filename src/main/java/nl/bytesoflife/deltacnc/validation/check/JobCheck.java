package nl.bytesoflife.deltacnc.validation.check;

import nl.bytesoflife.deltacnc.job.CncJob;
import nl.bytesoflife.deltacnc.model.geometry.ExpandedGeometry;
import nl.bytesoflife.deltacnc.validation.ValidationIssue;

import java.util.List;

public interface JobCheck {

    /**
     * @param geometry the job's expanded geometry before any void filtering
     */
    List<ValidationIssue> check(CncJob job, ExpandedGeometry geometry);

    String getName();
}
