package nl.bytesoflife.deltacnc.validation;

import nl.bytesoflife.deltacnc.job.CncJob;
import nl.bytesoflife.deltacnc.model.geometry.ExpandedGeometry;
import nl.bytesoflife.deltacnc.pattern.PatternExpander;
import nl.bytesoflife.deltacnc.validation.check.JobCheck;
import nl.bytesoflife.deltacnc.validation.check.ToolFitCheck;
import nl.bytesoflife.deltacnc.validation.check.ToolSelectionCheck;
import nl.bytesoflife.deltacnc.validation.check.TravelBoundsCheck;
import nl.bytesoflife.deltacnc.validation.check.VoidCrossingCheck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs every registered check against a job and collects all findings.
 * Nothing is generated and the job is not modified.
 */
public class JobValidator {

    private static final Logger log = LoggerFactory.getLogger(JobValidator.class);

    private final List<JobCheck> checks = new ArrayList<>();
    private final PatternExpander expander = new PatternExpander();

    public static JobValidator withDefaultChecks() {
        return new JobValidator()
                .registerCheck(new ToolSelectionCheck())
                .registerCheck(new TravelBoundsCheck())
                .registerCheck(new ToolFitCheck())
                .registerCheck(new VoidCrossingCheck());
    }

    public JobValidator registerCheck(JobCheck check) {
        checks.add(check);
        return this;
    }

    public ValidationReport validate(CncJob job) {
        ValidationReport report = new ValidationReport();
        ExpandedGeometry geometry = expander.expand(
                job.getDrillOperations(), job.getCircularCuts(), job.getLineCuts());

        for (JobCheck check : checks) {
            for (ValidationIssue issue : check.check(job, geometry)) {
                report.addIssue(issue);
            }
        }

        log.debug("Validation finished: {} errors, {} warnings",
                report.getErrors().size(), report.getWarnings().size());
        return report;
    }
}
