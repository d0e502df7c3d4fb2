package nl.bytesoflife.deltacnc.job;

import nl.bytesoflife.deltacnc.gcode.GcodeGenerator;
import nl.bytesoflife.deltacnc.gcode.GcodeProgram;
import nl.bytesoflife.deltacnc.model.InvalidOperationException;
import nl.bytesoflife.deltacnc.model.OperationType;
import nl.bytesoflife.deltacnc.model.geometry.ExpandedGeometry;
import nl.bytesoflife.deltacnc.pattern.PatternExpander;
import nl.bytesoflife.deltacnc.renderer.svg.PreviewSvgRenderer;
import nl.bytesoflife.deltacnc.tube.TubeVoidFilter;
import nl.bytesoflife.deltacnc.validation.JobValidator;
import nl.bytesoflife.deltacnc.validation.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the generation pipeline for a job: expand the operations, filter out the tube
 * void when requested, keep the part the requested operation type machines, then emit
 * G-code and render the preview from that one geometry.
 *
 * <pre>
 * JobResult result = new JobRunner().run(job, OperationType.CUT);
 * Files.writeString(out, result.gcode());
 * </pre>
 */
public class JobRunner {

    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);

    private final PatternExpander expander = new PatternExpander();
    private final GcodeGenerator generator = new GcodeGenerator();
    private PreviewSvgRenderer renderer = new PreviewSvgRenderer();
    private JobValidator validator = JobValidator.withDefaultChecks();

    public JobRunner withRenderer(PreviewSvgRenderer renderer) {
        this.renderer = renderer;
        return this;
    }

    public JobRunner withValidator(JobValidator validator) {
        this.validator = validator;
        return this;
    }

    public JobResult run(CncJob job, OperationType type) {
        requireReady(job);
        long startTime = System.currentTimeMillis();

        ExpandedGeometry geometry = expandAndFilter(job).select(type);
        GcodeProgram program = generator.generate(type, geometry, job.getTool(),
                job.getParams(), job.getCapabilities());
        String svg = renderer.render(geometry, job.getMaterial().width(), job.getMaterial().height(),
                job.getActiveVoidBounds());

        log.info("Generated {} job on '{}' in {}ms: {}, {} G-code lines, {} chars SVG",
                type, job.getMaterial().name(), System.currentTimeMillis() - startTime,
                geometry, program.getLines().size(), svg.length());
        return new JobResult(type, geometry, program, svg);
    }

    /**
     * Expanded geometry with the tube void removed when void skipping is active.
     */
    public ExpandedGeometry expandAndFilter(CncJob job) {
        ExpandedGeometry geometry = expander.expand(
                job.getDrillOperations(), job.getCircularCuts(), job.getLineCuts());
        if (!job.isTubeVoidActive()) {
            return geometry;
        }
        double toolRadius = job.getTool() != null ? job.getTool().radius() : 0;
        return new TubeVoidFilter(job.getMaterial().tubeProfile()).filter(geometry, toolRadius);
    }

    /**
     * Read-only check of the job. Does not require generation to succeed.
     */
    public ValidationReport validate(CncJob job) {
        return validator.validate(job);
    }

    private static void requireReady(CncJob job) {
        if (job.getMaterial() == null) {
            throw new InvalidOperationException("Job has no material");
        }
        if (job.getParams() == null) {
            throw new InvalidOperationException("Job has no machining parameters");
        }
        if (job.getCapabilities() == null) {
            throw new InvalidOperationException("Job has no machine capabilities");
        }
    }
}
