package nl.bytesoflife.deltacnc.gcode;

import nl.bytesoflife.deltacnc.model.InvalidOperationException;
import nl.bytesoflife.deltacnc.model.MachineCapabilities;
import nl.bytesoflife.deltacnc.model.MachiningParams;
import nl.bytesoflife.deltacnc.model.OperationType;
import nl.bytesoflife.deltacnc.model.Tool;
import nl.bytesoflife.deltacnc.model.geometry.ExpandedCircle;
import nl.bytesoflife.deltacnc.model.geometry.ExpandedGeometry;
import nl.bytesoflife.deltacnc.model.geometry.ExpandedPath;
import nl.bytesoflife.deltacnc.model.geometry.ExpandedPoint;
import nl.bytesoflife.deltacnc.model.operation.ArcDirection;
import nl.bytesoflife.deltacnc.model.operation.PathPoint;
import nl.bytesoflife.deltacnc.model.operation.PathPointKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

import static nl.bytesoflife.deltacnc.gcode.GcodeFormat.feed;
import static nl.bytesoflife.deltacnc.gcode.GcodeFormat.mm;
import static nl.bytesoflife.deltacnc.gcode.GcodeFormat.rpm;

/**
 * Emits a G-code program for one job: header, then either a drilling or a cutting
 * body, then footer.
 *
 * <p>The generator is stateless. Everything a call needs (line buffer, loop variable
 * numbering) is created per call, so identical inputs give identical text and calls
 * may run concurrently.
 */
public class GcodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(GcodeGenerator.class);

    /** Warm-up dwell after spindle start, seconds. */
    static final int WARMUP_DWELL_SECONDS = 2;

    /** Footer retract height in inches, independent of the configured safety height. */
    static final double FOOTER_SAFE_Z = 1.0;

    public GcodeProgram generate(OperationType type, ExpandedGeometry geometry, Tool tool,
                                 MachiningParams params, MachineCapabilities capabilities) {
        if (type == OperationType.CUT && tool == null) {
            throw new InvalidOperationException("No tool selected for cutting");
        }

        EmissionStrategy strategy = EmissionStrategy.from(capabilities);
        GcodeWriter out = new GcodeWriter();

        writeHeader(out, type, tool, params, strategy);
        if (type == OperationType.DRILL) {
            writeDrillBody(out, geometry.drillPoints(), params, strategy);
        } else {
            writeCutBody(out, geometry, tool, params, strategy);
        }
        writeFooter(out);

        GcodeProgram program = out.toProgram();
        log.debug("Generated {} program with {} lines ({}, {})",
                type, program.getLines().size(), strategy.drillMode(), strategy.cutMode());
        return program;
    }

    public GcodeProgram generateDrilling(ExpandedGeometry geometry, Tool tool,
                                         MachiningParams params, MachineCapabilities capabilities) {
        return generate(OperationType.DRILL, geometry, tool, params, capabilities);
    }

    public GcodeProgram generateCutting(ExpandedGeometry geometry, Tool tool,
                                        MachiningParams params, MachineCapabilities capabilities) {
        return generate(OperationType.CUT, geometry, tool, params, capabilities);
    }

    /**
     * Radius the tool center travels on to produce a hole of the given diameter.
     * Zero or negative means the tool does not fit.
     */
    public static double cutRadius(double diameter, double toolDiameter) {
        return diameter / 2 - toolDiameter / 2;
    }

    // ============================================================
    // Header / footer
    // ============================================================

    private void writeHeader(GcodeWriter out, OperationType type, Tool tool,
                             MachiningParams params, EmissionStrategy strategy) {
        out.comment(type == OperationType.DRILL ? "Drilling program" : "Cutting program");
        if (tool != null) {
            out.comment("Tool: " + tool);
        }
        out.comment(String.format(Locale.US, "Material depth: %.4f in, mode: %s",
                params.materialDepth(),
                type == OperationType.DRILL ? strategy.drillMode() : strategy.cutMode()));
        out.line("G21");
        out.line("G90");
        out.line("G17");
        out.rapidZ(params.safetyHeight());
        out.line("M3 S" + rpm(params.spindleSpeed()));
        out.line("G4 P" + WARMUP_DWELL_SECONDS);
    }

    private void writeFooter(GcodeWriter out) {
        out.comment("End of program");
        out.line("M5");
        out.rapidZ(FOOTER_SAFE_Z);
        out.rapidXY(0, 0);
        out.line("M30");
    }

    // ============================================================
    // Drilling
    // ============================================================

    private void writeDrillBody(GcodeWriter out, List<ExpandedPoint> points,
                                MachiningParams params, EmissionStrategy strategy) {
        if (points.isEmpty()) {
            out.comment("No drill points");
            return;
        }
        out.comment("Drilling " + points.size() + " holes");
        if (strategy.drillMode() == EmissionStrategy.DrillMode.CANNED_CYCLE) {
            writeCannedDrilling(out, points, params);
        } else {
            writeManualDrilling(out, points, params);
        }
    }

    private void writeCannedDrilling(GcodeWriter out, List<ExpandedPoint> points, MachiningParams params) {
        ExpandedPoint first = points.get(0);
        out.line("G99 G83"
                + " X" + mm(first.x()) + " Y" + mm(first.y())
                + " Z" + mm(-params.materialDepth())
                + " R" + mm(params.travelHeight())
                + " Q" + mm(params.peckingDepth())
                + " F" + feed(params.plungeRate()));
        for (int i = 1; i < points.size(); i++) {
            ExpandedPoint p = points.get(i);
            out.line("X" + mm(p.x()) + " Y" + mm(p.y()));
        }
        out.line("G80");
        out.rapidZ(params.safetyHeight());
    }

    private void writeManualDrilling(GcodeWriter out, List<ExpandedPoint> points, MachiningParams params) {
        List<Double> pecks = PassSchedule.depths(params.materialDepth(), params.peckingDepth());
        for (ExpandedPoint p : points) {
            out.rapidXY(p.x(), p.y());
            out.rapidZ(params.travelHeight());
            for (double depth : pecks) {
                out.plungeTo(depth, params.plungeRate());
                out.rapidZ(params.travelHeight());
            }
            out.rapidZ(params.safetyHeight());
        }
    }

    // ============================================================
    // Cutting
    // ============================================================

    private void writeCutBody(GcodeWriter out, ExpandedGeometry geometry, Tool tool,
                              MachiningParams params, EmissionStrategy strategy) {
        if (geometry.circles().isEmpty() && geometry.paths().isEmpty()) {
            out.comment("No cuts");
            return;
        }
        for (ExpandedCircle circle : geometry.circles()) {
            writeCircle(out, circle, tool, params, strategy);
        }
        for (ExpandedPath path : geometry.paths()) {
            writePath(out, path, params);
        }
    }

    private void writeCircle(GcodeWriter out, ExpandedCircle circle, Tool tool,
                             MachiningParams params, EmissionStrategy strategy) {
        double r = cutRadius(circle.diameter(), tool.diameter());
        if (r <= 0) {
            out.comment(String.format(Locale.US,
                    "SKIPPED circular cut %s: tool diameter %.4f does not fit hole diameter %.4f",
                    circle.sourceId(), tool.diameter(), circle.diameter()));
            log.warn("Skipping circular cut {} at ({}, {}): tool {} too large for diameter {}",
                    circle.sourceId(), circle.x(), circle.y(), tool.diameter(), circle.diameter());
            return;
        }

        int passes = PassSchedule.passCount(params.materialDepth(), params.passDepth());
        double startX = circle.x() + r;
        double startY = circle.y();

        out.comment(String.format(Locale.US, "Circular cut %s D%.4f at (%.4f, %.4f), %d passes",
                circle.sourceId(), circle.diameter(), circle.x(), circle.y(), passes));
        out.rapidXY(startX, startY);
        out.rapidZ(params.travelHeight());

        if (strategy.cutMode() == EmissionStrategy.CutMode.PARAMETRIC_LOOP) {
            writeCircleLoop(out, passes, startX, startY, r, params);
        } else {
            for (int i = 0; i < passes; i++) {
                out.plungeTo(PassSchedule.depthAt(i, params.materialDepth(), params.passDepth()),
                        params.plungeRate());
                out.arc(true, startX, startY, -r, 0, params.feedRate());
            }
        }
        out.rapidZ(params.safetyHeight());
    }

    /**
     * One while loop for all passes. The loop computes the pass depth itself; the
     * last pass, or any pass that would overshoot, goes to exactly the material depth.
     */
    private void writeCircleLoop(GcodeWriter out, int passes, double startX, double startY,
                                 double r, MachiningParams params) {
        VariableAllocator vars = out.allocator();
        String counter = vars.variable();
        String depth = vars.variable();
        String loop = vars.label();
        String clamp = vars.label();

        out.line(counter + " = 0");
        out.line(loop + " while [" + counter + " LT " + passes + "]");
        out.line(depth + " = [[" + counter + " + 1] * " + mm(params.passDepth()) + "]");
        out.line(clamp + " if [[" + depth + " GT " + mm(params.materialDepth()) + "] OR [["
                + counter + " + 1] GE " + passes + "]]");
        out.line(depth + " = " + mm(params.materialDepth()));
        out.line(clamp + " endif");
        out.line("G1 Z[0 - " + depth + "] F" + feed(params.plungeRate()));
        out.arc(true, startX, startY, -r, 0, params.feedRate());
        out.line(counter + " = [" + counter + " + 1]");
        out.line(loop + " endwhile");
    }

    /**
     * Multi-pass path cut. Arc offsets are taken relative to the previous traversed
     * vertex.
     */
    private void writePath(GcodeWriter out, ExpandedPath path, MachiningParams params) {
        List<PathPoint> points = path.points();
        PathPoint first = path.first();
        List<Double> depths = PassSchedule.depths(params.materialDepth(), params.passDepth());

        out.comment(String.format(Locale.US, "Line cut %s, %d points%s, %d passes",
                path.sourceId(), points.size(), path.closed() ? ", closed" : "", depths.size()));
        out.rapidXY(first.x(), first.y());
        out.rapidZ(params.travelHeight());

        for (int pass = 0; pass < depths.size(); pass++) {
            out.plungeTo(depths.get(pass), params.plungeRate());

            PathPoint previous = first;
            for (int k = 1; k < points.size(); k++) {
                PathPoint p = points.get(k);
                if (p.kind() == PathPointKind.ARC) {
                    out.arc(p.arcDirection() == ArcDirection.CW, p.x(), p.y(),
                            p.arcCenter().x() - previous.x(),
                            p.arcCenter().y() - previous.y(),
                            params.feedRate());
                } else {
                    out.linear(p.x(), p.y(), params.feedRate());
                }
                previous = p;
            }
            if (path.closed()) {
                out.linear(first.x(), first.y(), params.feedRate());
            }

            if (pass < depths.size() - 1) {
                out.rapidZ(params.travelHeight());
                out.rapidXY(first.x(), first.y());
            }
        }
        out.rapidZ(params.safetyHeight());
    }
}
