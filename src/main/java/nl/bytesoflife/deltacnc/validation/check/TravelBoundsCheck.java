package nl.bytesoflife.deltacnc.validation.check;

import nl.bytesoflife.deltacnc.job.CncJob;
import nl.bytesoflife.deltacnc.model.MachineCapabilities;
import nl.bytesoflife.deltacnc.model.geometry.ExpandedCircle;
import nl.bytesoflife.deltacnc.model.geometry.ExpandedGeometry;
import nl.bytesoflife.deltacnc.model.geometry.ExpandedPath;
import nl.bytesoflife.deltacnc.model.geometry.ExpandedPoint;
import nl.bytesoflife.deltacnc.model.operation.PathPoint;
import nl.bytesoflife.deltacnc.validation.ValidationIssue;
import org.locationtech.jts.geom.Envelope;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reports every drill point, circle extent and path vertex outside machine travel.
 * Positions exactly on the travel limit are reachable.
 */
public class TravelBoundsCheck implements JobCheck {

    @Override
    public String getName() {
        return "Travel bounds";
    }

    @Override
    public List<ValidationIssue> check(CncJob job, ExpandedGeometry geometry) {
        List<ValidationIssue> issues = new ArrayList<>();
        MachineCapabilities machine = job.getCapabilities();
        if (machine == null) {
            issues.add(ValidationIssue.error(getName(), "No machine selected, travel limits unknown"));
            return issues;
        }

        Envelope travel = new Envelope(0, machine.maxX(), 0, machine.maxY());
        String limits = String.format(Locale.US, "(0..%.3f, 0..%.3f)", machine.maxX(), machine.maxY());

        for (ExpandedPoint p : geometry.drillPoints()) {
            if (!travel.covers(p.x(), p.y())) {
                issues.add(ValidationIssue.error(getName(), String.format(Locale.US,
                        "Drill point (%.3f, %.3f) of %s is outside machine travel %s",
                        p.x(), p.y(), p.sourceId(), limits), p.sourceId(), p.x(), p.y()));
            }
        }

        for (ExpandedCircle c : geometry.circles()) {
            Envelope extent = new Envelope(
                    c.x() - c.radius(), c.x() + c.radius(),
                    c.y() - c.radius(), c.y() + c.radius());
            if (!travel.covers(extent)) {
                issues.add(ValidationIssue.error(getName(), String.format(Locale.US,
                        "Circular cut D%.3f at (%.3f, %.3f) of %s extends outside machine travel %s",
                        c.diameter(), c.x(), c.y(), c.sourceId(), limits), c.sourceId(), c.x(), c.y()));
            }
        }

        for (ExpandedPath path : geometry.paths()) {
            for (PathPoint p : path.points()) {
                if (!travel.covers(p.x(), p.y())) {
                    issues.add(ValidationIssue.error(getName(), String.format(Locale.US,
                            "Line cut point (%.3f, %.3f) of %s is outside machine travel %s",
                            p.x(), p.y(), path.sourceId(), limits), path.sourceId(), p.x(), p.y()));
                }
            }
        }

        return issues;
    }
}
