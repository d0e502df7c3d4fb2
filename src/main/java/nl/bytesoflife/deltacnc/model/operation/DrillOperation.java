package nl.bytesoflife.deltacnc.model.operation;

import nl.bytesoflife.deltacnc.model.Axis;
import nl.bytesoflife.deltacnc.model.InvalidOperationException;
import nl.bytesoflife.deltacnc.model.Point;

/**
 * A drilling request: a single hole or a pattern of holes.
 * The variant set is closed; consumers match on it exhaustively.
 */
public sealed interface DrillOperation
        permits DrillOperation.Single, DrillOperation.LinearPattern,
                DrillOperation.GridPattern, DrillOperation.CircularPattern {

    /**
     * Opaque identifier of the stored record this operation came from.
     */
    String sourceId();

    record Single(String sourceId, Point position) implements DrillOperation {
        public Single {
            OperationChecks.requireSource(sourceId);
            OperationChecks.requireNonNull(position, "position");
        }

        public Single(String sourceId, double x, double y) {
            this(sourceId, new Point(x, y));
        }
    }

    record LinearPattern(String sourceId, Point start, Axis axis, double spacing, int count)
            implements DrillOperation {
        public LinearPattern {
            OperationChecks.requireSource(sourceId);
            OperationChecks.requireNonNull(start, "start");
            OperationChecks.requireNonNull(axis, "axis");
            OperationChecks.requirePositive("spacing", spacing);
            OperationChecks.requireCount("count", count);
        }
    }

    record GridPattern(String sourceId, Point start, double xSpacing, double ySpacing, int xCount, int yCount)
            implements DrillOperation {
        public GridPattern {
            OperationChecks.requireSource(sourceId);
            OperationChecks.requireNonNull(start, "start");
            OperationChecks.requirePositive("x spacing", xSpacing);
            OperationChecks.requirePositive("y spacing", ySpacing);
            OperationChecks.requireCount("x count", xCount);
            OperationChecks.requireCount("y count", yCount);
        }
    }

    /**
     * Holes evenly spaced on a circle (bolt circle).
     */
    record CircularPattern(String sourceId, Point center, double radius, int count, double startAngleDeg)
            implements DrillOperation {
        public CircularPattern {
            OperationChecks.requireSource(sourceId);
            OperationChecks.requireNonNull(center, "center");
            OperationChecks.requirePositive("radius", radius);
            OperationChecks.requireCount("count", count);
            if (!Double.isFinite(startAngleDeg)) {
                throw new InvalidOperationException("Start angle must be finite, got " + startAngleDeg);
            }
        }
    }
}
