package nl.bytesoflife.deltacnc.model.operation;

import nl.bytesoflife.deltacnc.model.Axis;
import nl.bytesoflife.deltacnc.model.Point;

/**
 * A round cutout of a given finished diameter, alone or repeated along an axis.
 */
public sealed interface CircularCutOperation
        permits CircularCutOperation.Single, CircularCutOperation.LinearPattern {

    String sourceId();

    double diameter();

    record Single(String sourceId, Point center, double diameter) implements CircularCutOperation {
        public Single {
            OperationChecks.requireSource(sourceId);
            OperationChecks.requireNonNull(center, "center");
            OperationChecks.requirePositive("diameter", diameter);
        }
    }

    record LinearPattern(String sourceId, Point startCenter, double diameter, Axis axis, double spacing, int count)
            implements CircularCutOperation {
        public LinearPattern {
            OperationChecks.requireSource(sourceId);
            OperationChecks.requireNonNull(startCenter, "start center");
            OperationChecks.requirePositive("diameter", diameter);
            OperationChecks.requireNonNull(axis, "axis");
            OperationChecks.requirePositive("spacing", spacing);
            OperationChecks.requireCount("count", count);
        }
    }
}
