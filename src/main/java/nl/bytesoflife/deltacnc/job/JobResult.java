package nl.bytesoflife.deltacnc.job;

import nl.bytesoflife.deltacnc.gcode.GcodeProgram;
import nl.bytesoflife.deltacnc.model.OperationType;
import nl.bytesoflife.deltacnc.model.geometry.ExpandedGeometry;

/**
 * Output of one generation call. Program and preview were produced from the same geometry.
 */
public record JobResult(OperationType type, ExpandedGeometry geometry, GcodeProgram program, String previewSvg) {

    public String gcode() {
        return program.toText();
    }
}
