package nl.bytesoflife.deltacnc.gcode;

import java.util.ArrayList;
import java.util.List;

import static nl.bytesoflife.deltacnc.gcode.GcodeFormat.feed;
import static nl.bytesoflife.deltacnc.gcode.GcodeFormat.mm;

/**
 * Line buffer for one generation call. All coordinates passed in are inches.
 */
class GcodeWriter {

    private final List<String> lines = new ArrayList<>();
    private final VariableAllocator allocator = new VariableAllocator();

    VariableAllocator allocator() {
        return allocator;
    }

    void comment(String text) {
        lines.add(GcodeProgram.COMMENT_PREFIX + text);
    }

    void line(String command) {
        lines.add(command);
    }

    void rapidZ(double z) {
        lines.add("G0 Z" + mm(z));
    }

    void rapidXY(double x, double y) {
        lines.add("G0 X" + mm(x) + " Y" + mm(y));
    }

    void plungeTo(double depth, double plungeRate) {
        lines.add("G1 Z" + mm(-depth) + " F" + feed(plungeRate));
    }

    void linear(double x, double y, double feedRate) {
        lines.add("G1 X" + mm(x) + " Y" + mm(y) + " F" + feed(feedRate));
    }

    /**
     * Circular interpolation to (x, y). The offsets i/j are relative, not absolute.
     */
    void arc(boolean clockwise, double x, double y, double i, double j, double feedRate) {
        lines.add((clockwise ? "G2" : "G3")
                + " X" + mm(x) + " Y" + mm(y)
                + " I" + mm(i) + " J" + mm(j)
                + " F" + feed(feedRate));
    }

    GcodeProgram toProgram() {
        return new GcodeProgram(lines);
    }
}
