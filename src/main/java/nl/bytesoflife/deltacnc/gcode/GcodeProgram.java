package nl.bytesoflife.deltacnc.gcode;

import java.util.List;

/**
 * An emitted program as an ordered list of lines. Comment lines start with "; ".
 */
public class GcodeProgram {

    public static final String COMMENT_PREFIX = "; ";

    private final List<String> lines;

    public GcodeProgram(List<String> lines) {
        this.lines = List.copyOf(lines);
    }

    public List<String> getLines() {
        return lines;
    }

    public List<String> getCommandLines() {
        return lines.stream()
                .filter(line -> !isComment(line))
                .toList();
    }

    public List<String> getComments() {
        return lines.stream()
                .filter(GcodeProgram::isComment)
                .toList();
    }

    public static boolean isComment(String line) {
        return line.startsWith(";");
    }

    /**
     * Newline-joined program text, no trailing newline.
     */
    public String toText() {
        return String.join("\n", lines);
    }

    @Override
    public String toString() {
        return "GcodeProgram{lines=" + lines.size() + "}";
    }
}
