package nl.bytesoflife.deltacnc.gcode;

/**
 * Hands out numbered parameters (#n) and o-word labels for emitted loops.
 * One instance per generation call, so numbering restarts for every program.
 */
class VariableAllocator {

    static final int FIRST_VARIABLE = 100;
    static final int FIRST_LABEL = 100;

    private int nextVariable = FIRST_VARIABLE;
    private int nextLabel = FIRST_LABEL;

    String variable() {
        return "#" + nextVariable++;
    }

    String label() {
        return "o" + nextLabel++;
    }
}
