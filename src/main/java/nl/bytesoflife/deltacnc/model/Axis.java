package nl.bytesoflife.deltacnc.model;

public enum Axis {
    X,
    Y;

    public static Axis fromName(String name) {
        return switch (name.toLowerCase()) {
            case "x" -> X;
            case "y" -> Y;
            default -> throw new InvalidOperationException("Unknown axis: " + name);
        };
    }
}
