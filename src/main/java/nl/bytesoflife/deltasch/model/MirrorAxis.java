package nl.bytesoflife.deltasch.model;

public enum MirrorAxis {
    NONE,
    /** Mirrored about the horizontal axis, Y is negated. */
    X,
    /** Mirrored about the vertical axis, X is negated. */
    Y;

    public static MirrorAxis fromKicadName(String name) {
        if (name == null) return NONE;
        return switch (name.toLowerCase()) {
            case "x" -> X;
            case "y" -> Y;
            default -> throw new IllegalArgumentException("Unknown mirror axis: " + name);
        };
    }

    public String kicadName() {
        return name().toLowerCase();
    }
}
