package nl.bytesoflife.deltasch.model;

import java.util.Map;

/**
 * Direction of a global label, hierarchical label or sheet pin.
 */
public enum LabelShape {
    INPUT,
    OUTPUT,
    BIDIRECTIONAL,
    TRI_STATE,
    PASSIVE,
    UNSPECIFIED;

    private static final Map<String, LabelShape> KICAD_NAMES = Map.ofEntries(
            Map.entry("input", INPUT),
            Map.entry("output", OUTPUT),
            Map.entry("bidirectional", BIDIRECTIONAL),
            Map.entry("tri_state", TRI_STATE),
            Map.entry("passive", PASSIVE),
            Map.entry("unspecified", UNSPECIFIED)
    );

    public static LabelShape fromKicadName(String name) {
        LabelShape shape = KICAD_NAMES.get(name.toLowerCase());
        if (shape == null) {
            throw new IllegalArgumentException("Unknown label shape: " + name);
        }
        return shape;
    }

    public String kicadName() {
        return name().toLowerCase();
    }
}
