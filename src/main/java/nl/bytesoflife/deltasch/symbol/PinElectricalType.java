package nl.bytesoflife.deltasch.symbol;

import java.util.Map;

public enum PinElectricalType {
    INPUT,
    OUTPUT,
    BIDIRECTIONAL,
    TRI_STATE,
    PASSIVE,
    FREE,
    UNSPECIFIED,
    POWER_IN,
    POWER_OUT,
    OPEN_COLLECTOR,
    OPEN_EMITTER,
    NO_CONNECT;

    private static final Map<String, PinElectricalType> KICAD_NAMES = Map.ofEntries(
            Map.entry("input", INPUT),
            Map.entry("output", OUTPUT),
            Map.entry("bidirectional", BIDIRECTIONAL),
            Map.entry("tri_state", TRI_STATE),
            Map.entry("passive", PASSIVE),
            Map.entry("free", FREE),
            Map.entry("unspecified", UNSPECIFIED),
            Map.entry("power_in", POWER_IN),
            Map.entry("power_out", POWER_OUT),
            Map.entry("open_collector", OPEN_COLLECTOR),
            Map.entry("open_emitter", OPEN_EMITTER),
            Map.entry("no_connect", NO_CONNECT)
    );

    public static PinElectricalType fromKicadName(String name) {
        PinElectricalType type = KICAD_NAMES.get(name.toLowerCase());
        if (type == null) {
            throw new IllegalArgumentException("Unknown pin type: " + name);
        }
        return type;
    }
}
