package nl.bytesoflife.deltasch.model;

public enum WireKind {
    WIRE("wire"),
    BUS("bus");

    private final String tag;

    WireKind(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public static WireKind fromTag(String tag) {
        return "bus".equals(tag) ? BUS : WIRE;
    }
}
