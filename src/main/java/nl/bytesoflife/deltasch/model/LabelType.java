package nl.bytesoflife.deltasch.model;

public enum LabelType {
    LOCAL("label"),
    GLOBAL("global_label"),
    HIERARCHICAL("hierarchical_label");

    private final String tag;

    LabelType(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public static LabelType fromTag(String tag) {
        for (LabelType type : values()) {
            if (type.tag.equals(tag)) return type;
        }
        throw new IllegalArgumentException("Not a label tag: " + tag);
    }
}
