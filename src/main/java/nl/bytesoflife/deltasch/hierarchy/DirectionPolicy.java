package nl.bytesoflife.deltasch.hierarchy;

import nl.bytesoflife.deltasch.model.LabelShape;

/**
 * How the direction of a sheet pin is checked against the hierarchical label it binds to.
 */
public enum DirectionPolicy {

    /**
     * Input pairs with output, and either of them pairs with bidirectional, tri-state or passive.
     * Two inputs or two outputs do not pair.
     */
    SIGNAL_FLOW {
        @Override
        public boolean isCompatible(LabelShape pin, LabelShape label) {
            if (isNeutral(pin) || isNeutral(label)) return true;
            return pin != label;
        }
    },

    /**
     * Pin and label must declare the same direction, the way KiCad draws sheets.
     */
    MATCHING {
        @Override
        public boolean isCompatible(LabelShape pin, LabelShape label) {
            if (pin == LabelShape.UNSPECIFIED || label == LabelShape.UNSPECIFIED) return true;
            return pin == label;
        }
    };

    public abstract boolean isCompatible(LabelShape pin, LabelShape label);

    private static boolean isNeutral(LabelShape shape) {
        return shape == LabelShape.BIDIRECTIONAL || shape == LabelShape.TRI_STATE
                || shape == LabelShape.PASSIVE || shape == LabelShape.UNSPECIFIED;
    }
}
