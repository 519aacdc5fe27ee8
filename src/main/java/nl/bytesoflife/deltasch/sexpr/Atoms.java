package nl.bytesoflife.deltasch.sexpr;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Deterministic text for atoms created in memory.
 */
public final class Atoms {

    public static final int DEFAULT_DECIMALS = 4;

    private Atoms() {
    }

    /**
     * Formats with at most {@code decimals} decimals, no exponent, no trailing zeros and no
     * decimal point for integral values. Negative zero prints as {@code 0}.
     */
    public static String formatNumber(double value, int decimals) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Cannot format " + value);
        }
        BigDecimal rounded = BigDecimal.valueOf(value).setScale(decimals, RoundingMode.HALF_UP);
        if (rounded.signum() == 0) {
            return "0";
        }
        return rounded.stripTrailingZeros().toPlainString();
    }

    public static String formatNumber(double value) {
        return formatNumber(value, DEFAULT_DECIMALS);
    }

    public static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        sb.append('"');
        return sb.toString();
    }

    /**
     * Text of an atom: its captured source text when present, otherwise the canonical form.
     */
    public static String text(SNode.SAtom atom, int decimals) {
        if (atom.raw() != null) {
            return atom.raw();
        }
        return switch (atom.type()) {
            case STRING -> quote(atom.value());
            case FLOAT -> formatNumber(atom.asDouble(), decimals);
            default -> atom.value();
        };
    }
}
