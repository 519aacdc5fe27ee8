package nl.bytesoflife.deltasch.connectivity;

/**
 * A component pin, ordered naturally: {@code R2} before {@code R10}, pin {@code 2} before {@code 10}.
 */
public record PinRef(String reference, String pinNumber) implements Comparable<PinRef> {

    @Override
    public int compareTo(PinRef other) {
        int byReference = compareNatural(reference, other.reference);
        return byReference != 0 ? byReference : compareNatural(pinNumber, other.pinNumber);
    }

    static int compareNatural(String a, String b) {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            char ca = a.charAt(i);
            char cb = b.charAt(j);
            if (Character.isDigit(ca) && Character.isDigit(cb)) {
                int endA = i;
                while (endA < a.length() && Character.isDigit(a.charAt(endA))) endA++;
                int endB = j;
                while (endB < b.length() && Character.isDigit(b.charAt(endB))) endB++;
                String numA = a.substring(i, endA).replaceFirst("^0+(?=.)", "");
                String numB = b.substring(j, endB).replaceFirst("^0+(?=.)", "");
                int cmp = numA.length() != numB.length()
                        ? Integer.compare(numA.length(), numB.length())
                        : numA.compareTo(numB);
                if (cmp != 0) return cmp;
                i = endA;
                j = endB;
            } else {
                if (ca != cb) return Character.compare(ca, cb);
                i++;
                j++;
            }
        }
        return Integer.compare(a.length() - i, b.length() - j);
    }

    @Override
    public String toString() {
        return reference + "-" + pinNumber;
    }
}
