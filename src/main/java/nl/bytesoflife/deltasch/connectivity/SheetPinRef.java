package nl.bytesoflife.deltasch.connectivity;

public record SheetPinRef(String sheetUuid, String pinName) implements Comparable<SheetPinRef> {

    @Override
    public int compareTo(SheetPinRef other) {
        int bySheet = sheetUuid.compareTo(other.sheetUuid);
        return bySheet != 0 ? bySheet : pinName.compareTo(other.pinName);
    }

    @Override
    public String toString() {
        return sheetUuid + "/" + pinName;
    }
}
