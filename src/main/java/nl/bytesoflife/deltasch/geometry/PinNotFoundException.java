package nl.bytesoflife.deltasch.geometry;

public class PinNotFoundException extends Exception {
    private final String reference;
    private final String pinNumber;

    public PinNotFoundException(String reference, String pinNumber, String libId) {
        super("Pin " + pinNumber + " not found on " + reference + " (" + libId + ")");
        this.reference = reference;
        this.pinNumber = pinNumber;
    }

    public String getReference() {
        return reference;
    }

    public String getPinNumber() {
        return pinNumber;
    }
}
