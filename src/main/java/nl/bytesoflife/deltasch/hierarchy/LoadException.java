package nl.bytesoflife.deltasch.hierarchy;

public class LoadException extends Exception {

    private final String filename;

    public LoadException(String filename, String message) {
        super(message);
        this.filename = filename;
    }

    public LoadException(String filename, String message, Throwable cause) {
        super(message, cause);
        this.filename = filename;
    }

    public String getFilename() {
        return filename;
    }
}
