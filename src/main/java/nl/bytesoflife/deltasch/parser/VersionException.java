package nl.bytesoflife.deltasch.parser;

/**
 * The document declares no format version, or one outside the supported range.
 */
public class VersionException extends SchematicException {
    private final String version;

    public VersionException(String message, String version) {
        super(message);
        this.version = version;
    }

    /**
     * The declared version text, or {@code null} when the document has none.
     */
    public String getVersion() {
        return version;
    }
}
