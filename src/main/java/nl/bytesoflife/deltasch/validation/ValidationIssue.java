package nl.bytesoflife.deltasch.validation;

import java.util.List;

/**
 * A recoverable problem found in a schematic or hierarchy.
 */
public class ValidationIssue {

    private final Severity severity;
    private final String message;
    private final String elementType;
    private final String elementId;
    private final String path;
    private final List<String> suggestions;

    public ValidationIssue(Severity severity, String message, String elementType, String elementId,
                           String path, List<String> suggestions) {
        this.severity = severity;
        this.message = message;
        this.elementType = elementType;
        this.elementId = elementId;
        this.path = path;
        this.suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public ValidationIssue(Severity severity, String message, String elementType, String elementId) {
        this(severity, message, elementType, elementId, null, List.of());
    }

    public static ValidationIssue error(String message, String elementType, String elementId) {
        return new ValidationIssue(Severity.ERROR, message, elementType, elementId);
    }

    public static ValidationIssue warning(String message, String elementType, String elementId) {
        return new ValidationIssue(Severity.WARNING, message, elementType, elementId);
    }

    /**
     * Copy of this issue attributed to a hierarchy path.
     */
    public ValidationIssue atPath(String path) {
        return new ValidationIssue(severity, message, elementType, elementId, path, suggestions);
    }

    public ValidationIssue withSuggestions(List<String> suggestions) {
        return new ValidationIssue(severity, message, elementType, elementId, path, suggestions);
    }

    public Severity getSeverity() { return severity; }
    public String getMessage() { return message; }
    public String getElementType() { return elementType; }
    public String getElementId() { return elementId; }
    public String getPath() { return path; }
    public List<String> getSuggestions() { return suggestions; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(severity).append("] ");
        if (path != null) {
            sb.append(path).append(": ");
        }
        sb.append(message);
        if (elementType != null) {
            sb.append(" (").append(elementType);
            if (elementId != null) {
                sb.append(" ").append(elementId);
            }
            sb.append(")");
        }
        if (!suggestions.isEmpty()) {
            sb.append(" - try: ").append(String.join("; ", suggestions));
        }
        return sb.toString();
    }
}
