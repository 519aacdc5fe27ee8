package nl.bytesoflife.deltasch.sexpr;

public enum FormatMode {
    /** Captured whitespace and atom text are reused, only changed lists are laid out anew. */
    PRESERVE,
    /** Every list is laid out with the formatting rules. */
    CLEAN,
    /** Single spaces, no line breaks. */
    COMPACT
}
