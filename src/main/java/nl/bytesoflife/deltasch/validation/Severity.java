package nl.bytesoflife.deltasch.validation;

public enum Severity {
    ERROR,
    WARNING,
    INFO
}
