package nl.bytesoflife.deltacnc.validation;

public enum Severity {
    ERROR,
    WARNING
}
