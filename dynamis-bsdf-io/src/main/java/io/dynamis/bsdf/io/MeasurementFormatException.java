package io.dynamis.bsdf.io;

/**
 * Thrown when a measurement table cannot be parsed.
 *
 * Carries the 1-based line number of the offending line, or 0 when the problem is not tied
 * to a single line (e.g. an empty file).
 */
public final class MeasurementFormatException extends Exception {

    private final int lineNumber;

    public MeasurementFormatException(String message, int lineNumber) {
        super(lineNumber > 0 ? "line " + lineNumber + ": " + message : message);
        this.lineNumber = lineNumber;
    }

    public MeasurementFormatException(String message, int lineNumber, Throwable cause) {
        super(lineNumber > 0 ? "line " + lineNumber + ": " + message : message, cause);
        this.lineNumber = lineNumber;
    }

    /** 1-based line number, 0 if not applicable. */
    public int lineNumber() { return lineNumber; }
}
