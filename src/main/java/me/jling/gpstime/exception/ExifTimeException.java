package me.jling.gpstime.exception;

/**
 * Base exception for everything that can go wrong while reading capture times
 * out of an image and reconciling them.
 *
 * <p>Only {@link DecodeFailedException} and {@link NoTimeAvailableException}
 * ever escape a reconciliation; the other kinds are absorbed into an empty
 * field of the result.
 */
public class ExifTimeException extends RuntimeException {

    public enum Kind {
        INVALID_RATIONAL,
        MISSING_FIELD,
        MALFORMED_DATE,
        MALFORMED_DATE_TIME,
        UNSUPPORTED_FORMAT,
        DECODE_FAILED,
        NO_TIME_AVAILABLE
    }

    private final Kind kind;

    public ExifTimeException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ExifTimeException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
