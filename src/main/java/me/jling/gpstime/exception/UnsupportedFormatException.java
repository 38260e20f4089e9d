package me.jling.gpstime.exception;

/**
 * Thrown when an EXIF field exists but is not stored in the representation
 * the caller needs (for example a date/time that is not an ASCII string).
 */
public class UnsupportedFormatException extends ExifTimeException {

    public UnsupportedFormatException(String message) {
        super(Kind.UNSUPPORTED_FORMAT, message);
    }
}
