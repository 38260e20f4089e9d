package me.jling.gpstime.exception;

/**
 * Thrown when a rational EXIF value cannot be turned into a quantity,
 * typically because its denominator is zero.
 */
public class InvalidRationalException extends ExifTimeException {

    public InvalidRationalException(String message) {
        super(Kind.INVALID_RATIONAL, message);
    }
}
