package me.jling.gpstime.exception;

/**
 * Thrown when the metadata decoder reports a critical error: the container is
 * not a recognised image format, is structurally broken, or cannot be read.
 * No partial result exists in this case.
 */
public class DecodeFailedException extends ExifTimeException {

    public DecodeFailedException(String message, Throwable cause) {
        super(Kind.DECODE_FAILED, message, cause);
    }
}
