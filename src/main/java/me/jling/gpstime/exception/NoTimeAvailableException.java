package me.jling.gpstime.exception;

import me.jling.gpstime.image.core.tool.ReconciliationResult;

/**
 * Thrown when a file carries neither a readable camera-local capture time nor
 * a GPS timestamp.
 *
 * <p>The partial result (model and location flag) is still attached so that the
 * caller can report what is known.
 */
public class NoTimeAvailableException extends ExifTimeException {

    private final transient ReconciliationResult partialResult;

    public NoTimeAvailableException(ReconciliationResult partialResult, Throwable cause) {
        super(Kind.NO_TIME_AVAILABLE, cause == null ? "no capture time available" : cause.getMessage(), cause);
        this.partialResult = partialResult;
    }

    public ReconciliationResult getPartialResult() {
        return partialResult;
    }
}
