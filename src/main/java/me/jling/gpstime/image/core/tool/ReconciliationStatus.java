package me.jling.gpstime.image.core.tool;

/**
 * Outcome of cross-checking one file's capture times, in the priority order the
 * classification applies them.
 */
public enum ReconciliationStatus {
    ALL_TIMES_MISSING,
    ONLY_GPS_TIME,
    CORRECTION_FAILED,
    NO_GPS_LOCATION,
    RECONCILED,
    GPS_TIME_UNAVAILABLE
}
