package me.jling.gpstime.image.core.tool;

import me.jling.gpstime.image.core.exif.CaptureTime;

import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Capture times found in one image and how they line up.
 *
 * @param model          camera model, empty if absent
 * @param localTime      capture time as the camera recorded it, or null
 * @param correctedTime  {@code localTime} reinterpreted in the zone of the GPS position, or null
 * @param gpsTime        UTC time from the GPS date/time stamps, or null
 * @param hasGpsLocation whether a latitude/longitude pair was read, whether or not a zone was found for it
 * @param diagnostics    why optional steps produced nothing
 */
public record ReconciliationResult(
        String model,
        CaptureTime localTime,
        ZonedDateTime correctedTime,
        Instant gpsTime,
        boolean hasGpsLocation,
        List<String> diagnostics
) {

    public ReconciliationResult {
        if (correctedTime != null && localTime == null) {
            throw new IllegalArgumentException("correctedTime requires localTime");
        }
        model = model == null ? "" : model;
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public Optional<CaptureTime> local() {
        return Optional.ofNullable(localTime);
    }

    public Optional<ZonedDateTime> corrected() {
        return Optional.ofNullable(correctedTime);
    }

    public Optional<Instant> gps() {
        return Optional.ofNullable(gpsTime);
    }

    /**
     * {@code correctedTime - gpsTime}; positive when the camera clock runs ahead.
     */
    public Optional<Duration> delta() {
        if (correctedTime == null || gpsTime == null) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(gpsTime, correctedTime.toInstant()));
    }

    public ReconciliationStatus status() {
        boolean dt = localTime != null;
        boolean ct = correctedTime != null;
        boolean gt = gpsTime != null;
        if (!dt && !gt) {
            return ReconciliationStatus.ALL_TIMES_MISSING;
        }
        if (!dt) {
            return ReconciliationStatus.ONLY_GPS_TIME;
        }
        if (!ct && gt) {
            return hasGpsLocation ? ReconciliationStatus.CORRECTION_FAILED : ReconciliationStatus.NO_GPS_LOCATION;
        }
        if (ct && gt) {
            return ReconciliationStatus.RECONCILED;
        }
        return ReconciliationStatus.GPS_TIME_UNAVAILABLE;
    }
}
