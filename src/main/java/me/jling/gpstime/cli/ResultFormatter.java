package me.jling.gpstime.cli;

import me.jling.gpstime.image.core.tool.ReconciliationResult;
import org.springframework.stereotype.Component;

/**
 * One-line rendering of a {@link ReconciliationResult}. Lines for anything short
 * of a full reconciliation start with {@code "! "}.
 */
@Component
public class ResultFormatter {

    public String format(ReconciliationResult r) {
        return switch (r.status()) {
            case ALL_TIMES_MISSING -> "! all times missing";
            case ONLY_GPS_TIME -> String.format("! %s only GPSDateTime=%s", r.model(), r.gpsTime());
            case CORRECTION_FAILED ->
                    String.format("! %s lat/long correction failed GPSDateTime=%s", r.model(), r.gpsTime());
            case NO_GPS_LOCATION -> String.format("! %s no GPS location GPSDateTime=%s", r.model(), r.gpsTime());
            case RECONCILED -> String.format("%s Delta=%s, GPSDateTime=%s",
                    r.model(), r.delta().orElseThrow(), r.gpsTime());
            case GPS_TIME_UNAVAILABLE ->
                    String.format("! %s GPS time unavailable DateTime=%s", r.model(), r.localTime());
        };
    }
}
