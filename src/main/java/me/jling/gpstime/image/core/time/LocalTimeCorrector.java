package me.jling.gpstime.image.core.time;

import me.jling.gpstime.image.core.exif.ExifDateTimes;
import me.jling.gpstime.image.core.exif.ExifFields;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Reads the camera's wall-clock capture time as a time in a given zone.
 *
 * <p>Same field lookup as the decoder's own parse, except that the offset comes
 * from the zone's rules on that date rather than from the file.
 */
@Component
public class LocalTimeCorrector {

    public ZonedDateTime correct(ExifFields fields, ZoneId zone) {
        String value = ExifDateTimes.captureString(ExifDateTimes.captureField(fields));
        return ExifDateTimes.parseDateTime(value).atZone(zone);
    }
}
