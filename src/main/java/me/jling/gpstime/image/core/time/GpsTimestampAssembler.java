package me.jling.gpstime.image.core.time;

import me.jling.gpstime.exception.MissingFieldException;
import me.jling.gpstime.image.core.exif.ExifDateTimes;
import me.jling.gpstime.image.core.exif.ExifField;
import me.jling.gpstime.image.core.exif.ExifFields;
import me.jling.gpstime.image.core.exif.ExifRational;
import me.jling.gpstime.image.core.exif.ExifTag;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Builds the UTC instant recorded by the GPS receiver from {@code GPSDateStamp}
 * and the hour/minute/second rationals of {@code GPSTimeStamp}.
 *
 * <p>GPS time is UTC by definition (EXIF 2.3, CIPA DC-008); no zone adjustment
 * applies to the result.
 */
@Component
public class GpsTimestampAssembler {

    private static final Duration[] UNITS = {Duration.ofHours(1), Duration.ofMinutes(1), Duration.ofSeconds(1)};

    public Instant assemble(ExifFields fields) {
        ExifField dateTag = fields.get(ExifTag.GPS_DATE_STAMP)
                .orElseThrow(() -> new MissingFieldException(ExifTag.GPS_DATE_STAMP.fieldName()));
        ExifField timeTag = fields.get(ExifTag.GPS_TIME_STAMP)
                .orElseThrow(() -> new MissingFieldException(ExifTag.GPS_TIME_STAMP.fieldName()));

        Instant date = ExifDateTimes.parseDate(dateTag.stringValue())
                .atStartOfDay(ZoneOffset.UTC)
                .toInstant();

        Duration timeOfDay = Duration.ZERO;
        for (int i = 0; i < UNITS.length; i++) {
            ExifRational r = timeTag.rational(i);
            timeOfDay = timeOfDay.plus(RationalDurations.toDuration(r.numerator(), r.denominator(), UNITS[i]));
        }
        return date.plus(timeOfDay);
    }
}
