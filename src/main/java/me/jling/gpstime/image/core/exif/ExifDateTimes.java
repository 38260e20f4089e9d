package me.jling.gpstime.image.core.exif;

import me.jling.gpstime.exception.MalformedDateException;
import me.jling.gpstime.exception.MalformedDateTimeException;
import me.jling.gpstime.exception.MissingFieldException;
import me.jling.gpstime.exception.UnsupportedFormatException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;

/**
 * EXIF date/time layouts and the lookup of the capture-time field shared by the
 * decoder's own parse and the zone-aware correction.
 */
public final class ExifDateTimes {

    /** {@code GPSDateStamp} layout. */
    public static final DateTimeFormatter DATE =
            DateTimeFormatter.ofPattern("uuuu:MM:dd").withResolverStyle(ResolverStyle.STRICT);

    /** {@code DateTime} / {@code DateTimeOriginal} layout. */
    public static final DateTimeFormatter DATE_TIME =
            DateTimeFormatter.ofPattern("uuuu:MM:dd HH:mm:ss").withResolverStyle(ResolverStyle.STRICT);

    private ExifDateTimes() {
    }

    /**
     * {@code DateTimeOriginal} if present, otherwise {@code DateTime}.
     */
    public static ExifField captureField(ExifFields fields) {
        return fields.get(ExifTag.DATE_TIME_ORIGINAL)
                .or(() -> fields.get(ExifTag.DATE_TIME))
                .orElseThrow(() -> new MissingFieldException(ExifTag.DATE_TIME_ORIGINAL.fieldName()));
    }

    public static String captureString(ExifField field) {
        if (field.format() != FieldFormat.STRING) {
            throw new UnsupportedFormatException("DateTime[Original] not in string format");
        }
        return field.stringValue();
    }

    public static LocalDate parseDate(String value) {
        try {
            return LocalDate.parse(value, DATE);
        } catch (DateTimeParseException e) {
            throw new MalformedDateException(value, e);
        }
    }

    public static LocalDateTime parseDateTime(String value) {
        try {
            return LocalDateTime.parse(value, DATE_TIME);
        } catch (DateTimeParseException e) {
            throw new MalformedDateTimeException(value, e);
        }
    }

    static String trimNul(String value) {
        int end = value.length();
        while (end > 0 && value.charAt(end - 1) == '\0') {
            end--;
        }
        return value.substring(0, end);
    }
}
