package me.jling.gpstime.image.core.exif;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;

/**
 * The camera's recorded capture time.
 *
 * <p>Either {@link Naive} (wall-clock digits, zone unknown) or
 * {@link OffsetQualified} (the file itself states the UTC offset). Only a naive
 * capture time is a candidate for geographic correction.
 */
public sealed interface CaptureTime permits CaptureTime.Naive, CaptureTime.OffsetQualified {

    LocalDateTime localDateTime();

    record Naive(LocalDateTime localDateTime) implements CaptureTime {

        @Override
        public String toString() {
            return localDateTime.toString();
        }
    }

    record OffsetQualified(OffsetDateTime offsetDateTime) implements CaptureTime {

        @Override
        public LocalDateTime localDateTime() {
            return offsetDateTime.toLocalDateTime();
        }

        @Override
        public String toString() {
            return offsetDateTime.toString();
        }
    }
}
