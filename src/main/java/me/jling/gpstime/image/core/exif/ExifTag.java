package me.jling.gpstime.image.core.exif;

import com.drew.metadata.Directory;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import com.drew.metadata.exif.GpsDirectory;

import java.util.Arrays;
import java.util.Optional;

/**
 * EXIF fields the time reconciliation reads, with the metadata-extractor
 * directory each one is decoded into.
 */
public enum ExifTag {

    MODEL("Model", ExifIFD0Directory.class, 0x0110),
    DATE_TIME("DateTime", ExifIFD0Directory.class, 0x0132),
    DATE_TIME_ORIGINAL("DateTimeOriginal", ExifSubIFDDirectory.class, 0x9003),
    OFFSET_TIME("OffsetTime", ExifSubIFDDirectory.class, 0x9010),
    OFFSET_TIME_ORIGINAL("OffsetTimeOriginal", ExifSubIFDDirectory.class, 0x9011),
    GPS_TIME_STAMP("GPSTimeStamp", GpsDirectory.class, 0x0007),
    GPS_DATE_STAMP("GPSDateStamp", GpsDirectory.class, 0x001D);

    private final String fieldName;
    private final Class<? extends Directory> directoryType;
    private final int tagType;

    ExifTag(String fieldName, Class<? extends Directory> directoryType, int tagType) {
        this.fieldName = fieldName;
        this.directoryType = directoryType;
        this.tagType = tagType;
    }

    public String fieldName() {
        return fieldName;
    }

    public Class<? extends Directory> directoryType() {
        return directoryType;
    }

    public int tagType() {
        return tagType;
    }

    public static Optional<ExifTag> byName(String fieldName) {
        return Arrays.stream(values())
                .filter(t -> t.fieldName.equals(fieldName))
                .findFirst();
    }
}
