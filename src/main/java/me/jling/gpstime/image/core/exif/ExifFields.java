package me.jling.gpstime.image.core.exif;

import me.jling.gpstime.exception.ExifTimeException;

import java.util.Optional;

/**
 * Read access to the decoded EXIF metadata of one image.
 */
public interface ExifFields {

    Optional<ExifField> get(ExifTag tag);

    default Optional<ExifField> get(String fieldName) {
        return ExifTag.byName(fieldName).flatMap(this::get);
    }

    /**
     * The camera-local capture time as the file records it, without any zone
     * reinterpretation.
     *
     * @throws ExifTimeException if no capture time field exists or it cannot be parsed
     */
    CaptureTime captureTime();

    Optional<LatLong> latLong();
}
