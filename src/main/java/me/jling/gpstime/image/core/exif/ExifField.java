package me.jling.gpstime.image.core.exif;

import me.jling.gpstime.exception.InvalidRationalException;
import me.jling.gpstime.exception.UnsupportedFormatException;

/**
 * A single decoded EXIF field.
 */
public interface ExifField {

    ExifTag tag();

    FieldFormat format();

    /**
     * The value as text, trailing NUL padding removed.
     *
     * @throws UnsupportedFormatException if the field is not a string
     */
    String stringValue();

    /**
     * The {@code index}-th component of a rational field.
     *
     * @throws InvalidRationalException if the field has no rational at {@code index}
     */
    ExifRational rational(int index);

    /**
     * The bytes as stored, or the encoded form of the value when the decoder kept
     * no raw bytes for it.
     */
    byte[] rawBytes();
}
