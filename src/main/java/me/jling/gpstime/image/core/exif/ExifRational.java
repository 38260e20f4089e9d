package me.jling.gpstime.image.core.exif;

/**
 * One numerator/denominator pair of a rational EXIF field.
 */
public record ExifRational(long numerator, long denominator) {
}
