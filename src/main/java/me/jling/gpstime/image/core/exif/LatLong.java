package me.jling.gpstime.image.core.exif;

/**
 * GPS coordinate pair in decimal degrees.
 */
public record LatLong(double latitude, double longitude) {
}
