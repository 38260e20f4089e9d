package me.jling.gpstime.image.core.zone;

/**
 * Maps a coordinate to the IANA name of the time zone containing it.
 */
@FunctionalInterface
public interface ZoneNameLookup {

    /**
     * @return zone name such as {@code Europe/Paris}, or {@code ""} if unknown
     */
    String lookupZoneName(double latitude, double longitude);
}
