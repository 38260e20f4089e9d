package me.jling.gpstime.exception;

public class MalformedDateException extends ExifTimeException {

    public MalformedDateException(String value, Throwable cause) {
        super(Kind.MALFORMED_DATE, "Malformed EXIF date: \"" + value + "\"", cause);
    }
}
