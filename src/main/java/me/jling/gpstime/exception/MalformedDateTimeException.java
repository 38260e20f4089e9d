package me.jling.gpstime.exception;

public class MalformedDateTimeException extends ExifTimeException {

    public MalformedDateTimeException(String value, Throwable cause) {
        super(Kind.MALFORMED_DATE_TIME, "Malformed EXIF date/time: \"" + value + "\"", cause);
    }
}
