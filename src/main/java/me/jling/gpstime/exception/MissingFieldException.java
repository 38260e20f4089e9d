package me.jling.gpstime.exception;

/**
 * Thrown when a required EXIF field is not present in the decoded metadata.
 */
public class MissingFieldException extends ExifTimeException {

    private final String fieldName;

    public MissingFieldException(String fieldName) {
        super(Kind.MISSING_FIELD, "EXIF field not found: " + fieldName);
        this.fieldName = fieldName;
    }

    public String getFieldName() {
        return fieldName;
    }
}
