package me.jling.gpstime.image.core.exif;

public enum FieldFormat {
    STRING,
    OTHER
}
