package me.jling.gpstime.image.core.exif;

import com.drew.lang.GeoLocation;
import com.drew.lang.Rational;
import com.drew.metadata.Directory;
import com.drew.metadata.Metadata;
import com.drew.metadata.StringValue;
import com.drew.metadata.exif.GpsDirectory;
import lombok.extern.slf4j.Slf4j;
import me.jling.gpstime.exception.InvalidRationalException;
import me.jling.gpstime.exception.UnsupportedFormatException;

import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link ExifFields} over a metadata-extractor {@link Metadata} tree.
 */
@Slf4j
public class MetadataExifFields implements ExifFields {

    private final Metadata metadata;

    public MetadataExifFields(Metadata metadata) {
        this.metadata = metadata;
    }

    @Override
    public Optional<ExifField> get(ExifTag tag) {
        for (Directory dir : metadata.getDirectoriesOfType(tag.directoryType())) {
            if (dir.containsTag(tag.tagType())) {
                return Optional.of(new DirectoryField(tag, dir));
            }
        }
        return Optional.empty();
    }

    @Override
    public CaptureTime captureTime() {
        ExifField field = ExifDateTimes.captureField(this);
        LocalDateTime local = ExifDateTimes.parseDateTime(ExifDateTimes.captureString(field));

        ExifTag offsetTag = field.tag() == ExifTag.DATE_TIME_ORIGINAL
                ? ExifTag.OFFSET_TIME_ORIGINAL
                : ExifTag.OFFSET_TIME;
        return offset(offsetTag)
                .<CaptureTime>map(o -> new CaptureTime.OffsetQualified(local.atOffset(o)))
                .orElseGet(() -> new CaptureTime.Naive(local));
    }

    @Override
    public Optional<LatLong> latLong() {
        for (GpsDirectory gps : metadata.getDirectoriesOfType(GpsDirectory.class)) {
            GeoLocation loc = gps.getGeoLocation();
            if (loc != null && !loc.isZero()) {
                return Optional.of(new LatLong(loc.getLatitude(), loc.getLongitude()));
            }
        }
        return Optional.empty();
    }

    /**
     * Errors the decoder recorded against individual directories while still
     * producing a result.
     */
    public List<String> recoverableErrors() {
        List<String> errors = new ArrayList<>();
        for (Directory dir : metadata.getDirectories()) {
            for (String error : dir.getErrors()) {
                errors.add(dir.getName() + ": " + error);
            }
        }
        return errors;
    }

    private Optional<ZoneOffset> offset(ExifTag tag) {
        Optional<ExifField> field = get(tag).filter(f -> f.format() == FieldFormat.STRING);
        if (field.isEmpty()) {
            return Optional.empty();
        }
        String value = field.get().stringValue().trim();
        try {
            return Optional.of(ZoneOffset.of(value));
        } catch (DateTimeException e) {
            log.debug("[captureTime] ignoring unparseable {} \"{}\": {}", tag.fieldName(), value, e.toString());
            return Optional.empty();
        }
    }

    private record DirectoryField(ExifTag tag, Directory dir) implements ExifField {

        @Override
        public FieldFormat format() {
            Object value = dir.getObject(tag.tagType());
            return value instanceof StringValue || value instanceof String ? FieldFormat.STRING : FieldFormat.OTHER;
        }

        @Override
        public String stringValue() {
            Object value = dir.getObject(tag.tagType());
            if (value instanceof StringValue sv) {
                return ExifDateTimes.trimNul(sv.toString());
            }
            if (value instanceof String s) {
                return ExifDateTimes.trimNul(s);
            }
            throw new UnsupportedFormatException(tag.fieldName() + " not in string format");
        }

        @Override
        public ExifRational rational(int index) {
            Rational[] values = dir.getRationalArray(tag.tagType());
            if (values == null || index < 0 || index >= values.length) {
                throw new InvalidRationalException(tag.fieldName() + ": no rational component at index " + index);
            }
            return new ExifRational(values[index].getNumerator(), values[index].getDenominator());
        }

        @Override
        public byte[] rawBytes() {
            Object value = dir.getObject(tag.tagType());
            if (value instanceof StringValue sv) {
                return sv.getBytes().clone();
            }
            if (value instanceof String s) {
                return s.getBytes(StandardCharsets.UTF_8);
            }
            byte[] bytes = dir.getByteArray(tag.tagType());
            if (bytes != null) {
                return bytes;
            }
            return String.valueOf(value).getBytes(StandardCharsets.US_ASCII);
        }
    }
}
