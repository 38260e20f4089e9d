package me.jling.gpstime.image.core.tool;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.metadata.Metadata;
import lombok.extern.slf4j.Slf4j;
import me.jling.gpstime.exception.DecodeFailedException;
import me.jling.gpstime.image.core.exif.MetadataExifFields;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

@Slf4j
public class ImageMetaReader {

    private ImageMetaReader() {
    }

    public static MetadataExifFields read(Path file) {
        try {
            return wrap(ImageMetadataReader.readMetadata(file.toFile()), file.getFileName().toString());
        } catch (ImageProcessingException | IOException e) {
            throw new DecodeFailedException(e.getMessage(), e);
        }
    }

    public static MetadataExifFields read(byte[] bytes) {
        try (var in = new ByteArrayInputStream(bytes)) {
            return read(in, "<bytes>");
        } catch (IOException e) {
            throw new DecodeFailedException(e.getMessage(), e);
        }
    }

    public static MetadataExifFields read(InputStream in, String name) {
        try {
            return wrap(ImageMetadataReader.readMetadata(in), name);
        } catch (ImageProcessingException | IOException e) {
            throw new DecodeFailedException(e.getMessage(), e);
        }
    }

    private static MetadataExifFields wrap(Metadata meta, String name) {
        var fields = new MetadataExifFields(meta);
        // recoverable: keep whatever the decoder did manage to read
        for (String error : fields.recoverableErrors()) {
            log.debug("[read] {} decoder warning: {}", name, error);
        }
        return fields;
    }
}
