package ch.bergturbenthal.cura.libs.service;

import ch.bergturbenthal.cura.libs.exception.MediaException;
import ch.bergturbenthal.cura.libs.model.MediaMetadata;

import java.nio.file.Path;

public interface ImageMetadataReader {
    /**
     * Reads dimensions and embedded metadata. Fields that cannot be decoded stay empty, only missing dimensions fail
     * the call.
     */
    MediaMetadata readImage(Path path) throws MediaException;

    /**
     * EXIF orientation flag (1 to 8) as stored in the file, 1 when absent or invalid. The flag is not applied.
     */
    int readOrientation(Path path) throws MediaException;
}
