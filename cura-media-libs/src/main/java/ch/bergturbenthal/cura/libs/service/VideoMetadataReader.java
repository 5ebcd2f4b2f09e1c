package ch.bergturbenthal.cura.libs.service;

import ch.bergturbenthal.cura.libs.exception.MediaException;
import ch.bergturbenthal.cura.libs.model.MediaMetadata;

import java.nio.file.Path;

public interface VideoMetadataReader {
    MediaMetadata readVideo(Path path) throws MediaException;
}
