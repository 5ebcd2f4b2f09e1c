package ch.bergturbenthal.cura.libs.service;

import ch.bergturbenthal.cura.libs.exception.MediaException;
import ch.bergturbenthal.cura.libs.model.ThumbnailPaths;

import java.nio.file.Path;

public interface VideoFrameExtractor {
    ThumbnailPaths generate(Path path, double durationSeconds, String codecName) throws MediaException;

    ThumbnailPaths generate(Path path, String checksum, double durationSeconds, String codecName)
            throws MediaException;
}
