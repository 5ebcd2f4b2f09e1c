package ch.bergturbenthal.cura.libs.service;

import ch.bergturbenthal.cura.libs.exception.MediaException;
import ch.bergturbenthal.cura.libs.model.ThumbnailPaths;

import java.awt.image.BufferedImage;
import java.nio.file.Path;

public interface ImageThumbnailer {
    ThumbnailPaths generate(Path path, int orientation) throws MediaException;

    ThumbnailPaths generate(Path path, String checksum, int orientation) throws MediaException;

    /**
     * Orients, resizes and stores an already decoded image.
     */
    ThumbnailPaths storeThumbnails(String checksum, BufferedImage image, int orientation) throws MediaException;
}
