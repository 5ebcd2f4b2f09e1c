package ch.bergturbenthal.cura.libs.service;

import ch.bergturbenthal.cura.libs.exception.MediaException;
import ch.bergturbenthal.cura.libs.model.SizeClass;
import ch.bergturbenthal.cura.libs.model.ThumbnailPaths;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;

/**
 * Content addressed store of JPEG thumbnails, named {@code {checksum}_{small|medium}.jpg}.
 */
public interface ThumbnailCache {
    ThumbnailPaths pathsFor(String checksum);

    /**
     * @return the cached thumbnails, or empty when one of them is missing or older than {@code sourceMtime}
     */
    Optional<ThumbnailPaths> resolve(Path source, String checksum, Instant sourceMtime);

    Path store(String checksum, SizeClass sizeClass, byte[] jpegData) throws MediaException;

    /**
     * Resolves the thumbnails and runs the generator on a miss. Concurrent calls for the same checksum wait for a
     * single generator run.
     */
    ThumbnailPaths getOrGenerate(Path source, String checksum, Instant sourceMtime, ThumbnailGenerator generator)
            throws MediaException;

    @FunctionalInterface
    interface ThumbnailGenerator {
        ThumbnailPaths generate() throws MediaException;
    }
}
