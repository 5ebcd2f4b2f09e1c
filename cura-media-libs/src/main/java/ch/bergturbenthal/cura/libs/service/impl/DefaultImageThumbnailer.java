package ch.bergturbenthal.cura.libs.service.impl;

import ch.bergturbenthal.cura.libs.exception.MediaException;
import ch.bergturbenthal.cura.libs.model.DecodedImage;
import ch.bergturbenthal.cura.libs.model.ErrorKind;
import ch.bergturbenthal.cura.libs.model.FileFacts;
import ch.bergturbenthal.cura.libs.model.SizeClass;
import ch.bergturbenthal.cura.libs.model.SourceFormat;
import ch.bergturbenthal.cura.libs.model.ThumbnailPaths;
import ch.bergturbenthal.cura.libs.service.ChecksumService;
import ch.bergturbenthal.cura.libs.service.ImageDecoder;
import ch.bergturbenthal.cura.libs.service.ImageThumbnailer;
import ch.bergturbenthal.cura.libs.service.ThumbnailCache;
import ch.bergturbenthal.cura.libs.util.LanczosResampler;
import ch.bergturbenthal.cura.libs.util.Orientation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

@Slf4j
@Service
public class DefaultImageThumbnailer implements ImageThumbnailer {
    private final ImageDecoder imageDecoder;
    private final ThumbnailCache thumbnailCache;
    private final ChecksumService checksumService;

    public DefaultImageThumbnailer(final ImageDecoder imageDecoder, final ThumbnailCache thumbnailCache,
            final ChecksumService checksumService) {
        this.imageDecoder = imageDecoder;
        this.thumbnailCache = thumbnailCache;
        this.checksumService = checksumService;
    }

    public static int targetHeight(final int targetWidth, final int sourceWidth, final int sourceHeight) {
        return Math.max(1, (int) Math.round((double) targetWidth * sourceHeight / sourceWidth));
    }

    @Override
    public ThumbnailPaths generate(final Path path, final int orientation) throws MediaException {
        return generate(path, checksumService.checksum(path), orientation);
    }

    @Override
    public ThumbnailPaths generate(final Path path, final String checksum, final int orientation)
            throws MediaException {
        final FileFacts fileFacts = FileFacts.read(path);
        return thumbnailCache.getOrGenerate(path, checksum, fileFacts.getModified(), () -> {
            final long startTime = System.nanoTime();
            final SourceFormat format = imageDecoder.detectFormat(path);
            final DecodedImage decoded = imageDecoder.decode(path, format);
            final ThumbnailPaths paths = storeThumbnails(checksum, decoded.getImage(),
                    decoded.isOrientationApplied() ? 1 : orientation);
            log.info("Created thumbnails of {} in {}", path, Duration.ofNanos(System.nanoTime() - startTime));
            return paths;
        });
    }

    @Override
    public ThumbnailPaths storeThumbnails(final String checksum, final BufferedImage image, final int orientation)
            throws MediaException {
        final BufferedImage uprightImage = Orientation.apply(image, orientation);
        final int width = uprightImage.getWidth();
        final int height = uprightImage.getHeight();
        final Map<SizeClass, Path> stored = new EnumMap<>(SizeClass.class);
        for (SizeClass sizeClass : SizeClass.values()) {
            final int targetWidth = sizeClass.getWidth();
            final BufferedImage targetImage = LanczosResampler.resize(uprightImage, targetWidth,
                    targetHeight(targetWidth, width, height));
            stored.put(sizeClass, thumbnailCache.store(checksum, sizeClass, encodeJpeg(targetImage)));
        }
        return new ThumbnailPaths(stored.get(SizeClass.SMALL), stored.get(SizeClass.MEDIUM));
    }

    private static byte[] encodeJpeg(final BufferedImage image) throws MediaException {
        final ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try {
            if (!ImageIO.write(image, "jpg", baos))
                throw new MediaException(ErrorKind.CACHE_WRITE_FAILURE, "No JPEG writer available");
        } catch (IOException e) {
            throw new MediaException(ErrorKind.CACHE_WRITE_FAILURE, "Cannot encode thumbnail", e);
        }
        return baos.toByteArray();
    }
}
