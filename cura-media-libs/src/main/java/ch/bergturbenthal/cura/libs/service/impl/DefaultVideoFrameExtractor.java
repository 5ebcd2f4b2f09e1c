package ch.bergturbenthal.cura.libs.service.impl;

import ch.bergturbenthal.cura.libs.exception.MediaException;
import ch.bergturbenthal.cura.libs.exception.UnsupportedCodecException;
import ch.bergturbenthal.cura.libs.model.ErrorKind;
import ch.bergturbenthal.cura.libs.model.FileFacts;
import ch.bergturbenthal.cura.libs.model.ThumbnailPaths;
import ch.bergturbenthal.cura.libs.service.ChecksumService;
import ch.bergturbenthal.cura.libs.service.CodecPerformanceTracker;
import ch.bergturbenthal.cura.libs.service.FrameSource;
import ch.bergturbenthal.cura.libs.service.ImageThumbnailer;
import ch.bergturbenthal.cura.libs.service.ThumbnailCache;
import ch.bergturbenthal.cura.libs.service.VideoFrameExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

@Slf4j
@Service
public class DefaultVideoFrameExtractor implements VideoFrameExtractor {
    public static final double PREFERRED_SEEK_SECONDS = 5.0;
    private final FrameSource frameSource;
    private final ImageThumbnailer imageThumbnailer;
    private final ThumbnailCache thumbnailCache;
    private final ChecksumService checksumService;
    private final CodecPerformanceTracker codecPerformanceTracker;

    public DefaultVideoFrameExtractor(final FrameSource frameSource, final ImageThumbnailer imageThumbnailer,
            final ThumbnailCache thumbnailCache, final ChecksumService checksumService,
            final CodecPerformanceTracker codecPerformanceTracker) {
        this.frameSource = frameSource;
        this.imageThumbnailer = imageThumbnailer;
        this.thumbnailCache = thumbnailCache;
        this.checksumService = checksumService;
        this.codecPerformanceTracker = codecPerformanceTracker;
    }

    /**
     * 5 seconds into the video, or the first frame of shorter videos.
     */
    public static double seekPosition(final double durationSeconds) {
        return durationSeconds >= PREFERRED_SEEK_SECONDS ? PREFERRED_SEEK_SECONDS : 0.0;
    }

    @Override
    public ThumbnailPaths generate(final Path path, final double durationSeconds, final String codecName)
            throws MediaException {
        return generate(path, checksumService.checksum(path), durationSeconds, codecName);
    }

    @Override
    public ThumbnailPaths generate(final Path path, final String checksum, final double durationSeconds,
            final String codecName) throws MediaException {
        final FileFacts fileFacts = FileFacts.read(path);
        return thumbnailCache.getOrGenerate(path, checksum, fileFacts.getModified(),
                () -> extract(path, checksum, durationSeconds, codecName));
    }

    private ThumbnailPaths extract(final Path path, final String checksum, final double durationSeconds,
            final String codecName) throws MediaException {
        final long startTime = System.nanoTime();
        boolean success = false;
        try {
            final BufferedImage frame = grabFrameWithRetry(path, seekPosition(durationSeconds), codecName);
            final ThumbnailPaths paths = imageThumbnailer.storeThumbnails(checksum, frame, 1);
            success = true;
            return paths;
        } finally {
            final Duration duration = Duration.ofNanos(System.nanoTime() - startTime);
            codecPerformanceTracker.record(codecName, duration.toMillis(), success);
            log.info("Frame extraction of {} ({}) {} in {}", path, codecName, success ? "done" : "failed", duration);
        }
    }

    private BufferedImage grabFrameWithRetry(final Path path, final double seekSeconds, final String codecName)
            throws MediaException {
        try {
            return grabFrame(path, seekSeconds, codecName);
        } catch (MediaException e) {
            if (e.getKind() != ErrorKind.DECODE_FAILURE || seekSeconds <= 0)
                throw e;
            log.warn("Cannot decode frame of {} at {}s, retrying with first frame: {}", path, seekSeconds,
                    e.getMessage());
            return grabFrame(path, 0.0, codecName);
        }
    }

    private BufferedImage grabFrame(final Path path, final double seekSeconds, final String codecName)
            throws MediaException {
        final byte[] frameData;
        try {
            frameData = frameSource.extractFrame(path, seekSeconds);
        } catch (MediaException e) {
            if (e.getKind() == ErrorKind.UNSUPPORTED_CODEC && !(e instanceof UnsupportedCodecException))
                throw new UnsupportedCodecException(LockingCodecPerformanceTracker.normalizeCodecName(codecName),
                        e.getMessage());
            throw e;
        }
        final BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(frameData));
        } catch (IOException e) {
            throw new MediaException(ErrorKind.DECODE_FAILURE, "Cannot read frame of " + path, e);
        }
        if (image == null)
            throw new MediaException(ErrorKind.DECODE_FAILURE, "Unknown frame format from " + path);
        return image;
    }
}
