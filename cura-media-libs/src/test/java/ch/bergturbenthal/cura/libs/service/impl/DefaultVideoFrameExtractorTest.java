package ch.bergturbenthal.cura.libs.service.impl;

import ch.bergturbenthal.cura.libs.TestImages;
import ch.bergturbenthal.cura.libs.exception.MediaException;
import ch.bergturbenthal.cura.libs.exception.UnsupportedCodecException;
import ch.bergturbenthal.cura.libs.model.CodecStat;
import ch.bergturbenthal.cura.libs.model.ErrorKind;
import ch.bergturbenthal.cura.libs.model.ThumbnailPaths;
import ch.bergturbenthal.cura.libs.properties.MediaProperties;
import ch.bergturbenthal.cura.libs.service.FrameSource;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

public class DefaultVideoFrameExtractorTest {
    @TempDir
    Path tempDir;

    private ScriptedFrameSource frameSource;
    private LockingCodecPerformanceTracker tracker;
    private FileThumbnailCache cache;
    private DefaultVideoFrameExtractor extractor;

    /**
     * Answers frame requests from a queue of prepared results and remembers the requested positions.
     */
    private static class ScriptedFrameSource implements FrameSource {
        private final List<Double> seeks = new ArrayList<>();
        private final Deque<MediaException> failures = new ArrayDeque<>();
        private final byte[] frame;

        private ScriptedFrameSource(final byte[] frame) {
            this.frame = frame;
        }

        @Override
        public synchronized byte[] extractFrame(final Path path, final double seekSeconds) throws MediaException {
            seeks.add(seekSeconds);
            final MediaException failure = failures.poll();
            if (failure != null)
                throw failure;
            return frame;
        }
    }

    @BeforeEach
    public void setUp() throws Exception {
        final MediaProperties properties = new MediaProperties();
        properties.setCacheDir(tempDir.resolve("cache").toFile());
        cache = new FileThumbnailCache(properties);
        final Sha256ChecksumService checksumService = new Sha256ChecksumService();
        final DefaultImageThumbnailer thumbnailer = new DefaultImageThumbnailer(
                new DefaultImageDecoder(properties, new TestImages.NoToolsProbe()), cache, checksumService);
        frameSource = new ScriptedFrameSource(TestImages.encode(TestImages.quadrants(320, 180), "png"));
        tracker = new LockingCodecPerformanceTracker(Optional.empty());
        extractor = new DefaultVideoFrameExtractor(frameSource, thumbnailer, cache, checksumService, tracker);
    }

    private Path video(final String name) throws Exception {
        final Path file = Files.write(tempDir.resolve(name), name.getBytes(StandardCharsets.UTF_8));
        Files.setLastModifiedTime(file, FileTime.from(Instant.now().minusSeconds(3600)));
        return file;
    }

    @Test
    public void testSeekPosition() {
        Assertions.assertEquals(5.0, DefaultVideoFrameExtractor.seekPosition(10.0));
        Assertions.assertEquals(5.0, DefaultVideoFrameExtractor.seekPosition(5.0));
        Assertions.assertEquals(0.0, DefaultVideoFrameExtractor.seekPosition(3.0));
        Assertions.assertEquals(0.0, DefaultVideoFrameExtractor.seekPosition(0.0));
    }

    @Test
    public void testLongVideoUsesFrameAtFiveSeconds() throws Exception {
        final ThumbnailPaths paths = extractor.generate(video("long.mp4"), 10.0, "h264");
        Assertions.assertEquals(List.of(5.0), frameSource.seeks);
        final BufferedImage small = ImageIO.read(paths.getSmall().toFile());
        Assertions.assertEquals(150, small.getWidth());
        Assertions.assertEquals(84, small.getHeight());
        final BufferedImage medium = ImageIO.read(paths.getMedium().toFile());
        Assertions.assertEquals(600, medium.getWidth());
        Assertions.assertEquals(338, medium.getHeight());
    }

    @Test
    public void testShortVideoUsesFirstFrame() throws Exception {
        extractor.generate(video("short.mp4"), 3.0, "h264");
        Assertions.assertEquals(List.of(0.0), frameSource.seeks);
    }

    @Test
    public void testRetriesWithFirstFrame() throws Exception {
        frameSource.failures.add(new MediaException(ErrorKind.DECODE_FAILURE, "seek beyond keyframe"));
        extractor.generate(video("retry.mp4"), 10.0, "vp9");
        Assertions.assertEquals(List.of(5.0, 0.0), frameSource.seeks);
        final List<CodecStat> stats = tracker.snapshot();
        Assertions.assertEquals(1, stats.size());
        Assertions.assertEquals(1, stats.get(0).getSampleCount());
        Assertions.assertEquals(1, stats.get(0).getSuccessCount());
    }

    @Test
    public void testNoRetryForFirstFrame() throws Exception {
        frameSource.failures.add(new MediaException(ErrorKind.DECODE_FAILURE, "broken"));
        final Path file = video("broken.mp4");
        final MediaException exception = Assertions.assertThrows(MediaException.class,
                () -> extractor.generate(file, 2.0, "h264"));
        Assertions.assertEquals(ErrorKind.DECODE_FAILURE, exception.getKind());
        Assertions.assertEquals(List.of(0.0), frameSource.seeks);
        final CodecStat stat = tracker.snapshot().get(0);
        Assertions.assertEquals(1, stat.getSampleCount());
        Assertions.assertEquals(0, stat.getSuccessCount());
    }

    @Test
    public void testNoVideoStreamIsNotRetried() throws Exception {
        frameSource.failures.add(new MediaException(ErrorKind.NO_VIDEO_STREAM, "audio only"));
        final Path file = video("audio.mp4");
        final MediaException exception = Assertions.assertThrows(MediaException.class,
                () -> extractor.generate(file, 30.0, "aac"));
        Assertions.assertEquals(ErrorKind.NO_VIDEO_STREAM, exception.getKind());
        Assertions.assertEquals(List.of(5.0), frameSource.seeks);
        Assertions.assertFalse(Files.exists(cache.pathsFor(new Sha256ChecksumService().checksum(file)).getSmall()));
    }

    @Test
    public void testUnsupportedCodecCarriesCodecName() throws Exception {
        frameSource.failures.add(new MediaException(ErrorKind.UNSUPPORTED_CODEC, "Decoder hevc not found"));
        final Path file = video("exotic.mkv");
        final UnsupportedCodecException exception = Assertions.assertThrows(UnsupportedCodecException.class,
                () -> extractor.generate(file, 30.0, "HEVC"));
        Assertions.assertEquals("hevc", exception.getCodecName());
        Assertions.assertEquals(ErrorKind.UNSUPPORTED_CODEC, exception.getKind());
        Assertions.assertEquals("hevc", tracker.snapshot().get(0).getCodecName());
    }

    @Test
    public void testCachedThumbnailsSkipExtraction() throws Exception {
        final Path file = video("cached.mp4");
        final ThumbnailPaths first = extractor.generate(file, 12.0, "h264");
        final ThumbnailPaths second = extractor.generate(file, 12.0, "h264");
        Assertions.assertEquals(first, second);
        Assertions.assertEquals(1, frameSource.seeks.size());
        Assertions.assertEquals(1, tracker.snapshot().get(0).getSampleCount());
    }
}
