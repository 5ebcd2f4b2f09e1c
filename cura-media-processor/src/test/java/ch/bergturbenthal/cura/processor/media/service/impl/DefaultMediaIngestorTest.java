package ch.bergturbenthal.cura.processor.media.service.impl;

import ch.bergturbenthal.cura.libs.model.CodecStat;
import ch.bergturbenthal.cura.libs.model.ErrorKind;
import ch.bergturbenthal.cura.libs.model.FormatConfig;
import ch.bergturbenthal.cura.libs.model.MediaType;
import ch.bergturbenthal.cura.libs.model.ScanError;
import ch.bergturbenthal.cura.libs.model.VideoProbe;
import ch.bergturbenthal.cura.libs.model.VideoToolStatus;
import ch.bergturbenthal.cura.libs.properties.MediaProperties;
import ch.bergturbenthal.cura.libs.service.CancellationSignal;
import ch.bergturbenthal.cura.libs.service.ExternalToolProbe;
import ch.bergturbenthal.cura.libs.service.FrameSource;
import ch.bergturbenthal.cura.libs.service.ScanProgressListener;
import ch.bergturbenthal.cura.libs.service.impl.DefaultFormatClassifier;
import ch.bergturbenthal.cura.libs.service.impl.DefaultImageDecoder;
import ch.bergturbenthal.cura.libs.service.impl.DefaultImageThumbnailer;
import ch.bergturbenthal.cura.libs.service.impl.DefaultVideoFrameExtractor;
import ch.bergturbenthal.cura.libs.service.impl.ExecutorAsyncService;
import ch.bergturbenthal.cura.libs.service.impl.ExifImageMetadataReader;
import ch.bergturbenthal.cura.libs.service.impl.FileThumbnailCache;
import ch.bergturbenthal.cura.libs.service.impl.LockingCodecPerformanceTracker;
import ch.bergturbenthal.cura.libs.service.impl.ParallelDirectoryScanner;
import ch.bergturbenthal.cura.libs.service.impl.ProbingVideoMetadataReader;
import ch.bergturbenthal.cura.libs.service.impl.Sha256ChecksumService;
import ch.bergturbenthal.cura.processor.media.model.IngestOutcome;
import ch.bergturbenthal.cura.processor.media.model.ProcessedMedia;
import ch.bergturbenthal.cura.processor.media.model.StageTimings;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import javax.imageio.ImageIO;
import org.apache.commons.imaging.formats.jpeg.exif.ExifRewriter;
import org.apache.commons.imaging.formats.tiff.constants.TiffTagConstants;
import org.apache.commons.imaging.formats.tiff.write.TiffOutputSet;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class DefaultMediaIngestorTest {
  private static final Duration TIMEOUT = Duration.ofMinutes(2);

  @TempDir Path tempDir;

  private Path library;
  private ExecutorAsyncService asyncService;
  private LockingCodecPerformanceTracker tracker;
  private SimpleMeterRegistry meterRegistry;
  private final List<Double> requestedFrames = new CopyOnWriteArrayList<>();
  private boolean videoToolsInstalled = true;
  private DefaultMediaIngestor ingestor;

  private static byte[] encode(final BufferedImage image, final String format) throws Exception {
    final ByteArrayOutputStream baos = new ByteArrayOutputStream();
    ImageIO.write(image, format, baos);
    return baos.toByteArray();
  }

  private static BufferedImage image(final int width, final int height) {
    final BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    final Graphics2D graphics = image.createGraphics();
    graphics.setColor(Color.ORANGE);
    graphics.fillRect(0, 0, width, height);
    graphics.setColor(Color.BLUE);
    graphics.fillRect(0, 0, width / 2, height / 2);
    graphics.dispose();
    return image;
  }

  private static void writeJpegWithOrientation(
      final Path file, final BufferedImage image, final short orientation) throws Exception {
    final TiffOutputSet outputSet = new TiffOutputSet();
    outputSet.getOrCreateRootDirectory().add(TiffTagConstants.TIFF_TAG_ORIENTATION, orientation);
    try (OutputStream os = Files.newOutputStream(file)) {
      new ExifRewriter().updateExifMetadataLossy(encode(image, "jpg"), os, outputSet);
    }
  }

  @BeforeEach
  public void setUp() throws Exception {
    library = Files.createDirectories(tempDir.resolve("library"));
    final MediaProperties properties = new MediaProperties();
    properties.setCacheDir(tempDir.resolve("cache").toFile());
    properties.setWorkerThreads(4);
    asyncService = new ExecutorAsyncService(Executors.newFixedThreadPool(4), Optional.empty());
    tracker = new LockingCodecPerformanceTracker(Optional.empty());
    meterRegistry = new SimpleMeterRegistry();

    final ExternalToolProbe toolProbe =
        new ExternalToolProbe() {
          @Override
          public VideoToolStatus videoToolStatus() {
            return videoToolsInstalled
                ? VideoToolStatus.available("6.1")
                : VideoToolStatus.unavailable("FFmpeg is not installed or not in PATH");
          }

          @Override
          public boolean hasDcraw() {
            return false;
          }

          @Override
          public boolean hasHeicConverter() {
            return false;
          }
        };
    final byte[] frame = encode(image(640, 360), "png");
    final FrameSource frameSource =
        (path, seekSeconds) -> {
          requestedFrames.add(seekSeconds);
          return frame;
        };

    final Sha256ChecksumService checksumService = new Sha256ChecksumService();
    final FileThumbnailCache cache = new FileThumbnailCache(properties);
    final DefaultImageDecoder decoder = new DefaultImageDecoder(properties, toolProbe);
    final DefaultImageThumbnailer thumbnailer =
        new DefaultImageThumbnailer(decoder, cache, checksumService);
    ingestor =
        new DefaultMediaIngestor(
            new ParallelDirectoryScanner(asyncService, new DefaultFormatClassifier(), properties),
            checksumService,
            new ExifImageMetadataReader(decoder),
            new ProbingVideoMetadataReader(path -> new VideoProbe(12.0, "h264", 640, 360)),
            thumbnailer,
            new DefaultVideoFrameExtractor(frameSource, thumbnailer, cache, checksumService, tracker),
            toolProbe,
            asyncService,
            properties,
            Optional.of(meterRegistry));
  }

  @AfterEach
  public void tearDown() {
    asyncService.close();
  }

  private IngestOutcome ingest() {
    return ingestor
        .ingest(
            library, FormatConfig.defaults(), ScanProgressListener.NONE, new CancellationSignal())
        .block(TIMEOUT);
  }

  private static ProcessedMedia item(final IngestOutcome outcome, final String name) {
    return outcome.getItems().stream()
        .filter(m -> m.getFile().getPath().getFileName().toString().equals(name))
        .findFirst()
        .orElseThrow();
  }

  @Test
  public void testMixedLibrary() throws Exception {
    writeJpegWithOrientation(library.resolve("a.jpg"), image(4000, 3000), (short) 6);
    Files.write(library.resolve("b.mp4"), "not really a video".getBytes(StandardCharsets.UTF_8));
    Files.write(library.resolve("c.jpg"), "corrupt".getBytes(StandardCharsets.UTF_8));

    final IngestOutcome outcome = ingest();

    Assertions.assertNotNull(outcome);
    Assertions.assertEquals(2, outcome.getImageCount());
    Assertions.assertEquals(1, outcome.getVideoCount());
    Assertions.assertEquals(2, outcome.getItems().size());
    Assertions.assertEquals(1, outcome.getErrors().size());
    final ScanError error = outcome.getErrors().get(0);
    Assertions.assertTrue(error.getPath().endsWith("c.jpg"));
    Assertions.assertEquals(ErrorKind.DECODE_FAILURE, error.getKind());
    Assertions.assertTrue(error.getMessage().startsWith("DecodeFailure: "));

    final ProcessedMedia photo = item(outcome, "a.jpg");
    Assertions.assertEquals(MediaType.IMAGE, photo.getMetadata().getMediaType());
    Assertions.assertEquals(6, photo.getMetadata().getOrientation());
    Assertions.assertEquals(3000, photo.getMetadata().getWidth());
    Assertions.assertEquals(4000, photo.getMetadata().getHeight());
    final BufferedImage small = ImageIO.read(photo.getThumbnails().getSmall().toFile());
    Assertions.assertEquals(150, small.getWidth());
    Assertions.assertEquals(200, small.getHeight());
    final BufferedImage medium = ImageIO.read(photo.getThumbnails().getMedium().toFile());
    Assertions.assertEquals(600, medium.getWidth());
    Assertions.assertEquals(800, medium.getHeight());
    Assertions.assertEquals(
        photo.getChecksum() + "_small.jpg",
        photo.getThumbnails().getSmall().getFileName().toString());

    final ProcessedMedia video = item(outcome, "b.mp4");
    Assertions.assertEquals(MediaType.VIDEO, video.getMetadata().getMediaType());
    Assertions.assertEquals(12.0, video.getMetadata().getDurationSeconds());
    Assertions.assertEquals("h264", video.getMetadata().getVideoCodec());
    Assertions.assertEquals(List.of(5.0), requestedFrames);
    Assertions.assertTrue(Files.exists(video.getThumbnails().getSmall()));
    Assertions.assertTrue(Files.exists(video.getThumbnails().getMedium()));

    final List<CodecStat> stats = tracker.snapshot();
    Assertions.assertEquals(1, stats.size());
    Assertions.assertEquals("h264", stats.get(0).getCodecName());
    Assertions.assertEquals(1, stats.get(0).getSampleCount());
    Assertions.assertEquals(1, stats.get(0).getSuccessCount());
  }

  @Test
  public void testRecordsStageTimings() throws Exception {
    Files.write(library.resolve("a.png"), encode(image(300, 200), "png"));
    Files.write(library.resolve("b.mp4"), "not really a video".getBytes(StandardCharsets.UTF_8));
    Files.write(library.resolve("c.jpg"), "corrupt".getBytes(StandardCharsets.UTF_8));

    final IngestOutcome outcome = ingest();

    Assertions.assertNotNull(outcome);
    final StageTimings timings = outcome.getTimings();
    Assertions.assertEquals(2, timings.getProcessedCount());
    Assertions.assertFalse(timings.getScanTime().isNegative());
    Assertions.assertFalse(timings.getThumbnailTime().isZero());
    Assertions.assertEquals(
        timings.getThumbnailTime().dividedBy(2), timings.averageThumbnailTime());
    Assertions.assertEquals(
        timings.getMetadataTime().dividedBy(2), timings.averageMetadataTime());

    Assertions.assertEquals(1, meterRegistry.get("cura.ingest.scan").timer().count());
    Assertions.assertEquals(
        2, meterRegistry.get("cura.ingest.metadata").tag("type", "image").timer().count());
    Assertions.assertEquals(
        1, meterRegistry.get("cura.ingest.metadata").tag("type", "video").timer().count());
    Assertions.assertEquals(
        1, meterRegistry.get("cura.ingest.thumbnail").tag("type", "image").timer().count());
    Assertions.assertEquals(
        1, meterRegistry.get("cura.ingest.thumbnail").tag("type", "video").timer().count());
    Assertions.assertEquals(
        1.0,
        meterRegistry
            .get("cura.ingest.processed")
            .tags("type", "image", "result", "success")
            .counter()
            .count());
    Assertions.assertEquals(
        1.0,
        meterRegistry
            .get("cura.ingest.processed")
            .tags("type", "image", "result", "failure")
            .counter()
            .count());
    Assertions.assertEquals(
        1.0,
        meterRegistry
            .get("cura.ingest.processed")
            .tags("type", "video", "result", "success")
            .counter()
            .count());
  }

  @Test
  public void testEmptyTimingsHaveZeroAverages() {
    Assertions.assertEquals(Duration.ZERO, StageTimings.EMPTY.averageMetadataTime());
    Assertions.assertEquals(Duration.ZERO, StageTimings.EMPTY.averageThumbnailTime());
  }

  @Test
  public void testVideosFailWithoutTools() throws Exception {
    videoToolsInstalled = false;
    Files.write(library.resolve("a.png"), encode(image(300, 200), "png"));
    Files.write(library.resolve("b.mov"), new byte[] {1, 2, 3});

    final IngestOutcome outcome = ingest();

    Assertions.assertNotNull(outcome);
    Assertions.assertEquals(1, outcome.getItems().size());
    Assertions.assertEquals(1, outcome.getErrors().size());
    Assertions.assertEquals(ErrorKind.EXTERNAL_TOOL_UNAVAILABLE, outcome.getErrors().get(0).getKind());
    Assertions.assertTrue(outcome.getErrors().get(0).getPath().endsWith("b.mov"));
    Assertions.assertTrue(
        outcome.getErrors().get(0).getMessage().startsWith("ExternalToolUnavailable: "));
    Assertions.assertTrue(requestedFrames.isEmpty());
    Assertions.assertTrue(tracker.snapshot().isEmpty());
  }

  @Test
  public void testRepeatedIngestReusesThumbnails() throws Exception {
    Files.write(library.resolve("a.png"), encode(image(300, 200), "png"));
    Files.setLastModifiedTime(
        library.resolve("a.png"),
        FileTime.from(Instant.now().minusSeconds(3600)));
    final IngestOutcome first = ingest();
    final Path small = first.getItems().get(0).getThumbnails().getSmall();
    final FileTime written = Files.getLastModifiedTime(small);

    final IngestOutcome second = ingest();

    Assertions.assertEquals(
        first.getItems().get(0).getThumbnails(), second.getItems().get(0).getThumbnails());
    Assertions.assertEquals(written, Files.getLastModifiedTime(small));
  }

  @Test
  public void testCancelledIngest() throws Exception {
    Files.write(library.resolve("a.png"), encode(image(30, 20), "png"));
    final CancellationSignal cancellation = new CancellationSignal();
    cancellation.cancel();
    Assertions.assertThrows(
        CancellationException.class,
        () ->
            ingestor
                .ingest(library, FormatConfig.defaults(), ScanProgressListener.NONE, cancellation)
                .block(TIMEOUT));
  }
}
