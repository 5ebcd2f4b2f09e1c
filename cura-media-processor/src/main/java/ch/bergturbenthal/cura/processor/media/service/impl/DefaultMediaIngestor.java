package ch.bergturbenthal.cura.processor.media.service.impl;

import ch.bergturbenthal.cura.libs.exception.MediaException;
import ch.bergturbenthal.cura.libs.model.ErrorKind;
import ch.bergturbenthal.cura.libs.model.FormatConfig;
import ch.bergturbenthal.cura.libs.model.MediaFile;
import ch.bergturbenthal.cura.libs.model.MediaType;
import ch.bergturbenthal.cura.libs.model.ScanError;
import ch.bergturbenthal.cura.libs.model.ScanOutcome;
import ch.bergturbenthal.cura.libs.model.VideoToolStatus;
import ch.bergturbenthal.cura.libs.properties.MediaProperties;
import ch.bergturbenthal.cura.libs.service.AsyncService;
import ch.bergturbenthal.cura.libs.service.CancellationSignal;
import ch.bergturbenthal.cura.libs.service.ChecksumService;
import ch.bergturbenthal.cura.libs.service.DirectoryScanner;
import ch.bergturbenthal.cura.libs.service.ExternalToolProbe;
import ch.bergturbenthal.cura.libs.service.ImageMetadataReader;
import ch.bergturbenthal.cura.libs.service.ImageThumbnailer;
import ch.bergturbenthal.cura.libs.service.ScanProgressListener;
import ch.bergturbenthal.cura.libs.service.VideoFrameExtractor;
import ch.bergturbenthal.cura.libs.service.VideoMetadataReader;
import ch.bergturbenthal.cura.processor.media.model.IngestOutcome;
import ch.bergturbenthal.cura.processor.media.model.ProcessedMedia;
import ch.bergturbenthal.cura.processor.media.model.StageTimings;
import ch.bergturbenthal.cura.processor.media.service.MediaIngestor;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Slf4j
@Service
public class DefaultMediaIngestor implements MediaIngestor {
  private final DirectoryScanner directoryScanner;
  private final ChecksumService checksumService;
  private final ImageMetadataReader imageMetadataReader;
  private final VideoMetadataReader videoMetadataReader;
  private final ImageThumbnailer imageThumbnailer;
  private final VideoFrameExtractor videoFrameExtractor;
  private final ExternalToolProbe externalToolProbe;
  private final AsyncService asyncService;
  private final MediaProperties mediaProperties;
  private final Optional<MeterRegistry> meterRegistryOptional;

  public DefaultMediaIngestor(
      final DirectoryScanner directoryScanner,
      final ChecksumService checksumService,
      final ImageMetadataReader imageMetadataReader,
      final VideoMetadataReader videoMetadataReader,
      final ImageThumbnailer imageThumbnailer,
      final VideoFrameExtractor videoFrameExtractor,
      final ExternalToolProbe externalToolProbe,
      final AsyncService asyncService,
      final MediaProperties mediaProperties,
      final Optional<MeterRegistry> meterRegistryOptional) {
    this.directoryScanner = directoryScanner;
    this.checksumService = checksumService;
    this.imageMetadataReader = imageMetadataReader;
    this.videoMetadataReader = videoMetadataReader;
    this.imageThumbnailer = imageThumbnailer;
    this.videoFrameExtractor = videoFrameExtractor;
    this.externalToolProbe = externalToolProbe;
    this.asyncService = asyncService;
    this.mediaProperties = mediaProperties;
    this.meterRegistryOptional = meterRegistryOptional;
  }

  @Override
  @NotNull
  public Mono<IngestOutcome> ingest(
      final Path root,
      final FormatConfig config,
      final ScanProgressListener listener,
      final CancellationSignal cancellation) {
    final long startTime = System.nanoTime();
    final StageRecorder recorder = new StageRecorder(meterRegistryOptional);
    return directoryScanner
        .scan(root, config, listener, cancellation)
        .doOnNext(scanOutcome -> recorder.scanned(System.nanoTime() - startTime))
        .flatMap(
            scanOutcome ->
                videoToolStatus(scanOutcome)
                    .flatMap(
                        videoTools ->
                            Flux.fromIterable(scanOutcome.getFiles())
                                .filter(f -> !cancellation.isCancelled())
                                .flatMap(
                                    file -> process(file, videoTools, recorder),
                                    Math.max(1, mediaProperties.getWorkerThreads()))
                                .takeUntilOther(cancellation.whenCancelled())
                                .collectList()
                                .map(
                                    results -> {
                                      if (cancellation.isCancelled())
                                        throw new CancellationException(
                                            "Ingest of " + root + " cancelled");
                                      return createOutcome(scanOutcome, results, recorder.timings());
                                    })))
        .doOnNext(
            outcome ->
                log.info(
                    "Ingested "
                        + outcome.getItems().size()
                        + " of "
                        + (outcome.getImageCount() + outcome.getVideoCount())
                        + " files from "
                        + root
                        + " in "
                        + Duration.ofNanos(System.nanoTime() - startTime)));
  }

  private Mono<VideoToolStatus> videoToolStatus(final ScanOutcome scanOutcome) {
    if (scanOutcome.getVideoCount() == 0)
      return Mono.just(VideoToolStatus.unavailable("No videos found"));
    return asyncService.asyncMono(externalToolProbe::videoToolStatus);
  }

  private Mono<FileResult> process(
      final MediaFile file, final VideoToolStatus videoTools, final StageRecorder recorder) {
    final Path path = file.getPath();
    final MediaType mediaType = file.getMediaType();
    final Mono<ProcessedMedia> processed;
    if (file.getMediaType() == MediaType.IMAGE) {
      processed =
          Mono.zip(
                  asyncService.asyncMono(() -> checksumService.checksum(path)),
                  asyncService.asyncMono(
                      recorder.metadata(mediaType, () -> imageMetadataReader.readImage(path))))
              .flatMap(
                  checksumAndMetadata ->
                      asyncService.asyncMono(
                          recorder.thumbnail(
                              mediaType,
                              () ->
                                  new ProcessedMedia(
                                      file,
                                      checksumAndMetadata.getT1(),
                                      checksumAndMetadata.getT2(),
                                      imageThumbnailer.generate(
                                          path,
                                          checksumAndMetadata.getT1(),
                                          checksumAndMetadata.getT2().getOrientation())))));
    } else if (!videoTools.isAvailable()) {
      processed =
          Mono.error(
              new MediaException(
                  ErrorKind.EXTERNAL_TOOL_UNAVAILABLE, videoTools.getError().orElse("unknown")));
    } else {
      processed =
          Mono.zip(
                  asyncService.asyncMono(() -> checksumService.checksum(path)),
                  asyncService.asyncMono(
                      recorder.metadata(mediaType, () -> videoMetadataReader.readVideo(path))))
              .flatMap(
                  checksumAndMetadata ->
                      asyncService.asyncMono(
                          recorder.thumbnail(
                              mediaType,
                              () ->
                                  new ProcessedMedia(
                                      file,
                                      checksumAndMetadata.getT1(),
                                      checksumAndMetadata.getT2(),
                                      videoFrameExtractor.generate(
                                          path,
                                          checksumAndMetadata.getT1(),
                                          checksumAndMetadata.getT2().getDurationSeconds(),
                                          checksumAndMetadata.getT2().getVideoCodec())))));
    }
    return processed
        .map(FileResult::success)
        .doOnNext(result -> recorder.processed(mediaType, true))
        .onErrorResume(
            ex -> !(ex instanceof CancellationException),
            ex -> {
              final ScanError error;
              if (ex instanceof MediaException) {
                error = ScanError.of(path, (MediaException) ex);
              } else {
                log.warn("Unexpected error on " + path, ex);
                error = ScanError.of(path, ErrorKind.DECODE_FAILURE, String.valueOf(ex.getMessage()));
              }
              log.warn("Cannot process " + path + ": " + error.getMessage());
              recorder.processed(mediaType, false);
              return Mono.just(FileResult.failure(error));
            });
  }

  private static IngestOutcome createOutcome(
      final ScanOutcome scanOutcome, final List<FileResult> results, final StageTimings timings) {
    final List<ProcessedMedia> items = new ArrayList<>();
    final List<ScanError> errors = new ArrayList<>(scanOutcome.getErrors());
    for (FileResult result : results) {
      if (result.getMedia() != null) items.add(result.getMedia());
      else errors.add(result.getError());
    }
    return new IngestOutcome(
        List.copyOf(items),
        scanOutcome.getImageCount(),
        scanOutcome.getVideoCount(),
        List.copyOf(errors),
        timings);
  }

  /** Sums stage times of one ingest and mirrors them into the meter registry when present. */
  private static class StageRecorder {
    private final Optional<MeterRegistry> meterRegistryOptional;
    private final AtomicLong scanNanos = new AtomicLong();
    private final AtomicLong metadataNanos = new AtomicLong();
    private final AtomicLong thumbnailNanos = new AtomicLong();
    private final AtomicInteger processedCount = new AtomicInteger();

    StageRecorder(final Optional<MeterRegistry> meterRegistryOptional) {
      this.meterRegistryOptional = meterRegistryOptional;
    }

    private static String typeTag(final MediaType mediaType) {
      return mediaType.name().toLowerCase(Locale.ROOT);
    }

    void scanned(final long elapsedNanos) {
      scanNanos.set(elapsedNanos);
      meterRegistryOptional.ifPresent(
          meterRegistry ->
              meterRegistry.timer("cura.ingest.scan").record(elapsedNanos, TimeUnit.NANOSECONDS));
    }

    <T> Callable<T> metadata(final MediaType mediaType, final Callable<T> callable) {
      return timed(metadataNanos, "cura.ingest.metadata", mediaType, callable);
    }

    <T> Callable<T> thumbnail(final MediaType mediaType, final Callable<T> callable) {
      return timed(thumbnailNanos, "cura.ingest.thumbnail", mediaType, callable);
    }

    void processed(final MediaType mediaType, final boolean success) {
      if (success) processedCount.incrementAndGet();
      meterRegistryOptional.ifPresent(
          meterRegistry ->
              meterRegistry
                  .counter(
                      "cura.ingest.processed",
                      "type",
                      typeTag(mediaType),
                      "result",
                      success ? "success" : "failure")
                  .increment());
    }

    StageTimings timings() {
      return new StageTimings(
          Duration.ofNanos(scanNanos.get()),
          Duration.ofNanos(metadataNanos.get()),
          Duration.ofNanos(thumbnailNanos.get()),
          processedCount.get());
    }

    private <T> Callable<T> timed(
        final AtomicLong total,
        final String meterName,
        final MediaType mediaType,
        final Callable<T> callable) {
      return () -> {
        final long startTime = System.nanoTime();
        try {
          return callable.call();
        } finally {
          final long elapsed = System.nanoTime() - startTime;
          total.addAndGet(elapsed);
          meterRegistryOptional.ifPresent(
              meterRegistry ->
                  meterRegistry
                      .timer(meterName, "type", typeTag(mediaType))
                      .record(elapsed, TimeUnit.NANOSECONDS));
        }
      };
    }
  }

  @Value
  private static class FileResult {
    ProcessedMedia media;
    ScanError error;

    static FileResult success(final ProcessedMedia media) {
      return new FileResult(media, null);
    }

    static FileResult failure(final ScanError error) {
      return new FileResult(null, error);
    }
  }
}
