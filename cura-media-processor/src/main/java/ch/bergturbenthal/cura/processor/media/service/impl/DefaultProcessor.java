package ch.bergturbenthal.cura.processor.media.service.impl;

import ch.bergturbenthal.cura.libs.exception.ScanException;
import ch.bergturbenthal.cura.libs.model.CodecStat;
import ch.bergturbenthal.cura.libs.model.FormatConfig;
import ch.bergturbenthal.cura.libs.model.ScanError;
import ch.bergturbenthal.cura.libs.properties.MediaProperties;
import ch.bergturbenthal.cura.libs.service.CancellationSignal;
import ch.bergturbenthal.cura.libs.service.CodecPerformanceTracker;
import ch.bergturbenthal.cura.processor.media.model.IngestOutcome;
import ch.bergturbenthal.cura.processor.media.model.StageTimings;
import ch.bergturbenthal.cura.processor.media.properties.JobProperties;
import ch.bergturbenthal.cura.processor.media.service.MediaIngestor;
import ch.bergturbenthal.cura.processor.media.service.Processor;
import java.nio.file.Path;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class DefaultProcessor implements Processor {
  private final JobProperties jobProperties;
  private final MediaProperties mediaProperties;
  private final MediaIngestor mediaIngestor;
  private final CodecPerformanceTracker codecPerformanceTracker;

  public DefaultProcessor(
      final JobProperties jobProperties,
      final MediaProperties mediaProperties,
      final MediaIngestor mediaIngestor,
      final CodecPerformanceTracker codecPerformanceTracker) {
    this.jobProperties = jobProperties;
    this.mediaProperties = mediaProperties;
    this.mediaIngestor = mediaIngestor;
    this.codecPerformanceTracker = codecPerformanceTracker;
  }

  @Override
  public boolean run() {
    if (jobProperties.getRoot() == null) {
      log.error("No root directory configured, set cura.job.root");
      return false;
    }
    final Path root = jobProperties.getRoot().toPath();
    final FormatConfig formatConfig = mediaProperties.toFormatConfig();
    final CancellationSignal cancellation = new CancellationSignal();
    final Thread shutdownHook = new Thread(cancellation::cancel, "cancel-ingest");
    Runtime.getRuntime().addShutdownHook(shutdownHook);
    try {
      final IngestOutcome outcome =
          mediaIngestor
              .ingest(
                  root,
                  formatConfig,
                  progress -> {
                    if (progress.isFinished())
                      log.info("Discovered " + progress.getDiscovered() + " files");
                    else
                      log.info(
                          "Discovered "
                              + progress.getDiscovered()
                              + " files, at "
                              + progress.getCurrentFile());
                  },
                  cancellation)
              .block();
      if (outcome == null) return false;
      log.info(
          "Processed "
              + outcome.getItems().size()
              + " files ("
              + outcome.getImageCount()
              + " images, "
              + outcome.getVideoCount()
              + " videos) into "
              + mediaProperties.getCacheDir());
      final StageTimings timings = outcome.getTimings();
      log.info(
          "Scan took "
              + timings.getScanTime()
              + ", average metadata "
              + timings.averageMetadataTime()
              + ", average thumbnail "
              + timings.averageThumbnailTime());
      for (ScanError error : outcome.getErrors()) {
        log.warn(
            error.getPath() + ": " + error.getMessage() + " (" + error.getKind().getUserMessage() + ")");
      }
      for (CodecStat stat : codecPerformanceTracker.snapshot()) {
        log.info(
            String.format(
                Locale.ROOT,
                "Codec %s: %d samples, %.1f ms average, %.0f%% success",
                stat.getCodecName(),
                stat.getSampleCount(),
                stat.getAvgTimeMs(),
                stat.getSuccessRate() * 100));
      }
      return outcome.getErrors().isEmpty();
    } catch (ScanException ex) {
      log.error("Cannot scan " + root + " (" + ex.getReason() + "): " + ex.getMessage());
      return false;
    } finally {
      try {
        Runtime.getRuntime().removeShutdownHook(shutdownHook);
      } catch (IllegalStateException ex) {
        log.debug("Shutdown in progress", ex);
      }
    }
  }
}
