package ch.bergturbenthal.cura.processor.media.model;

import java.time.Duration;
import lombok.Value;

/**
 * Time spent per pipeline stage of one ingest. Metadata and thumbnail times are summed over all
 * files, the averages divide by the number of successfully processed files.
 */
@Value
public class StageTimings {
  public static final StageTimings EMPTY =
      new StageTimings(Duration.ZERO, Duration.ZERO, Duration.ZERO, 0);

  Duration scanTime;
  Duration metadataTime;
  Duration thumbnailTime;
  int processedCount;

  public Duration averageMetadataTime() {
    return average(metadataTime);
  }

  public Duration averageThumbnailTime() {
    return average(thumbnailTime);
  }

  private Duration average(final Duration total) {
    if (processedCount == 0) return Duration.ZERO;
    return total.dividedBy(processedCount);
  }
}
