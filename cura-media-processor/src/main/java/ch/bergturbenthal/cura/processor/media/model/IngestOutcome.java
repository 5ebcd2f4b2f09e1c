package ch.bergturbenthal.cura.processor.media.model;

import ch.bergturbenthal.cura.libs.model.ScanError;
import java.util.List;
import lombok.Value;

/**
 * Counts are taken from discovery, {@code errors} holds scan errors and per file processing errors.
 * {@code timings} is never null.
 */
@Value
public class IngestOutcome {
  List<ProcessedMedia> items;
  int imageCount;
  int videoCount;
  List<ScanError> errors;
  StageTimings timings;
}
