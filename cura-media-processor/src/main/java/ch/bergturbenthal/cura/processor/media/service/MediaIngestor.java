package ch.bergturbenthal.cura.processor.media.service;

import ch.bergturbenthal.cura.libs.model.FormatConfig;
import ch.bergturbenthal.cura.libs.service.CancellationSignal;
import ch.bergturbenthal.cura.libs.service.ScanProgressListener;
import ch.bergturbenthal.cura.processor.media.model.IngestOutcome;
import java.nio.file.Path;
import reactor.core.publisher.Mono;

public interface MediaIngestor {
  /**
   * Scans the tree and reads checksum, metadata and thumbnails of every found file. Failures of single files are
   * reported in the outcome.
   */
  Mono<IngestOutcome> ingest(
      Path root,
      FormatConfig config,
      ScanProgressListener listener,
      CancellationSignal cancellation);
}
