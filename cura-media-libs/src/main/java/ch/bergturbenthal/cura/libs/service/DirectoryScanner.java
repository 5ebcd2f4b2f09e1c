package ch.bergturbenthal.cura.libs.service;

import ch.bergturbenthal.cura.libs.model.FormatConfig;
import ch.bergturbenthal.cura.libs.model.ScanOutcome;
import reactor.core.publisher.Mono;

import java.nio.file.Path;

public interface DirectoryScanner {
    /**
     * Walks the tree below {@code root} and collects all media files.
     * <p>
     * Entries that cannot be read end up in {@link ScanOutcome#getErrors()}. The returned {@link Mono} fails with a
     * {@link ch.bergturbenthal.cura.libs.exception.ScanException} for an unusable root or a symbolic link loop, and
     * with a {@link java.util.concurrent.CancellationException} when the signal is cancelled.
     */
    Mono<ScanOutcome> scan(Path root, FormatConfig config, ScanProgressListener listener,
            CancellationSignal cancellation);

    default Mono<ScanOutcome> scan(Path root, FormatConfig config) {
        return scan(root, config, ScanProgressListener.NONE, new CancellationSignal());
    }
}
