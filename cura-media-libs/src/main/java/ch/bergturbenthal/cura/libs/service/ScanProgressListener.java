package ch.bergturbenthal.cura.libs.service;

import ch.bergturbenthal.cura.libs.model.ScanProgress;

/**
 * Receives coarse grained progress of a scan. Called from worker threads.
 */
@FunctionalInterface
public interface ScanProgressListener {
    ScanProgressListener NONE = progress -> {
    };

    void onProgress(ScanProgress progress);
}
