package ch.bergturbenthal.cura.libs.service;

import ch.bergturbenthal.cura.libs.model.VideoToolStatus;

/**
 * Detects the external decoders once per process.
 */
public interface ExternalToolProbe {
    VideoToolStatus videoToolStatus();

    boolean hasDcraw();

    boolean hasHeicConverter();
}
