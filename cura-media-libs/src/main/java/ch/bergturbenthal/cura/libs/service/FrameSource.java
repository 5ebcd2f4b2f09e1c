package ch.bergturbenthal.cura.libs.service;

import ch.bergturbenthal.cura.libs.exception.MediaException;

import java.nio.file.Path;

/**
 * Decodes one frame of a video into encoded image bytes.
 */
public interface FrameSource {
    byte[] extractFrame(Path path, double seekSeconds) throws MediaException;
}
