package ch.bergturbenthal.cura.libs.service;

import ch.bergturbenthal.cura.libs.exception.MediaException;
import ch.bergturbenthal.cura.libs.model.VideoProbe;

import java.nio.file.Path;

/**
 * Duration, codec and size of the first video stream in a single round trip.
 */
public interface VideoProber {
    VideoProbe probe(Path path) throws MediaException;
}
