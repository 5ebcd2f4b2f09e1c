package ch.bergturbenthal.cura.libs.service.impl;

import ch.bergturbenthal.cura.libs.exception.MediaException;
import ch.bergturbenthal.cura.libs.model.FileFacts;
import ch.bergturbenthal.cura.libs.model.MediaMetadata;
import ch.bergturbenthal.cura.libs.model.MediaType;
import ch.bergturbenthal.cura.libs.model.VideoProbe;
import ch.bergturbenthal.cura.libs.service.VideoMetadataReader;
import ch.bergturbenthal.cura.libs.service.VideoProber;
import org.springframework.stereotype.Service;

import java.nio.file.Path;

@Service
public class ProbingVideoMetadataReader implements VideoMetadataReader {
    private final VideoProber videoProber;

    public ProbingVideoMetadataReader(final VideoProber videoProber) {
        this.videoProber = videoProber;
    }

    @Override
    public MediaMetadata readVideo(final Path path) throws MediaException {
        final FileFacts fileFacts = FileFacts.read(path);
        final VideoProbe probe = videoProber.probe(path);
        return MediaMetadata.builder()
                .mediaType(MediaType.VIDEO)
                .width(probe.getWidth())
                .height(probe.getHeight())
                .durationSeconds(probe.getDurationSeconds())
                .videoCodec(probe.getCodecName())
                .fileSize(fileFacts.getSize())
                .fileModified(fileFacts.getModified())
                .build();
    }
}
