package ch.bergturbenthal.cura.libs.service;

import ch.bergturbenthal.cura.libs.model.FormatConfig;
import ch.bergturbenthal.cura.libs.model.MediaType;

import java.nio.file.Path;
import java.util.Optional;

public interface FormatClassifier {
    /**
     * @return the media type of the file ending, empty for endings in neither list
     */
    Optional<MediaType> classify(Path path, FormatConfig config);

    Optional<MediaType> classifyExtension(String extension, FormatConfig config);
}
