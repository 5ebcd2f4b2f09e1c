package ch.bergturbenthal.cura.libs.service.impl;

import ch.bergturbenthal.cura.libs.model.FormatConfig;
import ch.bergturbenthal.cura.libs.model.MediaType;
import ch.bergturbenthal.cura.libs.service.FormatClassifier;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Optional;

@Service
public class DefaultFormatClassifier implements FormatClassifier {

    @Override
    public Optional<MediaType> classify(final Path path, final FormatConfig config) {
        final Path fileName = path.getFileName();
        if (fileName == null)
            return Optional.empty();
        final String name = fileName.toString();
        // ".jpg" is a hidden file without ending
        if (name.lastIndexOf('.') <= 0)
            return Optional.empty();
        return classifyExtension(FilenameUtils.getExtension(name), config);
    }

    @Override
    public Optional<MediaType> classifyExtension(final String extension, final FormatConfig config) {
        if (extension == null || extension.isEmpty())
            return Optional.empty();
        final String ending = extension.startsWith(".") ? extension.substring(1) : extension;
        return config.lookup(ending);
    }
}
