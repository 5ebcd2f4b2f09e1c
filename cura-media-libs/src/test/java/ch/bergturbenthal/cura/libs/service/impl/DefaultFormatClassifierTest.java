package ch.bergturbenthal.cura.libs.service.impl;

import ch.bergturbenthal.cura.libs.model.FormatConfig;
import ch.bergturbenthal.cura.libs.model.MediaType;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

public class DefaultFormatClassifierTest {
    private final DefaultFormatClassifier classifier = new DefaultFormatClassifier();
    private final FormatConfig config = FormatConfig.defaults();

    @Test
    public void testClassifiesByEnding() {
        Assertions.assertEquals(Optional.of(MediaType.IMAGE), classifier.classify(Path.of("/a/b/photo.jpg"), config));
        Assertions.assertEquals(Optional.of(MediaType.IMAGE), classifier.classify(Path.of("photo.NEF"), config));
        Assertions.assertEquals(Optional.of(MediaType.VIDEO), classifier.classify(Path.of("clip.MP4"), config));
        Assertions.assertEquals(Optional.of(MediaType.VIDEO), classifier.classify(Path.of("clip.tar.mov"), config));
    }

    @Test
    public void testIgnoresUnknownOrMissingEndings() {
        Assertions.assertEquals(Optional.empty(), classifier.classify(Path.of("notes.txt"), config));
        Assertions.assertEquals(Optional.empty(), classifier.classify(Path.of("README"), config));
        Assertions.assertEquals(Optional.empty(), classifier.classify(Path.of(".jpg"), config));
        Assertions.assertEquals(Optional.empty(), classifier.classify(Path.of("photo."), config));
    }

    @Test
    public void testFollowsConfiguration() {
        final FormatConfig onlyPng = FormatConfig.of(List.of("png"), List.of("mkv"));
        Assertions.assertEquals(Optional.empty(), classifier.classify(Path.of("photo.jpg"), onlyPng));
        Assertions.assertEquals(Optional.of(MediaType.IMAGE), classifier.classify(Path.of("photo.png"), onlyPng));
        Assertions.assertEquals(Optional.of(MediaType.VIDEO), classifier.classifyExtension(".MKV", onlyPng));
    }
}
