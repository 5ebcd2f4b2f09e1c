package ch.bergturbenthal.cura.libs.model;

import lombok.Value;

import java.nio.file.Path;

@Value
public class ThumbnailPaths {
    Path small;
    Path medium;

    public Path get(final SizeClass sizeClass) {
        switch (sizeClass) {
        case SMALL:
            return small;
        case MEDIUM:
            return medium;
        default:
            throw new IllegalArgumentException("Unknown size class " + sizeClass);
        }
    }
}
