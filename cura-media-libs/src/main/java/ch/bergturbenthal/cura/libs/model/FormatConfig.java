package ch.bergturbenthal.cura.libs.model;

import ch.bergturbenthal.cura.libs.exception.InvalidFormatConfigException;
import lombok.Value;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Allow-lists of file endings, lower case and without the leading dot.
 */
@Value
public class FormatConfig {
    public static final List<String> DEFAULT_IMAGE_FORMATS = List.of("jpg", "jpeg", "png", "heic", "raw", "cr2",
            "nef", "dng", "arw", "webp", "gif", "bmp", "tiff");
    public static final List<String> DEFAULT_VIDEO_FORMATS = List.of("mp4", "mov", "avi", "mkv", "webm", "flv", "wmv",
            "m4v", "mpg", "mpeg", "3gp");

    Set<String> imageFormats;
    Set<String> videoFormats;

    public static FormatConfig defaults() {
        return of(DEFAULT_IMAGE_FORMATS, DEFAULT_VIDEO_FORMATS);
    }

    public static FormatConfig of(final Collection<String> imageFormats, final Collection<String> videoFormats) {
        return new FormatConfig(Collections.unmodifiableSet(new LinkedHashSet<>(imageFormats)),
                Collections.unmodifiableSet(new LinkedHashSet<>(videoFormats)));
    }

    public Optional<MediaType> lookup(final String extension) {
        final String ending = extension.toLowerCase(Locale.ROOT);
        if (imageFormats.contains(ending))
            return Optional.of(MediaType.IMAGE);
        if (videoFormats.contains(ending))
            return Optional.of(MediaType.VIDEO);
        return Optional.empty();
    }

    public FormatConfig validate() {
        for (String format : imageFormats)
            validateFormat(format);
        for (String format : videoFormats)
            validateFormat(format);
        if (imageFormats.isEmpty())
            throw new InvalidFormatConfigException("At least one image format must be selected.");
        if (videoFormats.isEmpty())
            throw new InvalidFormatConfigException("At least one video format must be selected.");
        return this;
    }

    private static void validateFormat(final String format) {
        if (format == null || format.isEmpty())
            throw new InvalidFormatConfigException("Format string cannot be empty.");
        if (format.indexOf('.') >= 0)
            throw new InvalidFormatConfigException(
                    "Format string '" + format + "' cannot contain dots. Use 'jpg' instead of '.jpg'.");
        if (!format.equals(format.toLowerCase(Locale.ROOT)))
            throw new InvalidFormatConfigException("Format string '" + format + "' must be lowercase.");
        for (int i = 0; i < format.length(); i++) {
            if (!Character.isLetterOrDigit(format.charAt(i)))
                throw new InvalidFormatConfigException("Format string '" + format
                        + "' contains invalid characters. Only alphanumeric characters are allowed.");
        }
    }
}
