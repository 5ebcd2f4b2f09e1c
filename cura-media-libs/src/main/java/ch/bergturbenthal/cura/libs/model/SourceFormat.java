package ch.bergturbenthal.cura.libs.model;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Decoder families, selected by file ending first and by detected mime type second.
 */
public enum SourceFormat {
    JPEG, PNG, RASTER, HEIC, RAW, VIDEO;

    private static final Set<String> JPEG_ENDINGS = Set.of("jpg", "jpeg", "jpe");
    private static final Set<String> HEIC_ENDINGS = Set.of("heic", "heif");
    private static final Set<String> RAW_ENDINGS = Set.of("raw", "nef", "dng", "cr2", "crw", "cr3", "arw", "orf",
            "rw2", "raf");
    private static final Set<String> RASTER_ENDINGS = Set.of("gif", "bmp", "tif", "tiff", "webp", "pnm", "ppm");
    private static final Set<String> VIDEO_ENDINGS = Set.of("mp4", "mov", "avi", "mkv", "webm", "flv", "wmv", "m4v",
            "mpg", "mpeg", "3gp");

    public static Optional<SourceFormat> fromExtension(final String extension) {
        if (extension == null)
            return Optional.empty();
        final String ending = extension.toLowerCase(Locale.ROOT);
        if (JPEG_ENDINGS.contains(ending))
            return Optional.of(JPEG);
        if (ending.equals("png"))
            return Optional.of(PNG);
        if (HEIC_ENDINGS.contains(ending))
            return Optional.of(HEIC);
        if (RAW_ENDINGS.contains(ending))
            return Optional.of(RAW);
        if (RASTER_ENDINGS.contains(ending))
            return Optional.of(RASTER);
        if (VIDEO_ENDINGS.contains(ending))
            return Optional.of(VIDEO);
        return Optional.empty();
    }

    public static Optional<SourceFormat> fromMimeType(final String mimeType) {
        if (mimeType == null)
            return Optional.empty();
        final String type = mimeType.toLowerCase(Locale.ROOT);
        if (type.equals("image/jpeg"))
            return Optional.of(JPEG);
        if (type.equals("image/png"))
            return Optional.of(PNG);
        if (type.equals("image/heic") || type.equals("image/heif"))
            return Optional.of(HEIC);
        if (type.startsWith("image/x-") && (type.contains("raw") || type.contains("canon") || type.contains("nikon")
                || type.contains("sony") || type.contains("adobe-dng")))
            return Optional.of(RAW);
        if (type.startsWith("image/"))
            return Optional.of(RASTER);
        if (type.startsWith("video/"))
            return Optional.of(VIDEO);
        return Optional.empty();
    }
}
