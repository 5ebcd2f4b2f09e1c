package ch.bergturbenthal.cura.libs.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Objects;

/**
 * Metadata of a single image or video.
 * <p>
 * Optional values are {@code null} when absent. {@code width} and {@code height} are the display dimensions, so for
 * orientations 5 to 8 they are swapped against the stored pixel raster. {@code captureDate} is never empty, it falls
 * back to {@code fileModified}.
 */
@Value
public class MediaMetadata {
    MediaType mediaType;
    Instant captureDate;
    String cameraMake;
    String cameraModel;
    Double gpsLatitude;
    Double gpsLongitude;
    int width;
    int height;
    int orientation;
    Double durationSeconds;
    String videoCodec;
    long fileSize;
    Instant fileModified;

    @Builder
    private MediaMetadata(final MediaType mediaType, final Instant captureDate, final String cameraMake,
            final String cameraModel, final Double gpsLatitude, final Double gpsLongitude, final int width,
            final int height, final int orientation, final Double durationSeconds, final String videoCodec,
            final long fileSize, final Instant fileModified) {
        this.mediaType = Objects.requireNonNull(mediaType, "mediaType");
        this.fileModified = Objects.requireNonNull(fileModified, "fileModified");
        if (width <= 0 || height <= 0)
            throw new IllegalArgumentException("Invalid dimensions " + width + "x" + height);
        if ((gpsLatitude == null) != (gpsLongitude == null))
            throw new IllegalArgumentException("Latitude and longitude must be set together");
        if (gpsLatitude != null && (gpsLatitude < -90 || gpsLatitude > 90))
            throw new IllegalArgumentException("Latitude out of range: " + gpsLatitude);
        if (gpsLongitude != null && (gpsLongitude < -180 || gpsLongitude > 180))
            throw new IllegalArgumentException("Longitude out of range: " + gpsLongitude);
        final int effectiveOrientation = orientation == 0 ? 1 : orientation;
        if (effectiveOrientation < 1 || effectiveOrientation > 8)
            throw new IllegalArgumentException("Invalid orientation " + orientation);
        switch (mediaType) {
        case IMAGE:
            if (durationSeconds != null || videoCodec != null)
                throw new IllegalArgumentException("An image has no duration or codec");
            break;
        case VIDEO:
            if (cameraMake != null || cameraModel != null || gpsLatitude != null)
                throw new IllegalArgumentException("Camera and location fields are not read from videos");
            if (durationSeconds == null || videoCodec == null)
                throw new IllegalArgumentException("A video needs a duration and a codec");
            if (effectiveOrientation != 1)
                throw new IllegalArgumentException("Videos are not oriented");
            break;
        }
        this.captureDate = captureDate != null ? captureDate : fileModified;
        this.cameraMake = cameraMake;
        this.cameraModel = cameraModel;
        this.gpsLatitude = gpsLatitude;
        this.gpsLongitude = gpsLongitude;
        this.width = width;
        this.height = height;
        this.orientation = effectiveOrientation;
        this.durationSeconds = durationSeconds;
        this.videoCodec = videoCodec;
        this.fileSize = fileSize;
    }
}
