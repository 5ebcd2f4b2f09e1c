package ch.bergturbenthal.cura.libs.model;

import lombok.Value;

import java.util.Optional;

@Value
public class VideoToolStatus {
    boolean available;
    Optional<String> version;
    Optional<String> error;

    public static VideoToolStatus available(final String version) {
        return new VideoToolStatus(true, Optional.ofNullable(version), Optional.empty());
    }

    public static VideoToolStatus unavailable(final String error) {
        return new VideoToolStatus(false, Optional.empty(), Optional.of(error));
    }
}
