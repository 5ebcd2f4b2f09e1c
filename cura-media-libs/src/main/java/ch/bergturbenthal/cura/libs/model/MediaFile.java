package ch.bergturbenthal.cura.libs.model;

import lombok.Value;

import java.nio.file.Path;

@Value
public class MediaFile {
    Path path;
    MediaType mediaType;
}
