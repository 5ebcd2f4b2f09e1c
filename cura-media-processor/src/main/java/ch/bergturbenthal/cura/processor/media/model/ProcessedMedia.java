package ch.bergturbenthal.cura.processor.media.model;

import ch.bergturbenthal.cura.libs.model.MediaFile;
import ch.bergturbenthal.cura.libs.model.MediaMetadata;
import ch.bergturbenthal.cura.libs.model.ThumbnailPaths;
import lombok.Value;

@Value
public class ProcessedMedia {
  MediaFile file;
  String checksum;
  MediaMetadata metadata;
  ThumbnailPaths thumbnails;
}
