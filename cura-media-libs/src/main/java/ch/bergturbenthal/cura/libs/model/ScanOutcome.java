package ch.bergturbenthal.cura.libs.model;

import lombok.Value;

import java.util.List;

@Value
public class ScanOutcome {
    List<MediaFile> files;
    int imageCount;
    int videoCount;
    List<ScanError> errors;

    public int getTotalCount() {
        return imageCount + videoCount;
    }
}
