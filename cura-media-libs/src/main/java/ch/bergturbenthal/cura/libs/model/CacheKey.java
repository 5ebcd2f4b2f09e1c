package ch.bergturbenthal.cura.libs.model;

import lombok.Value;

@Value
public class CacheKey {
    String checksum;
    SizeClass sizeClass;

    public String fileName() {
        return checksum + "_" + sizeClass.getSuffix() + ".jpg";
    }
}
