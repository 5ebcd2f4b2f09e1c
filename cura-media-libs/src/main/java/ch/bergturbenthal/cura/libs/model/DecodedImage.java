package ch.bergturbenthal.cura.libs.model;

import lombok.Value;

import java.awt.image.BufferedImage;

@Value
public class DecodedImage {
    BufferedImage image;
    // dcraw rotates on its own
    boolean orientationApplied;
}
