package ch.bergturbenthal.cura.libs.model;

import lombok.Value;

@Value
public class VideoProbe {
    double durationSeconds;
    String codecName;
    int width;
    int height;
}
