package ch.bergturbenthal.cura.libs.model;

import lombok.Value;

@Value
public class ScanProgress {
    int discovered;
    String currentFile;
    boolean finished;
}
