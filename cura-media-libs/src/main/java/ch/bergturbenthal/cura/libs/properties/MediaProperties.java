package ch.bergturbenthal.cura.libs.properties;

import ch.bergturbenthal.cura.libs.model.FormatConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.lang.NonNull;
import org.springframework.validation.annotation.Validated;

import java.io.File;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "cura.media")
@Data
@Validated
public class MediaProperties {
    @NonNull
    private File cacheDir = new File(System.getProperty("java.io.tmpdir"), "cura-thumbnails");
    private int workerThreads = Runtime.getRuntime().availableProcessors();
    private int progressInterval = 100;
    private boolean followSymlinks = false;
    private List<String> imageFormats = new ArrayList<>(FormatConfig.DEFAULT_IMAGE_FORMATS);
    private List<String> videoFormats = new ArrayList<>(FormatConfig.DEFAULT_VIDEO_FORMATS);
    private String ffmpegCommand = "ffmpeg";
    private String ffprobeCommand = "ffprobe";
    private String dcrawCommand = "dcraw";
    private String heicCommand = "convert";
    private Duration frameTimeout = Duration.ofSeconds(60);
    private Duration probeTimeout = Duration.ofSeconds(30);
    private Duration decodeTimeout = Duration.ofMinutes(2);
    private Duration toolCheckTimeout = Duration.ofSeconds(10);

    public FormatConfig toFormatConfig() {
        return FormatConfig.of(imageFormats, videoFormats).validate();
    }
}
