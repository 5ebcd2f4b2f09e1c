package ch.bergturbenthal.cura.libs.service.impl;

import ch.bergturbenthal.cura.libs.model.VideoToolStatus;
import ch.bergturbenthal.cura.libs.properties.MediaProperties;
import ch.bergturbenthal.cura.libs.service.ExternalToolProbe;
import ch.bergturbenthal.cura.libs.util.ExternalProcessRunner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

@Slf4j
@Service
public class DefaultExternalToolProbe implements ExternalToolProbe {
    private final MediaProperties properties;
    private VideoToolStatus videoToolStatus;
    private Boolean hasDcraw;
    private Boolean hasHeicConverter;

    public DefaultExternalToolProbe(final MediaProperties properties) {
        this.properties = properties;
    }

    @Override
    public synchronized VideoToolStatus videoToolStatus() {
        if (videoToolStatus == null) {
            videoToolStatus = detectVideoTools();
            if (videoToolStatus.isAvailable())
                log.info("Video support enabled, ffmpeg version {}", videoToolStatus.getVersion().orElse("unknown"));
            else
                log.warn("Video support disabled: {}", videoToolStatus.getError().orElse(""));
        }
        return videoToolStatus;
    }

    @Override
    public synchronized boolean hasDcraw() {
        if (hasDcraw == null)
            hasDcraw = canStart(properties.getDcrawCommand());
        return hasDcraw;
    }

    @Override
    public synchronized boolean hasHeicConverter() {
        if (hasHeicConverter == null)
            hasHeicConverter = canStart(properties.getHeicCommand(), "-version");
        return hasHeicConverter;
    }

    private VideoToolStatus detectVideoTools() {
        final Optional<String> ffmpegVersion = readVersion(properties.getFfmpegCommand());
        if (ffmpegVersion.isEmpty())
            return VideoToolStatus.unavailable("FFmpeg is not installed or not in PATH");
        if (readVersion(properties.getFfprobeCommand()).isEmpty())
            return VideoToolStatus.unavailable("FFprobe is not installed or not in PATH");
        return VideoToolStatus.available(ffmpegVersion.get());
    }

    private Optional<String> readVersion(final String command) {
        try {
            final ExternalProcessRunner.ExecuteResult result = ExternalProcessRunner
                    .execute(new String[] { command, "-version" }, properties.getToolCheckTimeout());
            if (result.getCode() != 0) {
                log.warn("{} -version exited with {}", command, result.getCode());
                return Optional.empty();
            }
            return Optional.of(parseVersion(new String(result.getStdOut(), StandardCharsets.UTF_8)));
        } catch (IOException | TimeoutException ex) {
            log.warn("{} not found", command, ex);
            return Optional.empty();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    /**
     * Takes the third token of a line like {@code ffmpeg version 6.1.1 Copyright ...}.
     */
    static String parseVersion(final String versionOutput) {
        final String firstLine = versionOutput.lines().findFirst().orElse("").trim();
        final String[] tokens = firstLine.split("\\s+");
        if (tokens.length >= 3 && tokens[1].equals("version"))
            return tokens[2];
        return firstLine.isEmpty() ? "unknown" : firstLine;
    }

    private boolean canStart(final String... command) {
        try {
            final ExternalProcessRunner.ExecuteResult result = ExternalProcessRunner.execute(command,
                    properties.getToolCheckTimeout());
            log.debug("{} exited with {}", command[0], result.getCode());
            return true;
        } catch (IOException | TimeoutException ex) {
            log.warn("{} not usable", command[0], ex);
            return false;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
