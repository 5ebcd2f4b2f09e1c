package ch.bergturbenthal.cura.libs.service.impl;

import ch.bergturbenthal.cura.libs.exception.MediaException;
import ch.bergturbenthal.cura.libs.model.ErrorKind;
import ch.bergturbenthal.cura.libs.model.VideoProbe;
import ch.bergturbenthal.cura.libs.properties.MediaProperties;
import ch.bergturbenthal.cura.libs.service.VideoProber;
import ch.bergturbenthal.cura.libs.util.ExternalProcessRunner;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

@Slf4j
@Service
public class FfprobeVideoProber implements VideoProber {
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private final MediaProperties properties;

    public FfprobeVideoProber(final MediaProperties properties) {
        this.properties = properties;
    }

    @Override
    public VideoProbe probe(final Path path) throws MediaException {
        final String[] command = { properties.getFfprobeCommand(), "-v", "error", "-select_streams", "v:0",
                "-show_entries", "stream=codec_type,codec_name,width,height,duration:format=duration", "-of", "json",
                path.toAbsolutePath().toString() };
        final ExternalProcessRunner.ExecuteResult result;
        try {
            result = ExternalProcessRunner.execute(command, properties.getProbeTimeout());
        } catch (IOException e) {
            throw new MediaException(ErrorKind.EXTERNAL_TOOL_UNAVAILABLE, "Cannot start " + command[0], e);
        } catch (TimeoutException e) {
            throw new MediaException(ErrorKind.DECODE_FAILURE, e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Probing of " + path + " interrupted");
        }
        if (result.getCode() != 0)
            throw new MediaException(ErrorKind.DECODE_FAILURE,
                    "ffprobe failed on " + path + ": " + result.getStdErr().trim());
        return parseProbeOutput(path, new String(result.getStdOut(), StandardCharsets.UTF_8));
    }

    static VideoProbe parseProbeOutput(final Path path, final String json) throws MediaException {
        final JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (IOException e) {
            throw new MediaException(ErrorKind.DECODE_FAILURE, "Unreadable probe output for " + path, e);
        }
        if (root == null || root.isMissingNode())
            throw new MediaException(ErrorKind.DECODE_FAILURE, "Empty probe output for " + path);
        JsonNode videoStream = null;
        for (JsonNode stream : root.path("streams")) {
            final String codecType = stream.path("codec_type").asText("video");
            if (codecType.equals("video")) {
                videoStream = stream;
                break;
            }
        }
        if (videoStream == null)
            throw new MediaException(ErrorKind.NO_VIDEO_STREAM, path + " contains no video stream");
        final int width = videoStream.path("width").asInt(0);
        final int height = videoStream.path("height").asInt(0);
        if (width <= 0 || height <= 0)
            throw new MediaException(ErrorKind.DECODE_FAILURE, "No frame size in " + path);
        Double duration = parseDuration(videoStream.path("duration"));
        if (duration == null)
            duration = parseDuration(root.path("format").path("duration"));
        if (duration == null)
            throw new MediaException(ErrorKind.DECODE_FAILURE, "No duration in " + path);
        final String codecName = videoStream.path("codec_name").asText("");
        return new VideoProbe(duration, codecName.isBlank() ? "unknown" : codecName, width, height);
    }

    private static Double parseDuration(final JsonNode node) {
        if (node.isMissingNode() || node.isNull())
            return null;
        if (node.isNumber())
            return node.asDouble();
        try {
            final double value = Double.parseDouble(node.asText());
            if (Double.isNaN(value) || value < 0)
                return null;
            return value;
        } catch (NumberFormatException e) {
            log.debug("Cannot parse duration {}", node.asText());
            return null;
        }
    }
}
