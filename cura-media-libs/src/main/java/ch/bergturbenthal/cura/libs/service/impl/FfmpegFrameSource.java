package ch.bergturbenthal.cura.libs.service.impl;

import ch.bergturbenthal.cura.libs.exception.MediaException;
import ch.bergturbenthal.cura.libs.model.ErrorKind;
import ch.bergturbenthal.cura.libs.properties.MediaProperties;
import ch.bergturbenthal.cura.libs.service.FrameSource;
import ch.bergturbenthal.cura.libs.util.ExternalProcessRunner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Seeks before opening the input and pipes a single PNG frame to stdout.
 */
@Slf4j
@Service
public class FfmpegFrameSource implements FrameSource {
    private final MediaProperties properties;

    public FfmpegFrameSource(final MediaProperties properties) {
        this.properties = properties;
    }

    static String[] frameCommand(final String ffmpeg, final Path path, final double seekSeconds) {
        return new String[] { ffmpeg, "-v", "error", "-nostdin", "-ss", String.format(Locale.ROOT, "%.3f", seekSeconds),
                "-threads", "1", "-i", path.toAbsolutePath().toString(), "-frames:v", "1", "-f", "image2pipe",
                "-vcodec", "png", "pipe:1" };
    }

    @Override
    public byte[] extractFrame(final Path path, final double seekSeconds) throws MediaException {
        final String[] command = frameCommand(properties.getFfmpegCommand(), path, seekSeconds);
        final ExternalProcessRunner.ExecuteResult result;
        try {
            result = ExternalProcessRunner.execute(command, properties.getFrameTimeout());
        } catch (IOException e) {
            throw new MediaException(ErrorKind.EXTERNAL_TOOL_UNAVAILABLE, "Cannot start " + command[0], e);
        } catch (TimeoutException e) {
            throw new MediaException(ErrorKind.DECODE_FAILURE, e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Frame extraction of " + path + " interrupted");
        }
        if (result.getCode() != 0 || result.getStdOut().length == 0)
            throw classifyFailure(path, result.getStdErr());
        log.debug("Extracted frame of {} at {}s in {}", path, seekSeconds, result.getDuration());
        return result.getStdOut();
    }

    static MediaException classifyFailure(final Path path, final String stdErr) {
        final String message = stdErr == null ? "" : stdErr.trim();
        final String lowerMessage = message.toLowerCase(Locale.ROOT);
        if (lowerMessage.contains("does not contain any stream") || lowerMessage.contains("matches no streams"))
            return new MediaException(ErrorKind.NO_VIDEO_STREAM, path + " contains no video stream");
        if (lowerMessage.contains("no decoder found") || lowerMessage.contains("unsupported codec")
                || (lowerMessage.contains("decoder") && lowerMessage.contains("not found")))
            return new MediaException(ErrorKind.UNSUPPORTED_CODEC, message);
        return new MediaException(ErrorKind.DECODE_FAILURE,
                message.isEmpty() ? "No frame decoded from " + path : message);
    }
}
