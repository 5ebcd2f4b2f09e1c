package ch.bergturbenthal.cura.libs.service.impl;

import ch.bergturbenthal.cura.libs.exception.MediaException;
import ch.bergturbenthal.cura.libs.model.DecodedImage;
import ch.bergturbenthal.cura.libs.model.ErrorKind;
import ch.bergturbenthal.cura.libs.model.SourceFormat;
import ch.bergturbenthal.cura.libs.properties.MediaProperties;
import ch.bergturbenthal.cura.libs.service.ExternalToolProbe;
import ch.bergturbenthal.cura.libs.service.ImageDecoder;
import ch.bergturbenthal.cura.libs.util.ExternalProcessRunner;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.apache.tika.Tika;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

@Slf4j
@Service
public class DefaultImageDecoder implements ImageDecoder {
    private static final Object dcrawLock = new Object();
    private final MediaProperties properties;
    private final ExternalToolProbe externalToolProbe;
    private final Tika tika = new Tika();

    public DefaultImageDecoder(final MediaProperties properties, final ExternalToolProbe externalToolProbe) {
        this.properties = properties;
        this.externalToolProbe = externalToolProbe;
    }

    @Override
    public SourceFormat detectFormat(final Path path) throws MediaException {
        final Optional<SourceFormat> byEnding = SourceFormat
                .fromExtension(FilenameUtils.getExtension(path.getFileName().toString()));
        if (byEnding.isPresent())
            return byEnding.get();
        final String mimeType;
        try {
            mimeType = tika.detect(path);
        } catch (IOException e) {
            throw new MediaException(ErrorKind.UNREADABLE_FILE, "Cannot read " + path, e);
        }
        return SourceFormat.fromMimeType(mimeType)
                .orElseThrow(() -> new MediaException(ErrorKind.UNSUPPORTED_FORMAT,
                        "Unsupported content type " + mimeType + " of " + path));
    }

    @Override
    public DecodedImage decode(final Path path, final SourceFormat format) throws MediaException {
        if (!Files.isReadable(path))
            throw new MediaException(ErrorKind.UNREADABLE_FILE, path + " is not readable");
        switch (format) {
        case JPEG:
        case PNG:
        case RASTER:
            return new DecodedImage(readImageIO(path), false);
        case RAW:
            return new DecodedImage(decodeRaw(path), true);
        case HEIC:
            // the converter applies the stored rotation on its own
            return new DecodedImage(decodeHeic(path), true);
        case VIDEO:
        default:
            throw new MediaException(ErrorKind.UNSUPPORTED_FORMAT, "Cannot decode " + format + " as image: " + path);
        }
    }

    private static BufferedImage readImageIO(final Path path) throws MediaException {
        final BufferedImage image;
        try {
            image = ImageIO.read(path.toFile());
        } catch (IOException | RuntimeException e) {
            throw new MediaException(ErrorKind.DECODE_FAILURE, "Cannot decode " + path + ": " + e.getMessage(), e);
        }
        if (image == null)
            throw new MediaException(ErrorKind.DECODE_FAILURE, "No decoder found for " + path);
        return image;
    }

    private BufferedImage decodeRaw(final Path path) throws MediaException {
        if (!externalToolProbe.hasDcraw())
            throw new MediaException(ErrorKind.EXTERNAL_TOOL_UNAVAILABLE, "dcraw is needed to decode " + path);
        synchronized (dcrawLock) {
            return decodeWithTool(path,
                    new String[] { properties.getDcrawCommand(), "-c", "-w", path.toAbsolutePath().toString() });
        }
    }

    private BufferedImage decodeHeic(final Path path) throws MediaException {
        if (!externalToolProbe.hasHeicConverter())
            throw new MediaException(ErrorKind.EXTERNAL_TOOL_UNAVAILABLE,
                    properties.getHeicCommand() + " is needed to decode " + path);
        return decodeWithTool(path,
                new String[] { properties.getHeicCommand(), path.toAbsolutePath() + "[0]", "png:-" });
    }

    private BufferedImage decodeWithTool(final Path path, final String[] command) throws MediaException {
        final ExternalProcessRunner.ExecuteResult result;
        try {
            result = ExternalProcessRunner.execute(command, properties.getDecodeTimeout());
        } catch (IOException e) {
            throw new MediaException(ErrorKind.EXTERNAL_TOOL_UNAVAILABLE, "Cannot start " + command[0], e);
        } catch (TimeoutException e) {
            throw new MediaException(ErrorKind.DECODE_FAILURE, e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Decoding of " + path + " interrupted");
        }
        if (result.getCode() != 0 || result.getStdOut().length == 0)
            throw new MediaException(ErrorKind.DECODE_FAILURE,
                    command[0] + " failed on " + path + ": " + result.getStdErr().trim());
        final BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(result.getStdOut()));
        } catch (IOException e) {
            throw new MediaException(ErrorKind.DECODE_FAILURE, "Cannot read output of " + command[0], e);
        }
        if (image == null)
            throw new MediaException(ErrorKind.DECODE_FAILURE, "Unknown output format of " + command[0]);
        log.debug("Decoded {} with {}: {}x{}", path, command[0], image.getWidth(), image.getHeight());
        return image;
    }
}
