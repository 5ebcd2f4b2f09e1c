package ch.bergturbenthal.cura.libs.model;

import ch.bergturbenthal.cura.libs.exception.MediaException;
import lombok.Value;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;

@Value
public class FileFacts {
    long size;
    Instant modified;

    public static FileFacts read(final Path path) throws MediaException {
        final BasicFileAttributes attributes;
        try {
            attributes = Files.readAttributes(path, BasicFileAttributes.class);
        } catch (IOException e) {
            throw new MediaException(ErrorKind.UNREADABLE_FILE, "Cannot read attributes of " + path, e);
        }
        if (!attributes.isRegularFile())
            throw new MediaException(ErrorKind.UNREADABLE_FILE, path + " is not a regular file");
        if (!Files.isReadable(path))
            throw new MediaException(ErrorKind.UNREADABLE_FILE, path + " is not readable");
        return new FileFacts(attributes.size(), attributes.lastModifiedTime().toInstant());
    }
}
