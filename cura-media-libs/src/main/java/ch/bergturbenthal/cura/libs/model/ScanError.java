package ch.bergturbenthal.cura.libs.model;

import ch.bergturbenthal.cura.libs.exception.MediaException;
import lombok.Value;

import java.nio.file.Path;

@Value
public class ScanError {
    String path;
    String message;
    ErrorKind kind;

    public static ScanError of(final Path path, final ErrorKind kind, final String detail) {
        return new ScanError(path.toString(), kind.getLabel() + ": " + detail, kind);
    }

    public static ScanError of(final Path path, final MediaException exception) {
        return of(path, exception.getKind(), exception.getMessage());
    }
}
