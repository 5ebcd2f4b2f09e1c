package ch.bergturbenthal.cura.libs.exception;

import lombok.Getter;

import java.nio.file.Path;

/**
 * A scan that cannot start or cannot terminate. Raised instead of returning an empty result.
 */
public class ScanException extends RuntimeException {
    public enum Reason {
        INVALID_ROOT, NOT_FOUND, NOT_A_DIRECTORY, UNREADABLE_ROOT, SYMLINK_LOOP
    }

    @Getter
    private final Reason reason;
    @Getter
    private final Path path;

    public ScanException(final Reason reason, final Path path, final String message) {
        super(message);
        this.reason = reason;
        this.path = path;
    }

    public ScanException(final Reason reason, final Path path, final String message, final Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.path = path;
    }
}
