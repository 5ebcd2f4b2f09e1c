package ch.bergturbenthal.cura.libs.exception;

import ch.bergturbenthal.cura.libs.model.ErrorKind;
import lombok.Getter;

/**
 * Failure while reading or converting a single media file.
 */
public class MediaException extends Exception {
    @Getter
    private final ErrorKind kind;

    public MediaException(final ErrorKind kind, final String message) {
        super(message);
        this.kind = kind;
    }

    public MediaException(final ErrorKind kind, final String message, final Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public String userMessage() {
        return kind.getUserMessage();
    }

    @Override
    public String toString() {
        return kind.getLabel() + ": " + getMessage();
    }
}
