package ch.bergturbenthal.cura.libs.exception;

public class InvalidFormatConfigException extends IllegalArgumentException {
    public InvalidFormatConfigException(final String message) {
        super(message);
    }
}
