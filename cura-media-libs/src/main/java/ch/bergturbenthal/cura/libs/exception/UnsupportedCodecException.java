package ch.bergturbenthal.cura.libs.exception;

import ch.bergturbenthal.cura.libs.model.ErrorKind;
import lombok.Getter;

public class UnsupportedCodecException extends MediaException {
    @Getter
    private final String codecName;

    public UnsupportedCodecException(final String codecName, final String detail) {
        super(ErrorKind.UNSUPPORTED_CODEC, "Codec " + codecName + " cannot be decoded: " + detail);
        this.codecName = codecName;
    }
}
