package ch.bergturbenthal.cura.libs.service;

import ch.bergturbenthal.cura.libs.exception.MediaException;
import ch.bergturbenthal.cura.libs.model.DecodedImage;
import ch.bergturbenthal.cura.libs.model.SourceFormat;

import java.nio.file.Path;

public interface ImageDecoder {
    SourceFormat detectFormat(Path path) throws MediaException;

    DecodedImage decode(Path path, SourceFormat format) throws MediaException;

    default DecodedImage decode(Path path) throws MediaException {
        return decode(path, detectFormat(path));
    }
}
