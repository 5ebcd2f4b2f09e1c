package ch.bergturbenthal.cura.libs.service;

import ch.bergturbenthal.cura.libs.exception.MediaException;

import java.nio.file.Path;

public interface ChecksumService {
    /**
     * @return lower case hex encoded content hash
     */
    String checksum(Path path) throws MediaException;
}
