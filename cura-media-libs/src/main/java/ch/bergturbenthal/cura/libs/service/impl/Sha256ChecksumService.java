package ch.bergturbenthal.cura.libs.service.impl;

import ch.bergturbenthal.cura.libs.exception.MediaException;
import ch.bergturbenthal.cura.libs.model.ErrorKind;
import ch.bergturbenthal.cura.libs.service.ChecksumService;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

@Service
public class Sha256ChecksumService implements ChecksumService {

    @Override
    public String checksum(final Path path) throws MediaException {
        final MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        try (InputStream inputStream = Files.newInputStream(path)) {
            final byte[] buffer = new byte[64 * 1024];
            while (true) {
                final int read = inputStream.read(buffer);
                if (read < 0)
                    break;
                digest.update(buffer, 0, read);
            }
        } catch (IOException e) {
            throw new MediaException(ErrorKind.UNREADABLE_FILE, "Cannot read " + path, e);
        }
        return HexFormat.of().formatHex(digest.digest());
    }
}
