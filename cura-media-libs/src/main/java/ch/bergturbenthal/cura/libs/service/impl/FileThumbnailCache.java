package ch.bergturbenthal.cura.libs.service.impl;

import ch.bergturbenthal.cura.libs.exception.MediaException;
import ch.bergturbenthal.cura.libs.model.CacheKey;
import ch.bergturbenthal.cura.libs.model.ErrorKind;
import ch.bergturbenthal.cura.libs.model.SizeClass;
import ch.bergturbenthal.cura.libs.model.ThumbnailPaths;
import ch.bergturbenthal.cura.libs.properties.MediaProperties;
import ch.bergturbenthal.cura.libs.service.ThumbnailCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;

/**
 * Thumbnails live flat in the cache directory. A cached entry is considered current as long as it is not older than
 * the modification time of its source; the content itself is not compared.
 */
@Slf4j
@Service
public class FileThumbnailCache implements ThumbnailCache {
    private final Path cacheRoot;
    private final ConcurrentMap<String, CompletableFuture<ThumbnailPaths>> pendingGenerations =
            new ConcurrentHashMap<>();

    @Autowired
    public FileThumbnailCache(final MediaProperties properties) {
        this(properties.getCacheDir().toPath());
    }

    public FileThumbnailCache(final Path cacheRoot) {
        this.cacheRoot = cacheRoot;
    }

    @Override
    public ThumbnailPaths pathsFor(final String checksum) {
        return new ThumbnailPaths(entryPath(new CacheKey(checksum, SizeClass.SMALL)),
                entryPath(new CacheKey(checksum, SizeClass.MEDIUM)));
    }

    private Path entryPath(final CacheKey key) {
        return cacheRoot.resolve(key.fileName());
    }

    @Override
    public Optional<ThumbnailPaths> resolve(final Path source, final String checksum, final Instant sourceMtime) {
        final ThumbnailPaths paths = pathsFor(checksum);
        for (SizeClass sizeClass : SizeClass.values()) {
            final Path entry = paths.get(sizeClass);
            try {
                final Instant cachedMtime = Files.getLastModifiedTime(entry).toInstant();
                if (sourceMtime.isAfter(cachedMtime)) {
                    log.debug("{} is newer than {}", source, entry);
                    return Optional.empty();
                }
            } catch (NoSuchFileException e) {
                return Optional.empty();
            } catch (IOException e) {
                log.warn("Cannot read cache entry {}, regenerating", entry, e);
                return Optional.empty();
            }
        }
        return Optional.of(paths);
    }

    @Override
    public Path store(final String checksum, final SizeClass sizeClass, final byte[] jpegData) throws MediaException {
        final Path targetFile = entryPath(new CacheKey(checksum, sizeClass));
        final Path tempFile = cacheRoot.resolve(UUID.randomUUID() + ".tmp");
        try {
            Files.createDirectories(cacheRoot);
            Files.write(tempFile, jpegData);
            try {
                Files.move(tempFile, targetFile, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tempFile, targetFile, StandardCopyOption.REPLACE_EXISTING);
            }
            return targetFile;
        } catch (IOException e) {
            throw new MediaException(ErrorKind.CACHE_WRITE_FAILURE, "Cannot write " + targetFile, e);
        } finally {
            try {
                Files.deleteIfExists(tempFile);
            } catch (IOException e) {
                log.warn("Cannot delete temp file {}", tempFile, e);
            }
        }
    }

    @Override
    public ThumbnailPaths getOrGenerate(final Path source, final String checksum, final Instant sourceMtime,
            final ThumbnailGenerator generator) throws MediaException {
        final Optional<ThumbnailPaths> existing = resolve(source, checksum, sourceMtime);
        if (existing.isPresent())
            return existing.get();
        final CompletableFuture<ThumbnailPaths> generation = new CompletableFuture<>();
        final CompletableFuture<ThumbnailPaths> running = pendingGenerations.putIfAbsent(checksum, generation);
        if (running != null) {
            log.debug("Waiting for running generation of {}", checksum);
            return await(running);
        }
        try {
            // a concurrent writer may have finished between resolve and registration
            final Optional<ThumbnailPaths> written = resolve(source, checksum, sourceMtime);
            final ThumbnailPaths paths = written.isPresent() ? written.get() : generator.generate();
            generation.complete(paths);
            return paths;
        } catch (Throwable t) {
            generation.completeExceptionally(t);
            throw t;
        } finally {
            pendingGenerations.remove(checksum, generation);
        }
    }

    private static ThumbnailPaths await(final CompletableFuture<ThumbnailPaths> running) throws MediaException {
        try {
            return running.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for thumbnails");
        } catch (ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof MediaException)
                throw (MediaException) cause;
            if (cause instanceof RuntimeException)
                throw (RuntimeException) cause;
            if (cause instanceof Error)
                throw (Error) cause;
            throw new IllegalStateException(cause);
        }
    }
}
