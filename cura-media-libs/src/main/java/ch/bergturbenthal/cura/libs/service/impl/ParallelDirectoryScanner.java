package ch.bergturbenthal.cura.libs.service.impl;

import ch.bergturbenthal.cura.libs.exception.ScanException;
import ch.bergturbenthal.cura.libs.model.ErrorKind;
import ch.bergturbenthal.cura.libs.model.FormatConfig;
import ch.bergturbenthal.cura.libs.model.MediaFile;
import ch.bergturbenthal.cura.libs.model.MediaType;
import ch.bergturbenthal.cura.libs.model.ScanError;
import ch.bergturbenthal.cura.libs.model.ScanOutcome;
import ch.bergturbenthal.cura.libs.model.ScanProgress;
import ch.bergturbenthal.cura.libs.properties.MediaProperties;
import ch.bergturbenthal.cura.libs.service.AsyncService;
import ch.bergturbenthal.cura.libs.service.CancellationSignal;
import ch.bergturbenthal.cura.libs.service.DirectoryScanner;
import ch.bergturbenthal.cura.libs.service.FormatClassifier;
import ch.bergturbenthal.cura.libs.service.ScanProgressListener;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lists every directory as its own task on the worker pool, so sibling directories are read in parallel.
 */
@Slf4j
@Service
public class ParallelDirectoryScanner implements DirectoryScanner {
    private final AsyncService asyncService;
    private final FormatClassifier formatClassifier;
    private final MediaProperties properties;

    public ParallelDirectoryScanner(final AsyncService asyncService, final FormatClassifier formatClassifier,
            final MediaProperties properties) {
        this.asyncService = asyncService;
        this.formatClassifier = formatClassifier;
        this.properties = properties;
    }

    @Override
    @NotNull
    public Mono<ScanOutcome> scan(final Path root, final FormatConfig config, final ScanProgressListener listener,
            final CancellationSignal cancellation) {
        return Mono.defer(() -> {
            config.validate();
            final Path realRoot = validateRoot(root);
            final long startTime = System.nanoTime();
            final ScanState state = new ScanState(config, listener, Math.max(1, properties.getProgressInterval()));
            return walk(new DirectoryTask(root, realRoot, null), state, cancellation)
                    .takeUntilOther(cancellation.whenCancelled())
                    .then(Mono.fromCallable(() -> {
                        if (cancellation.isCancelled())
                            throw new CancellationException("Scan of " + root + " cancelled");
                        final ScanOutcome outcome = state.finish();
                        log.info("Scanned {} in {}: {} images, {} videos, {} errors", root,
                                Duration.ofNanos(System.nanoTime() - startTime), outcome.getImageCount(),
                                outcome.getVideoCount(), outcome.getErrors().size());
                        return outcome;
                    }));
        });
    }

    private Flux<DirectoryTask> walk(final DirectoryTask task, final ScanState state,
            final CancellationSignal cancellation) {
        if (cancellation.isCancelled())
            return Flux.empty();
        return asyncService.asyncMono(() -> listDirectory(task, state))
                .flatMapMany(Flux::fromIterable)
                .flatMap(subDirectory -> walk(subDirectory, state, cancellation));
    }

    private Path validateRoot(final Path root) {
        if (root == null || root.toString().isBlank())
            throw new ScanException(ScanException.Reason.INVALID_ROOT, root, "Root path is empty");
        final Path realRoot;
        try {
            realRoot = root.toRealPath();
        } catch (NoSuchFileException e) {
            throw new ScanException(ScanException.Reason.NOT_FOUND, root, "Path does not exist: " + root, e);
        } catch (AccessDeniedException e) {
            throw new ScanException(ScanException.Reason.UNREADABLE_ROOT, root, "Cannot access " + root, e);
        } catch (FileSystemException e) {
            if (Files.isSymbolicLink(root))
                throw new ScanException(ScanException.Reason.SYMLINK_LOOP, root,
                        "Cannot resolve symbolic link " + root + ": " + e.getReason(), e);
            throw new ScanException(ScanException.Reason.UNREADABLE_ROOT, root, "Cannot access " + root, e);
        } catch (IOException e) {
            throw new ScanException(ScanException.Reason.UNREADABLE_ROOT, root, "Cannot access " + root, e);
        }
        if (!Files.isDirectory(realRoot))
            throw new ScanException(ScanException.Reason.NOT_A_DIRECTORY, root, "Path is not a directory: " + root);
        if (!Files.isReadable(realRoot))
            throw new ScanException(ScanException.Reason.UNREADABLE_ROOT, root, "Directory is not readable: " + root);
        return realRoot;
    }

    private List<DirectoryTask> listDirectory(final DirectoryTask task, final ScanState state) {
        final List<DirectoryTask> subDirectories = new ArrayList<>();
        final Path directory = task.getDirectory();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory)) {
            for (Path entry : entries) {
                if (Thread.currentThread().isInterrupted()) {
                    log.debug("Listing of {} interrupted", directory);
                    break;
                }
                visit(entry, task, state, subDirectories);
            }
        } catch (AccessDeniedException e) {
            state.error(ScanError.of(directory, ErrorKind.UNREADABLE_FILE, "Permission denied"));
        } catch (IOException e) {
            state.error(ScanError.of(directory, ErrorKind.UNREADABLE_FILE, String.valueOf(e.getMessage())));
        } catch (DirectoryIteratorException e) {
            state.error(ScanError.of(directory, ErrorKind.UNREADABLE_FILE, String.valueOf(e.getCause().getMessage())));
        }
        return subDirectories;
    }

    private void visit(final Path entry, final DirectoryTask parent, final ScanState state,
            final List<DirectoryTask> subDirectories) {
        final BasicFileAttributes attributes;
        try {
            attributes = Files.readAttributes(entry, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        } catch (IOException e) {
            state.error(ScanError.of(entry, ErrorKind.UNREADABLE_FILE, String.valueOf(e.getMessage())));
            return;
        }
        if (attributes.isSymbolicLink()) {
            visitLink(entry, parent, state, subDirectories);
        } else if (attributes.isDirectory()) {
            subDirectories.add(new DirectoryTask(entry, parent.getRealPath().resolve(entry.getFileName()), parent));
        } else if (attributes.isRegularFile()) {
            visitFile(entry, state);
        }
    }

    private void visitLink(final Path entry, final DirectoryTask parent, final ScanState state,
            final List<DirectoryTask> subDirectories) {
        final Path target;
        try {
            target = entry.toRealPath();
        } catch (IOException e) {
            state.error(ScanError.of(entry, ErrorKind.UNREADABLE_FILE, "Broken symbolic link"));
            return;
        }
        if (Files.isDirectory(target)) {
            if (!properties.isFollowSymlinks()) {
                log.debug("Not following linked directory {}", entry);
                return;
            }
            if (parent.hasAncestor(target))
                throw new ScanException(ScanException.Reason.SYMLINK_LOOP, entry,
                        "Symbolic link " + entry + " points to its own ancestor " + target);
            subDirectories.add(new DirectoryTask(entry, target, parent));
        } else if (Files.isRegularFile(target)) {
            visitFile(entry, state);
        }
    }

    private void visitFile(final Path file, final ScanState state) {
        final Optional<MediaType> mediaType = formatClassifier.classify(file, state.getConfig());
        if (mediaType.isEmpty())
            return;
        if (!Files.isReadable(file)) {
            state.error(ScanError.of(file, ErrorKind.UNREADABLE_FILE, "Permission denied"));
            return;
        }
        state.add(new MediaFile(file, mediaType.get()));
    }

    @Value
    private static class DirectoryTask {
        Path directory;
        Path realPath;
        DirectoryTask parent;

        boolean hasAncestor(final Path candidate) {
            for (DirectoryTask t = this; t != null; t = t.getParent()) {
                if (t.getRealPath().equals(candidate))
                    return true;
            }
            return false;
        }
    }

    private static class ScanState {
        private final FormatConfig config;
        private final ScanProgressListener listener;
        private final int progressInterval;
        private final ConcurrentLinkedQueue<MediaFile> files = new ConcurrentLinkedQueue<>();
        private final ConcurrentLinkedQueue<ScanError> errors = new ConcurrentLinkedQueue<>();
        private final AtomicInteger discovered = new AtomicInteger();
        private final AtomicInteger imageCount = new AtomicInteger();
        private final AtomicInteger videoCount = new AtomicInteger();

        private ScanState(final FormatConfig config, final ScanProgressListener listener,
                final int progressInterval) {
            this.config = config;
            this.listener = listener;
            this.progressInterval = progressInterval;
        }

        FormatConfig getConfig() {
            return config;
        }

        void add(final MediaFile file) {
            files.add(file);
            if (file.getMediaType() == MediaType.IMAGE)
                imageCount.incrementAndGet();
            else
                videoCount.incrementAndGet();
            final int count = discovered.incrementAndGet();
            if (count % progressInterval == 0)
                notifyListener(new ScanProgress(count, file.getPath().toString(), false));
        }

        void error(final ScanError error) {
            log.warn("Scan error at {}: {}", error.getPath(), error.getMessage());
            errors.add(error);
        }

        ScanOutcome finish() {
            notifyListener(new ScanProgress(discovered.get(), null, true));
            return new ScanOutcome(List.copyOf(files), imageCount.get(), videoCount.get(), List.copyOf(errors));
        }

        private void notifyListener(final ScanProgress progress) {
            try {
                listener.onProgress(progress);
            } catch (RuntimeException e) {
                log.warn("Progress listener failed", e);
            }
        }
    }
}
