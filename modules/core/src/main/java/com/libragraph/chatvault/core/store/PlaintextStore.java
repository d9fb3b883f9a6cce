package com.libragraph.chatvault.core.store;

import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A decrypted copy of the store in its own temporary directory.
 *
 * <p>{@link #close()} deletes the directory and everything in it and may be
 * called any number of times. The paths are also registered for deletion at
 * JVM exit in case {@code close()} never runs.
 */
public final class PlaintextStore implements AutoCloseable {
    private static final Logger log = Logger.getLogger(PlaintextStore.class);

    private final Path directory;
    private final Path file;
    private boolean closed;

    PlaintextStore(Path directory, Path file) {
        this.directory = directory;
        this.file = file;
        // deleteOnExit runs in reverse registration order: file first, then directory
        directory.toFile().deleteOnExit();
        file.toFile().deleteOnExit();
    }

    public Path file() {
        return file;
    }

    public Path directory() {
        return directory;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (!Files.exists(directory)) {
            return;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(directory)) {
            paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        } catch (IOException e) {
            log.warnf("Failed to list plaintext store %s: %s", directory, e.getMessage());
            return;
        }
        for (Path path : paths) {
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                log.warnf("Failed to delete %s: %s", path, e.getMessage());
            }
        }
        log.debugf("Deleted plaintext store %s", directory);
    }

    @Override
    public String toString() {
        return "PlaintextStore[" + file + (closed ? ", closed" : "") + "]";
    }
}
