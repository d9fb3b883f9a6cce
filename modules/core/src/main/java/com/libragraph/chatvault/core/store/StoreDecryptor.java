package com.libragraph.chatvault.core.store;

import com.libragraph.chatvault.util.KeyMaterial;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Produces a plaintext copy of an encrypted store at a fresh, process-unique temporary path.
 */
public class StoreDecryptor {
    private static final Logger log = Logger.getLogger(StoreDecryptor.class);

    static final String DIRECTORY_PREFIX = "chatvault-";
    static final String PLAINTEXT_NAME = "plaintext.db";

    private final StoreExporter exporter;
    private final Path tempRoot;

    public StoreDecryptor(StoreExporter exporter) {
        this(exporter, null);
    }

    /**
     * @param tempRoot parent of the per-export temporary directories, or {@code null} for the system default
     */
    public StoreDecryptor(StoreExporter exporter, Path tempRoot) {
        this.exporter = Objects.requireNonNull(exporter, "exporter cannot be null");
        this.tempRoot = tempRoot;
    }

    /**
     * Exports {@code encrypted} and returns the plaintext copy. The caller owns the result and must close it.
     *
     * @throws DecryptionException if the export fails or leaves no data
     */
    public PlaintextStore decrypt(Path encrypted, KeyMaterial key) {
        Path directory;
        try {
            directory = tempRoot == null
                    ? Files.createTempDirectory(DIRECTORY_PREFIX)
                    : Files.createTempDirectory(tempRoot, DIRECTORY_PREFIX);
        } catch (IOException e) {
            throw new DecryptionException("Failed to create temporary directory", e);
        }

        PlaintextStore store = new PlaintextStore(directory, directory.resolve(PLAINTEXT_NAME));
        try {
            long started = System.nanoTime();
            exporter.export(encrypted, key, store.file());
            if (!Files.isRegularFile(store.file()) || Files.size(store.file()) == 0) {
                throw new DecryptionException("Export produced empty output. Decryption may have failed.");
            }
            log.infof("Decrypted %s to %s (%d bytes) in %d ms", encrypted, store.file(),
                    Files.size(store.file()), (System.nanoTime() - started) / 1_000_000);
            return store;
        } catch (IOException e) {
            store.close();
            throw new DecryptionException("Failed to inspect plaintext copy " + store.file(), e);
        } catch (RuntimeException e) {
            store.close();
            throw e;
        }
    }
}
