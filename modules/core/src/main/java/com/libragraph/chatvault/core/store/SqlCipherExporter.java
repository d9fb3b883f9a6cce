package com.libragraph.chatvault.core.store;

import com.libragraph.chatvault.util.KeyMaterial;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Exports an SQLCipher database with the {@code sqlcipher} command-line shell.
 *
 * <p>The store keeps its first 32 bytes unencrypted, so the plaintext header
 * size is set on both the source and the attached target before
 * {@code sqlcipher_export} runs.
 */
public class SqlCipherExporter implements StoreExporter {
    private static final Logger log = Logger.getLogger(SqlCipherExporter.class);

    public static final String DEFAULT_BINARY = "sqlcipher";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(5);
    static final int PLAINTEXT_HEADER_SIZE = 32;
    private static final int MAX_OUTPUT_CHARS = 64 * 1024;

    private final String binary;
    private final Duration timeout;

    public SqlCipherExporter() {
        this(DEFAULT_BINARY, DEFAULT_TIMEOUT);
    }

    public SqlCipherExporter(String binary, Duration timeout) {
        this.binary = Objects.requireNonNull(binary, "binary cannot be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout cannot be null");
    }

    @Override
    public void export(Path encrypted, KeyMaterial key, Path target) {
        List<String> command = List.of(binary, encrypted.toString());
        log.debugf("Exporting %s with %s", encrypted, binary);

        Path output = null;
        try {
            output = Files.createTempFile("sqlcipher-", ".log");
            Process process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(output.toFile())
                    .start();

            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(exportScript(key, target).getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                // the shell exited before reading its input; the exit code below reports why
                log.debugf("Could not write export script to %s: %s", binary, e.getMessage());
            }

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new DecryptionException("sqlcipher export timed out after " + timeout);
            }
            int code = process.exitValue();
            if (code != 0) {
                throw new DecryptionException("sqlcipher export failed (exit " + code + "): " + readOutput(output));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DecryptionException("sqlcipher export interrupted", e);
        } catch (IOException e) {
            throw new DecryptionException("Failed to run " + binary + ". Is SQLCipher installed?", e);
        } finally {
            if (output != null) {
                try {
                    Files.deleteIfExists(output);
                } catch (IOException e) {
                    log.warnf("Failed to delete export log %s: %s", output, e.getMessage());
                }
            }
        }
    }

    /**
     * SQL fed to the shell on stdin.
     */
    static String exportScript(KeyMaterial key, Path target) {
        String quotedTarget = target.toAbsolutePath().toString().replace("'", "''");
        return "PRAGMA key=\"x'" + key.toHex() + "'\";\n"
                + "PRAGMA cipher_plaintext_header_size=" + PLAINTEXT_HEADER_SIZE + ";\n"
                + "PRAGMA cipher_default_plaintext_header_size=" + PLAINTEXT_HEADER_SIZE + ";\n"
                + "ATTACH DATABASE '" + quotedTarget + "' AS plaintext KEY '';\n"
                + "SELECT sqlcipher_export('plaintext');\n"
                + "DETACH DATABASE plaintext;\n";
    }

    private static String readOutput(Path output) throws IOException {
        String text = Files.readString(output, StandardCharsets.UTF_8).trim();
        return text.length() > MAX_OUTPUT_CHARS ? text.substring(0, MAX_OUTPUT_CHARS) : text;
    }
}
