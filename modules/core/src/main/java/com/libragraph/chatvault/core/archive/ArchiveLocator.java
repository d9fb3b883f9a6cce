package com.libragraph.chatvault.core.archive;

import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds the encrypted database and key file inside an application container directory.
 *
 * <p>Layout: {@code {container}[/appstore]/account-*}{@code /postbox/db/db_sqlite}
 * and {@code {container}[/appstore]/.tempkeyEncrypted}. The {@code appstore}
 * variant is tried first; account directories are visited in name order.
 */
public final class ArchiveLocator {
    private static final Logger log = Logger.getLogger(ArchiveLocator.class);

    static final String STORE_VARIANT = "appstore";
    static final String ACCOUNT_GLOB = "account-*";
    static final Path DATABASE_PATH = Path.of("postbox", "db", "db_sqlite");
    static final String KEY_FILE = ".tempkeyEncrypted";

    private ArchiveLocator() {
    }

    public static Optional<ArchiveLocation> locate(Path containerDir) {
        if (containerDir == null || !Files.isDirectory(containerDir)) {
            log.debugf("Container directory not found: %s", containerDir);
            return Optional.empty();
        }
        Optional<Path> database = findDatabase(containerDir);
        Optional<Path> keyFile = findKeyFile(containerDir);
        if (database.isEmpty() || keyFile.isEmpty()) {
            log.debugf("Archive incomplete under %s (database=%s, key=%s)",
                    containerDir, database.orElse(null), keyFile.orElse(null));
            return Optional.empty();
        }
        return Optional.of(new ArchiveLocation(database.get(), keyFile.get()));
    }

    static Optional<Path> findDatabase(Path containerDir) {
        for (Path base : bases(containerDir)) {
            for (Path account : accounts(base)) {
                Path candidate = account.resolve(DATABASE_PATH);
                if (Files.isRegularFile(candidate)) {
                    return Optional.of(candidate);
                }
            }
        }
        return Optional.empty();
    }

    static Optional<Path> findKeyFile(Path containerDir) {
        for (Path base : bases(containerDir)) {
            Path candidate = base.resolve(KEY_FILE);
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private static List<Path> bases(Path containerDir) {
        return List.of(containerDir.resolve(STORE_VARIANT), containerDir);
    }

    private static List<Path> accounts(Path base) {
        List<Path> accounts = new ArrayList<>();
        if (!Files.isDirectory(base)) {
            return accounts;
        }
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(base, ACCOUNT_GLOB)) {
            for (Path entry : entries) {
                if (Files.isDirectory(entry)) {
                    accounts.add(entry);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list accounts in " + base, e);
        }
        accounts.sort(null);
        return accounts;
    }
}
