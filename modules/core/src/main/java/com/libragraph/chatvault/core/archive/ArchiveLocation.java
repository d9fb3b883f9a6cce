package com.libragraph.chatvault.core.archive;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Paths of an encrypted archive: the encrypted database and its wrapped key file.
 */
public record ArchiveLocation(Path database, Path keyFile) {

    public ArchiveLocation {
        Objects.requireNonNull(database, "database cannot be null");
        Objects.requireNonNull(keyFile, "keyFile cannot be null");
    }
}
