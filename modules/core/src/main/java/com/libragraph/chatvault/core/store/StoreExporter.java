package com.libragraph.chatvault.core.store;

import com.libragraph.chatvault.util.KeyMaterial;

import java.nio.file.Path;

/**
 * Writes a plaintext copy of an encrypted store.
 * Implementations must leave {@code target} absent or empty on failure, or throw.
 */
public interface StoreExporter {

    /**
     * @param encrypted encrypted database file
     * @param key       raw key material for the encrypted database
     * @param target    path of the plaintext copy to create; does not exist yet
     * @throws DecryptionException if the export fails
     */
    void export(Path encrypted, KeyMaterial key, Path target);
}
