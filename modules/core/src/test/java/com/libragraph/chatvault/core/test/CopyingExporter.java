package com.libragraph.chatvault.core.test;

import com.libragraph.chatvault.core.store.StoreExporter;
import com.libragraph.chatvault.util.KeyMaterial;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Exporter that "decrypts" by copying a prepared plaintext store, recording every call.
 */
public class CopyingExporter implements StoreExporter {

    private final Path plaintext;
    private final List<KeyMaterial> keys = new ArrayList<>();
    private final List<Path> targets = new ArrayList<>();

    public CopyingExporter(Path plaintext) {
        this.plaintext = plaintext;
    }

    @Override
    public void export(Path encrypted, KeyMaterial key, Path target) {
        keys.add(key);
        targets.add(target);
        try {
            Files.copy(plaintext, target);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public int calls() {
        return keys.size();
    }

    public List<KeyMaterial> keys() {
        return keys;
    }

    public List<Path> targets() {
        return targets;
    }
}
