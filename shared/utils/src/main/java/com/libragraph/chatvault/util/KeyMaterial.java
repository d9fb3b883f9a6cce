package com.libragraph.chatvault.util;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Database key and salt unwrapped from an encrypted key file.
 * Immutable value object; both arrays are copied in and out.
 *
 * The encrypted store is keyed with the raw 48 bytes {@code key || salt},
 * which is what {@link #toHex()} renders.
 */
public record KeyMaterial(byte[] key, byte[] salt) {
    public static final int KEY_LENGTH = 32;
    public static final int SALT_LENGTH = 16;
    private static final HexFormat HEX_FORMAT = HexFormat.of();

    public KeyMaterial {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(salt, "salt cannot be null");
        if (key.length != KEY_LENGTH) {
            throw new IllegalArgumentException(
                "Key must be 32 bytes, got: " + key.length
            );
        }
        if (salt.length != SALT_LENGTH) {
            throw new IllegalArgumentException(
                "Salt must be 16 bytes, got: " + salt.length
            );
        }
        key = Arrays.copyOf(key, key.length);
        salt = Arrays.copyOf(salt, salt.length);
    }

    @Override
    public byte[] key() {
        return Arrays.copyOf(key, key.length);
    }

    @Override
    public byte[] salt() {
        return Arrays.copyOf(salt, salt.length);
    }

    /**
     * Returns {@code key || salt} (48 bytes).
     */
    public byte[] concatenated() {
        byte[] out = Arrays.copyOf(key, KEY_LENGTH + SALT_LENGTH);
        System.arraycopy(salt, 0, out, KEY_LENGTH, SALT_LENGTH);
        return out;
    }

    /**
     * Returns lowercase hex of {@code key || salt} (96 characters).
     */
    public String toHex() {
        return HEX_FORMAT.formatHex(concatenated());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof KeyMaterial other)) return false;
        return Arrays.equals(key, other.key) && Arrays.equals(salt, other.salt);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(key) + Arrays.hashCode(salt);
    }

    /** Never prints the secret. */
    @Override
    public String toString() {
        return "KeyMaterial[redacted]";
    }
}
