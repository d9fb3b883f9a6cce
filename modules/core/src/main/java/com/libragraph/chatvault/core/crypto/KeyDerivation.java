package com.libragraph.chatvault.core.crypto;

import com.libragraph.chatvault.util.KeyMaterial;
import org.apache.commons.codec.digest.MurmurHash3;
import org.jboss.logging.Logger;

import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.Objects;

/**
 * Unwraps the database key from the encrypted key file.
 *
 * <p>SHA-512 of the passphrase gives the AES-256 key (first 32 bytes) and
 * CBC IV (last 16 bytes). The decrypted file starts with
 * {@code key[32] || salt[16] || hash[4]}, where {@code hash} is the
 * little-endian signed MurmurHash3 x86 32-bit hash of {@code key || salt}
 * with seed {@value #MURMUR_SEED}.
 */
public class KeyDerivation {
    private static final Logger log = Logger.getLogger(KeyDerivation.class);

    public static final String DEFAULT_PASSPHRASE = "no-matter-key";
    public static final int MURMUR_SEED = -137723950;

    static final int HASH_OFFSET = KeyMaterial.KEY_LENGTH + KeyMaterial.SALT_LENGTH;
    static final int MIN_PLAINTEXT_LENGTH = HASH_OFFSET + 4;
    private static final String TRANSFORMATION = "AES/CBC/NoPadding";

    private final String passphrase;

    public KeyDerivation() {
        this(DEFAULT_PASSPHRASE);
    }

    public KeyDerivation(String passphrase) {
        this.passphrase = Objects.requireNonNull(passphrase, "passphrase cannot be null");
    }

    public KeyMaterial deriveFromFile(Path keyFile) {
        byte[] wrapped;
        try {
            wrapped = Files.readAllBytes(keyFile);
        } catch (IOException e) {
            throw new IntegrityException("Failed to read key file " + keyFile + ".", e);
        }
        return derive(wrapped);
    }

    /**
     * Decrypts a wrapped key and verifies its integrity hash.
     *
     * @throws IntegrityException if the blob cannot be decrypted or the hash does not match
     */
    public KeyMaterial derive(byte[] wrapped) {
        byte[] plain;
        try {
            plain = cipher(Cipher.DECRYPT_MODE).doFinal(wrapped);
        } catch (GeneralSecurityException e) {
            throw new IntegrityException("Wrapped key of " + wrapped.length + " bytes could not be decrypted.", e);
        }
        if (plain.length < MIN_PLAINTEXT_LENGTH) {
            throw new IntegrityException("Wrapped key too short: " + plain.length + " bytes.");
        }

        byte[] keyAndSalt = Arrays.copyOf(plain, HASH_OFFSET);
        int storedHash = ByteBuffer.wrap(plain, HASH_OFFSET, 4).order(ByteOrder.LITTLE_ENDIAN).getInt();
        int computedHash = integrityHash(keyAndSalt);
        if (storedHash != computedHash) {
            throw new IntegrityException(String.format(
                    "Key integrity check failed (hash mismatch: %d != %d).", storedHash, computedHash));
        }

        log.debug("Unwrapped database key");
        return new KeyMaterial(
                Arrays.copyOfRange(keyAndSalt, 0, KeyMaterial.KEY_LENGTH),
                Arrays.copyOfRange(keyAndSalt, KeyMaterial.KEY_LENGTH, HASH_OFFSET));
    }

    public static int integrityHash(byte[] keyAndSalt) {
        return MurmurHash3.hash32x86(keyAndSalt, 0, keyAndSalt.length, MURMUR_SEED);
    }

    private Cipher cipher(int mode) throws GeneralSecurityException {
        byte[] digest = MessageDigest.getInstance("SHA-512")
                .digest(passphrase.getBytes(StandardCharsets.UTF_8));
        SecretKeySpec key = new SecretKeySpec(Arrays.copyOf(digest, 32), "AES");
        IvParameterSpec iv = new IvParameterSpec(Arrays.copyOfRange(digest, digest.length - 16, digest.length));
        Cipher cipher = Cipher.getInstance(TRANSFORMATION);
        cipher.init(mode, key, iv);
        return cipher;
    }
}
