package com.libragraph.chatvault.core.store;

import com.libragraph.chatvault.core.ArchiveException;

/**
 * Thrown when the encrypted store cannot be exported to plaintext.
 */
public class DecryptionException extends ArchiveException {

    public DecryptionException(String message, Throwable cause) {
        super(message, cause);
    }

    public DecryptionException(String message) {
        super(message);
    }
}
