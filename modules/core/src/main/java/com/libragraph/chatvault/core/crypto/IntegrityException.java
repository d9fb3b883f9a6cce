package com.libragraph.chatvault.core.crypto;

import com.libragraph.chatvault.core.ArchiveException;

/**
 * Thrown when the unwrapped key fails its integrity check, which in practice
 * means the source device protects the key with a local passcode.
 */
public class IntegrityException extends ArchiveException {

    static final String PASSCODE_HINT =
            "A local passcode is probably set on the source device; passcode-protected keys are not supported. "
                    + "Remove the passcode in the app settings and try again.";

    public IntegrityException(String message) {
        super(message + " " + PASSCODE_HINT);
    }

    public IntegrityException(String message, Throwable cause) {
        super(message + " " + PASSCODE_HINT, cause);
    }
}
