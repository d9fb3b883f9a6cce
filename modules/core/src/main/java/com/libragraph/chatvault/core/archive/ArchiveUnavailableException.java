package com.libragraph.chatvault.core.archive;

import com.libragraph.chatvault.core.ArchiveException;

/**
 * Thrown when a query needs the archive but its database or key file could not be found.
 */
public class ArchiveUnavailableException extends ArchiveException {

    public ArchiveUnavailableException(String message) {
        super(message);
    }
}
