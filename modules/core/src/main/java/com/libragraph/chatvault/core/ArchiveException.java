package com.libragraph.chatvault.core;

/**
 * Base for failures that stop an archive from being opened.
 */
public class ArchiveException extends RuntimeException {

    public ArchiveException(String message, Throwable cause) {
        super(message, cause);
    }

    public ArchiveException(String message) {
        super(message);
    }
}
