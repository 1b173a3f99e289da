package com.telereplay.core.archive;

import java.io.IOException;

/**
 * Failure while querying the archive. Treated as transient: the query may
 * succeed when retried.
 */
public class ArchiveException extends IOException {

    public ArchiveException(String message) {
        super(message);
    }

    public ArchiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
