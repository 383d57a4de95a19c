package com.github.challengeplatform.submissionengine.storage;

/**
 * Object storage or remote dataset could not be reached or read.
 *
 * @author timo.buechert
 */
public class StorageException extends RuntimeException {

    public StorageException(final String message) {
        super(message);
    }

    public StorageException(final String message, final Throwable cause) {
        super(message, cause);
    }

}
