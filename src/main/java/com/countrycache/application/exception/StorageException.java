package com.countrycache.application.exception;

/**
 * Storage could not complete a read or commit a write.
 * For writes, the transaction has already been rolled back when this is raised.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
