package com.example.homemic_backend.exception;

/**
 * Blob or row write failed. Transient: the caller is expected to retry the upload.
 */
public class StorageFailureException extends HomeMicException {

    public StorageFailureException(String message) {
        super(message);
    }

    public StorageFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
