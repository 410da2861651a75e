package com.deepcheck.common.exception;

/**
 * An uploaded artifact could not be written to the upload directory. Nothing was persisted
 * for the request, so the client may retry once storage is healthy.
 */
public class StorageException extends VerificationException {

    public StorageException(String message, Throwable cause) {
        super("storage_error", message, cause);
    }
}
