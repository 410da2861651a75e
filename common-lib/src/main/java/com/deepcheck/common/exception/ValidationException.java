package com.deepcheck.common.exception;

/**
 * Malformed input rejected before any record is created or any network call is issued.
 */
public class ValidationException extends VerificationException {

    public ValidationException(String message) {
        super("validation_error", message);
    }
}
