package com.deepcheck.common.exception;

/**
 * Base of the verification error taxonomy. Every subtype carries a stable, machine-readable
 * {@code code} that callers can switch on without parsing messages.
 */
public class VerificationException extends RuntimeException {
    private final String code;

    public VerificationException(String code, String message) {
        super(message);
        this.code = code;
    }

    public VerificationException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
