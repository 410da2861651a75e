package com.deepcheck.common.exception;

/**
 * A classifier service was unreachable, timed out, refused the call (quota) or answered with
 * something that could not be parsed. Recoverable when the other classifier answers.
 */
public class ServiceException extends VerificationException {
    private final String source;

    public ServiceException(String source, String message) {
        super("service_error", "[" + source + "] " + message);
        this.source = source;
    }

    public ServiceException(String source, String message, Throwable cause) {
        super("service_error", "[" + source + "] " + message, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
