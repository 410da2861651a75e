package com.deepcheck.common.exception;

/**
 * The submitted artifact could not be parsed or sliced into frames. Always fatal for the
 * analysis; resubmitting the same bytes will fail again.
 */
public class DecodeException extends VerificationException {

    public DecodeException(String message) {
        super("decode_error", message);
    }

    public DecodeException(String message, Throwable cause) {
        super("decode_error", message, cause);
    }
}
