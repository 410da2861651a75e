package com.deepcheck.verification.service;

import com.deepcheck.common.exception.ServiceException;

import java.util.Objects;

/**
 * Result of one guarded classifier call: either a value or the {@link ServiceException} that
 * replaced it. Lets {@code Mono.zip} always complete, whatever each source did.
 */
public record SourceOutcome<T>(String source, T value, ServiceException error) {

    public SourceOutcome {
        Objects.requireNonNull(source, "source");
        if ((value == null) == (error == null)) {
            throw new IllegalArgumentException("exactly one of value and error must be set");
        }
    }

    public static <T> SourceOutcome<T> success(String source, T value) {
        return new SourceOutcome<>(source, value, null);
    }

    public static <T> SourceOutcome<T> failure(String source, ServiceException error) {
        return new SourceOutcome<>(source, null, error);
    }

    public boolean isSuccess() {
        return value != null;
    }
}
