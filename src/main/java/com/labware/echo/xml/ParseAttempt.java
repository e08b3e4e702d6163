package com.labware.echo.xml;

import java.util.function.Supplier;

import com.labware.echo.exception.EchoXmlException;

/**
 * Outcome of trying one document layout: either the parsed value or the
 * failure that rejected it.
 *
 * @param <T> parsed type
 */
public final class ParseAttempt<T> {

    private final T value;
    private final EchoXmlException failure;

    private ParseAttempt(T value, EchoXmlException failure) {
        this.value = value;
        this.failure = failure;
    }

    public static <T> ParseAttempt<T> success(T value) {
        return new ParseAttempt<>(value, null);
    }

    public static <T> ParseAttempt<T> failure(EchoXmlException failure) {
        return new ParseAttempt<>(null, failure);
    }

    /**
     * Runs {@code parse}, capturing any {@link EchoXmlException} as a failed attempt.
     */
    public static <T> ParseAttempt<T> of(Supplier<T> parse) {
        try {
            return success(parse.get());
        } catch (EchoXmlException e) {
            return failure(e);
        }
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public T getValue() {
        if (failure != null) {
            throw new IllegalStateException("Attempt failed", failure);
        }
        return value;
    }

    public EchoXmlException getFailure() {
        return failure;
    }
}
