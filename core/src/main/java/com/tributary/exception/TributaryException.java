package com.tributary.exception;

import java.util.Objects;

/**
 * Base class for failures the server knows how to report to a client.
 */
public class TributaryException extends RuntimeException {

    private final ErrorOrigin origin;

    public TributaryException(String message) {
        this(message, null, ErrorOrigin.ENGINE);
    }

    public TributaryException(String message, Throwable cause) {
        this(message, cause, ErrorOrigin.ENGINE);
    }

    protected TributaryException(String message, Throwable cause, ErrorOrigin origin) {
        super(message, cause);
        this.origin = Objects.requireNonNull(origin, "origin must not be null");
    }

    /**
     * Returns where this failure was raised.
     *
     * @return the origin tag
     */
    public ErrorOrigin origin() {
        return origin;
    }
}
