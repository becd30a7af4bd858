package com.catalog.crossmatch.error;

import java.util.Objects;

/**
 * Base runtime exception for every fatal cross-matching failure.
 */
public class CrossMatchException extends RuntimeException {

    private final ErrorKind kind;

    public CrossMatchException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind is required");
    }

    public CrossMatchException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind is required");
    }

    public ErrorKind getKind() {
        return kind;
    }
}
