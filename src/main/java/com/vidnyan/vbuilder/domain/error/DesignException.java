package com.vidnyan.vbuilder.domain.error;

/**
 * Base class for all failures raised by the design core.
 * Carries the error kind so callers can react without instanceof chains.
 */
public abstract class DesignException extends RuntimeException {

    private final ErrorKind kind;

    protected DesignException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected DesignException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
