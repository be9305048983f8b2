package com.cusip.refdata.load.error;

/**
 * Base of every pipeline failure that ends a record type's load as FAILED.
 */
public abstract class LoadFailureException extends RuntimeException {
    private final FailureKind kind;

    protected LoadFailureException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected LoadFailureException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind kind() {
        return kind;
    }
}
