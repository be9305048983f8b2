package com.cusip.refdata.load.error;

public class SourceUnavailableException extends LoadFailureException {
    public SourceUnavailableException(String message) {
        super(FailureKind.SOURCE_UNAVAILABLE, message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(FailureKind.SOURCE_UNAVAILABLE, message, cause);
    }
}
