package com.cusip.refdata.load.error;

public class StagingFailedException extends LoadFailureException {
    public StagingFailedException(String message, Throwable cause) {
        super(FailureKind.STAGING_FAILED, message, cause);
    }
}
