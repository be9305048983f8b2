package com.cusip.refdata.load.error;

public class MergeFailedException extends LoadFailureException {
    public MergeFailedException(String message, Throwable cause) {
        super(FailureKind.MERGE_FAILED, message, cause);
    }
}
