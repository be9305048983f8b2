package com.cusip.refdata.load.error;

public class LockTimeoutException extends LoadFailureException {
    public LockTimeoutException(String message) {
        super(FailureKind.LOCK_TIMEOUT, message);
    }
}
