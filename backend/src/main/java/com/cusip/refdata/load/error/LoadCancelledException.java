package com.cusip.refdata.load.error;

public class LoadCancelledException extends LoadFailureException {
    public LoadCancelledException(String message) {
        super(FailureKind.CANCELLED, message);
    }
}
