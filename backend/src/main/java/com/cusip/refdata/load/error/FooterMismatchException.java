package com.cusip.refdata.load.error;

public class FooterMismatchException extends LoadFailureException {
    public FooterMismatchException(String message) {
        super(FailureKind.FOOTER_MISMATCH, message);
    }
}
