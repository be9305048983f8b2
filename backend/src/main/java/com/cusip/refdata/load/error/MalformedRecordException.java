package com.cusip.refdata.load.error;

public class MalformedRecordException extends LoadFailureException {
    private final long lineNumber;

    public MalformedRecordException(long lineNumber, String message) {
        super(FailureKind.MALFORMED_RECORD, "line " + lineNumber + ": " + message);
        this.lineNumber = lineNumber;
    }

    public MalformedRecordException(long lineNumber, String message, Throwable cause) {
        super(FailureKind.MALFORMED_RECORD, "line " + lineNumber + ": " + message, cause);
        this.lineNumber = lineNumber;
    }

    public long lineNumber() {
        return lineNumber;
    }
}
