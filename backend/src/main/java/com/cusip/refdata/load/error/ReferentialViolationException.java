package com.cusip.refdata.load.error;

import java.util.List;

public class ReferentialViolationException extends LoadFailureException {
    private final List<String> offendingKeys;

    public ReferentialViolationException(String message, List<String> offendingKeys) {
        super(FailureKind.REFERENTIAL_VIOLATION, message);
        this.offendingKeys = List.copyOf(offendingKeys);
    }

    public ReferentialViolationException(String message, Throwable cause) {
        super(FailureKind.REFERENTIAL_VIOLATION, message, cause);
        this.offendingKeys = List.of();
    }

    public List<String> offendingKeys() {
        return offendingKeys;
    }
}
