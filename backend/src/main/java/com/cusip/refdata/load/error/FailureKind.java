package com.cusip.refdata.load.error;

public enum FailureKind {
    SOURCE_UNAVAILABLE,
    SOURCE_AMBIGUOUS,
    FOOTER_MISMATCH,
    MALFORMED_RECORD,
    STAGING_FAILED,
    TYPE_COERCION,
    REFERENTIAL_VIOLATION,
    MERGE_FAILED,
    LOCK_TIMEOUT,
    CANCELLED,
    UNEXPECTED
}
