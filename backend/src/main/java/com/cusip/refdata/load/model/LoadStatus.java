package com.cusip.refdata.load.model;

public enum LoadStatus {
    SUCCEEDED,
    SKIPPED,
    FAILED,
    NOT_ATTEMPTED
}
