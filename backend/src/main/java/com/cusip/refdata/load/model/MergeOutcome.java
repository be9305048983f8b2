package com.cusip.refdata.load.model;

public record MergeOutcome(
    long rowsStaged,
    long rowsUpserted,
    long rowsSuperseded
) {
}
