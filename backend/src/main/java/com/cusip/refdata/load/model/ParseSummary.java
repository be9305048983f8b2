package com.cusip.refdata.load.model;

public record ParseSummary(
    long dataLines,
    long footerCount
) {
    public boolean isEmpty() {
        return dataLines == 0;
    }
}
