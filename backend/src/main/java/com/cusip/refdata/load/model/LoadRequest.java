package com.cusip.refdata.load.model;

import java.time.LocalDate;

public record LoadRequest(
    LocalDate date
) {
    public LocalDate dateOrToday() {
        return date == null ? LocalDate.now() : date;
    }
}
