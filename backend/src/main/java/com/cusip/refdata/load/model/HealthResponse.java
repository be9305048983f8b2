package com.cusip.refdata.load.model;

public record HealthResponse(
    String status,
    String database,
    String version
) {
}
