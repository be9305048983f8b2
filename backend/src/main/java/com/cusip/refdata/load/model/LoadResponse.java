package com.cusip.refdata.load.model;

import java.time.LocalDate;
import java.util.List;

public record LoadResponse(
    boolean success,
    String message,
    LocalDate date,
    List<LoadResult> results
) {
    public static LoadResponse forRecordType(RecordType recordType, LocalDate date, LoadResult result) {
        String label = recordType.apiName();
        String message = switch (result.status()) {
            case SUCCEEDED -> label + " load completed";
            case SKIPPED -> label + " load skipped: no file for " + date;
            default -> label + " load failed";
        };
        return new LoadResponse(result.status() == LoadStatus.SUCCEEDED, message, date, List.of(result));
    }

    public static LoadResponse forRun(LocalDate date, List<LoadResult> results) {
        boolean failed = results.stream().anyMatch(LoadResult::isFailed);
        boolean skipped = results.stream().anyMatch(result -> result.status() == LoadStatus.SKIPPED);
        String message;
        if (failed) {
            message = "Load failed - check results for details";
        } else if (skipped) {
            message = "Load completed with warnings";
        } else {
            message = "All files loaded successfully";
        }
        return new LoadResponse(!failed, message, date, List.copyOf(results));
    }
}
