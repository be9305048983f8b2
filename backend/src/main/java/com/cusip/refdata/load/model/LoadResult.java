package com.cusip.refdata.load.model;

import com.cusip.refdata.load.error.FailureKind;

import java.time.Instant;
import java.time.LocalDate;

public record LoadResult(
    RecordType recordType,
    LocalDate date,
    String file,
    long rowsRead,
    long rowsRejected,
    long rowsUpserted,
    LoadStatus status,
    LoadStage failedStage,
    FailureKind failureKind,
    String error,
    Instant startedAt,
    Instant finishedAt
) {
    public static LoadResult succeeded(
        RecordType recordType,
        LocalDate date,
        String file,
        MergeOutcome outcome,
        Instant startedAt
    ) {
        return new LoadResult(
            recordType,
            date,
            file,
            outcome.rowsStaged(),
            outcome.rowsSuperseded(),
            outcome.rowsUpserted(),
            LoadStatus.SUCCEEDED,
            null,
            null,
            null,
            startedAt,
            Instant.now()
        );
    }

    public static LoadResult skipped(RecordType recordType, LocalDate date, String detail, Instant startedAt) {
        return new LoadResult(
            recordType,
            date,
            null,
            0,
            0,
            0,
            LoadStatus.SKIPPED,
            null,
            null,
            detail,
            startedAt,
            Instant.now()
        );
    }

    public static LoadResult failed(
        RecordType recordType,
        LocalDate date,
        String file,
        long rowsRead,
        LoadStage failedStage,
        FailureKind failureKind,
        String error,
        Instant startedAt
    ) {
        return new LoadResult(
            recordType,
            date,
            file,
            rowsRead,
            rowsRead,
            0,
            LoadStatus.FAILED,
            failedStage,
            failureKind,
            error,
            startedAt,
            Instant.now()
        );
    }

    public static LoadResult notAttempted(RecordType recordType, LocalDate date, RecordType blockedBy) {
        return new LoadResult(
            recordType,
            date,
            null,
            0,
            0,
            0,
            LoadStatus.NOT_ATTEMPTED,
            null,
            null,
            blockedBy == null ? null : "not attempted: " + blockedBy.apiName() + " load failed",
            null,
            null
        );
    }

    public boolean isFailed() {
        return status == LoadStatus.FAILED;
    }
}
