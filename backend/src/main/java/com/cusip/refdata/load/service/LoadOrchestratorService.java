package com.cusip.refdata.load.service;

import com.cusip.refdata.load.error.FailureKind;
import com.cusip.refdata.load.error.LoadCancelledException;
import com.cusip.refdata.load.error.LoadFailureException;
import com.cusip.refdata.load.error.LoadInProgressException;
import com.cusip.refdata.load.model.LoadResult;
import com.cusip.refdata.load.model.LoadStage;
import com.cusip.refdata.load.model.MergeOutcome;
import com.cusip.refdata.load.model.ParseSummary;
import com.cusip.refdata.load.model.RecordType;
import com.cusip.refdata.load.parse.RecordParser;
import com.cusip.refdata.load.source.FileSource;
import com.cusip.refdata.load.source.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

@Service
public class LoadOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(LoadOrchestratorService.class);

    private final FileSource fileSource;
    private final RecordParser parser;
    private final RecordMergeService mergeService;
    private final ReentrantLock runLock = new ReentrantLock();

    public LoadOrchestratorService(FileSource fileSource, RecordParser parser, RecordMergeService mergeService) {
        this.fileSource = fileSource;
        this.parser = parser;
        this.mergeService = mergeService;
    }

    public LoadResult loadRecordType(RecordType recordType, LocalDate date) {
        return load(List.of(recordType), date).get(0);
    }

    public List<LoadResult> loadAll(LocalDate date) {
        return load(EnumSet.allOf(RecordType.class), date);
    }

    /**
     * Loads the requested record types for a date in dependency order. After the first failure the
     * remaining types are reported as not attempted; a skipped type does not stop the chain.
     */
    public List<LoadResult> load(Collection<RecordType> recordTypes, LocalDate date) {
        if (recordTypes == null || recordTypes.isEmpty()) {
            throw new IllegalArgumentException("at least one record type is required");
        }
        if (date == null) {
            throw new IllegalArgumentException("load date is required");
        }
        ensureNoActiveRun();
        try {
            EnumSet<RecordType> ordered = EnumSet.copyOf(recordTypes);
            List<LoadResult> results = new ArrayList<>(ordered.size());
            RecordType failedType = null;
            for (RecordType recordType : ordered) {
                if (failedType != null) {
                    results.add(LoadResult.notAttempted(recordType, date, failedType));
                    continue;
                }
                LoadResult result = runRecordType(recordType, date);
                results.add(result);
                if (result.isFailed()) {
                    failedType = recordType;
                }
            }
            return results;
        } finally {
            runLock.unlock();
        }
    }

    public boolean isRunning() {
        return runLock.isLocked();
    }

    private void ensureNoActiveRun() {
        if (!runLock.tryLock()) {
            throw new LoadInProgressException("Another load run is in progress");
        }
    }

    private LoadResult runRecordType(RecordType recordType, LocalDate date) {
        Instant startedAt = Instant.now();
        Progress progress = new Progress(recordType);
        String fileName = null;
        long rowsRead = 0;
        try {
            progress.advance(LoadStage.FETCHING);
            ensureNotCancelled(recordType);
            Optional<SourceFile> file = fileSource.fetch(recordType, date);
            if (file.isEmpty()) {
                progress.advance(LoadStage.SKIPPED);
                String detail = "No " + recordType.apiName() + " file found for " + date + " in " + fileSource.describe();
                log.warn("Skipping {} for {}: {}", recordType.apiName(), date, detail);
                return LoadResult.skipped(recordType, date, detail, startedAt);
            }
            fileName = file.get().name();

            progress.advance(LoadStage.PARSING);
            ensureNotCancelled(recordType);
            RecordParser.RecordStream rows = parser.parse(recordType, file.get());
            ParseSummary summary = rows.validate();
            rowsRead = summary.dataLines();
            ensureNotCancelled(recordType);

            MergeOutcome outcome = mergeService.stageAndMerge(recordType, rows, progress::advance);
            progress.advance(LoadStage.SUCCEEDED);
            log.info(
                "Loaded {} from {}: read={}, upserted={}, superseded={}",
                recordType.apiName(),
                fileName,
                outcome.rowsStaged(),
                outcome.rowsUpserted(),
                outcome.rowsSuperseded()
            );
            return LoadResult.succeeded(recordType, date, fileName, outcome, startedAt);
        } catch (LoadFailureException e) {
            LoadStage failedStage = progress.fail();
            log.warn("Load of {} for {} failed at {} ({}): {}", recordType.apiName(), date, failedStage, e.kind(), e.getMessage());
            return LoadResult.failed(recordType, date, fileName, rowsRead, failedStage, e.kind(), e.getMessage(), startedAt);
        } catch (RuntimeException e) {
            LoadStage failedStage = progress.fail();
            log.error("Unexpected error loading {} for {} at {}", recordType.apiName(), date, failedStage, e);
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            return LoadResult.failed(recordType, date, fileName, rowsRead, failedStage, FailureKind.UNEXPECTED, message, startedAt);
        }
    }

    private void ensureNotCancelled(RecordType recordType) {
        if (Thread.currentThread().isInterrupted()) {
            throw new LoadCancelledException("Load of " + recordType.apiName() + " cancelled");
        }
    }

    private static final class Progress {
        private final RecordType recordType;
        private LoadStage stage = LoadStage.PENDING;

        private Progress(RecordType recordType) {
            this.recordType = recordType;
        }

        void advance(LoadStage next) {
            stage = stage.advanceTo(next);
            log.debug("{} -> {}", recordType.apiName(), stage);
        }

        LoadStage fail() {
            LoadStage failedAt = stage;
            if (!stage.isTerminal()) {
                stage = stage.advanceTo(LoadStage.FAILED);
            }
            return failedAt;
        }
    }
}
