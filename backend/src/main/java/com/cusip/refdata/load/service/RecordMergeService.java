package com.cusip.refdata.load.service;

import com.cusip.refdata.load.error.LoadCancelledException;
import com.cusip.refdata.load.model.LoadStage;
import com.cusip.refdata.load.model.MergeOutcome;
import com.cusip.refdata.load.model.ParsedRow;
import com.cusip.refdata.load.model.RecordType;
import com.cusip.refdata.load.persistence.MasterJdbcRepository;
import com.cusip.refdata.load.persistence.StagingJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Consumer;

/**
 * Runs staging and merge for one record type as a single transaction under the record type's lock.
 * Any exception rolls back both the scratch table and the master table.
 */
@Service
public class RecordMergeService {
    private static final Logger log = LoggerFactory.getLogger(RecordMergeService.class);

    private final StagingJdbcRepository stagingRepository;
    private final MasterJdbcRepository masterRepository;
    private final RecordTypeLocks locks;
    private final TransactionTemplate transactionTemplate;

    public RecordMergeService(
        StagingJdbcRepository stagingRepository,
        MasterJdbcRepository masterRepository,
        RecordTypeLocks locks,
        PlatformTransactionManager transactionManager
    ) {
        this.stagingRepository = stagingRepository;
        this.masterRepository = masterRepository;
        this.locks = locks;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public MergeOutcome stageAndMerge(RecordType recordType, Iterable<ParsedRow> rows, Consumer<LoadStage> stageListener) {
        return locks.withLock(recordType, () -> transactionTemplate.execute(status -> {
            masterRepository.acquireMergeLock(recordType);
            stageListener.accept(LoadStage.STAGING);
            long staged = stagingRepository.replace(recordType, rows);
            ensureNotCancelled(recordType, "staging");
            stageListener.accept(LoadStage.MERGING);
            MergeOutcome outcome = masterRepository.merge(recordType);
            ensureNotCancelled(recordType, "merging");
            if (outcome.rowsStaged() != staged) {
                log.warn(
                    "{} staged {} rows but the scratch table holds {}",
                    recordType.apiName(),
                    staged,
                    outcome.rowsStaged()
                );
            }
            return outcome;
        }));
    }

    private void ensureNotCancelled(RecordType recordType, String phase) {
        if (Thread.currentThread().isInterrupted()) {
            throw new LoadCancelledException("Load of " + recordType.apiName() + " cancelled while " + phase + "; rolled back");
        }
    }
}
