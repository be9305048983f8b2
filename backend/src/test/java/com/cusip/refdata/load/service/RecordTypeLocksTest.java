package com.cusip.refdata.load.service;

import com.cusip.refdata.config.LoaderProperties;
import com.cusip.refdata.load.error.LockTimeoutException;
import com.cusip.refdata.load.model.RecordType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class RecordTypeLocksTest {

    private final ExecutorService executor = Executors.newSingleThreadExecutor();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void sameRecordTypeIsExclusiveAcrossThreads() {
        RecordTypeLocks locks = new RecordTypeLocks(noWait());

        Throwable contenderFailure = locks.withLock(RecordType.ISSUE, () -> {
            try {
                executor.submit(() -> locks.withLock(RecordType.ISSUE, () -> "acquired")).get();
                return null;
            } catch (ExecutionException e) {
                return e.getCause();
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });

        assertThat(contenderFailure).isInstanceOf(LockTimeoutException.class);
    }

    @Test
    void differentRecordTypesDoNotBlockEachOther() throws Exception {
        RecordTypeLocks locks = new RecordTypeLocks(noWait());

        String result = locks.withLock(RecordType.ISSUER, () -> {
            try {
                return executor.submit(() -> locks.withLock(RecordType.ISSUE, () -> "issue")).get();
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        });

        assertEquals("issue", result);
    }

    @Test
    void lockIsReleasedWhenActionThrows() {
        RecordTypeLocks locks = new RecordTypeLocks(noWait());

        assertThatThrownBy(() -> locks.withLock(RecordType.ISSUER, () -> {
            throw new IllegalStateException("boom");
        })).hasMessage("boom");

        assertFalse(locks.isLocked(RecordType.ISSUER));
        assertThat(locks.withLock(RecordType.ISSUER, () -> "again")).isEqualTo("again");
    }

    private static LoaderProperties noWait() {
        LoaderProperties properties = new LoaderProperties();
        properties.getLock().setWaitSeconds(0);
        return properties;
    }
}
