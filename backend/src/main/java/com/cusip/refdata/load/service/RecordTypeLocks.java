package com.cusip.refdata.load.service;

import com.cusip.refdata.config.LoaderProperties;
import com.cusip.refdata.load.error.LoadCancelledException;
import com.cusip.refdata.load.error.LockTimeoutException;
import com.cusip.refdata.load.model.RecordType;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per record type around its staging and merge critical section.
 */
@Component
public class RecordTypeLocks {
    private final Map<RecordType, ReentrantLock> locks = new EnumMap<>(RecordType.class);
    private final LoaderProperties properties;

    public RecordTypeLocks(LoaderProperties properties) {
        this.properties = properties;
        for (RecordType type : RecordType.values()) {
            locks.put(type, new ReentrantLock());
        }
    }

    public <T> T withLock(RecordType recordType, Supplier<T> action) {
        ReentrantLock lock = locks.get(recordType);
        int waitSeconds = properties.getLock().getWaitSeconds();
        boolean acquired;
        try {
            acquired = lock.tryLock(waitSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LoadCancelledException("Interrupted while waiting for the " + recordType.apiName() + " load lock");
        }
        if (!acquired) {
            throw new LockTimeoutException(
                "A " + recordType.apiName() + " load is already staging or merging (waited " + waitSeconds + "s)"
            );
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public boolean isLocked(RecordType recordType) {
        return locks.get(recordType).isLocked();
    }
}
