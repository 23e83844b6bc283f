package com.lab2fhir.service;

import com.google.common.util.concurrent.Striped;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

/**
 * In-process mutual exclusion scoped to one report (or one content hash during submission).
 * Work passed in must commit before returning so the lock covers the write.
 */
@Component
public class ReportLockManager {

    private final Striped<Lock> reportLocks;
    private final Striped<Lock> contentLocks;

    public ReportLockManager(@Value("${app.pipeline.lock-stripes:256}") int stripes) {
        this.reportLocks = Striped.lazyWeakLock(stripes);
        this.contentLocks = Striped.lazyWeakLock(stripes);
    }

    public <T> T withReportLock(UUID reportId, Supplier<T> work) {
        return runLocked(reportLocks.get(reportId), work);
    }

    public <T> T withContentLock(String contentHash, Supplier<T> work) {
        return runLocked(contentLocks.get(contentHash), work);
    }

    private static <T> T runLocked(Lock lock, Supplier<T> work) {
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }
}
