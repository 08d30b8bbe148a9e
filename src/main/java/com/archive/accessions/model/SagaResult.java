package com.archive.accessions.model;

/**
 * Terminal state of one saga run. Failure fields are null on success; record fields are null
 * until the corresponding step succeeded.
 */
public record SagaResult(
    boolean succeeded,
    SagaStep failedStep,
    FailureKind failureKind,
    int pollAttempts,
    CrawlHandle handle,
    StorageKey storageKey,
    Long recordId,
    boolean notified
) {

    public static SagaResult success(int pollAttempts, CrawlHandle handle, StorageKey key, Long recordId, boolean notified) {
        return new SagaResult(true, null, null, pollAttempts, handle, key, recordId, notified);
    }

    public static SagaResult failure(SagaStep step, FailureKind kind, int pollAttempts, CrawlHandle handle, StorageKey key) {
        return new SagaResult(false, step, kind, pollAttempts, handle, key, null, false);
    }
}
