package com.archive.accessions.model;

/**
 * Steps at which a saga run can fail. Notifying is best-effort and never fails a run.
 */
public enum SagaStep {
    INITIATING,
    POLLING,
    FETCHING,
    PERSISTING,
    RECORDING
}
