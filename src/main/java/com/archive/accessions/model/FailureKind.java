package com.archive.accessions.model;

public enum FailureKind {
    /** Crawl creation, poll budget exhausted or fetch failed: nothing was persisted. */
    BEFORE_ARTIFACT,
    /** Upload failed: the remote crawl result is abandoned. */
    AFTER_ARTIFACT,
    /** Catalog write failed after upload: a stored artifact has no catalog entry. */
    ORPHANED_ARTIFACT
}
