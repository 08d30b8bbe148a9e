package com.archive.accessions.exception;

import lombok.Getter;

/**
 * A catalog entry for the same stored artifact or crawl job run already exists.
 */
@Getter
public class DuplicateRecordException extends CatalogWriteException {
    private final String jobRunId;

    public DuplicateRecordException(String jobRunId, Throwable cause) {
        super("Accession already recorded for job run " + jobRunId, cause);
        this.jobRunId = jobRunId;
    }
}
