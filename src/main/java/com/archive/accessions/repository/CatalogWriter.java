package com.archive.accessions.repository;

import com.archive.accessions.model.ArchivedRecord;

public interface CatalogWriter {

    /**
     * Writes the record and its metadata atomically.
     *
     * @return id of the new catalog entry
     * @throws com.archive.accessions.exception.DuplicateRecordException if the job run or storage key is already recorded
     * @throws com.archive.accessions.exception.CatalogWriteException on any other failure; nothing is written
     */
    Long writeRecord(ArchivedRecord record);
}
