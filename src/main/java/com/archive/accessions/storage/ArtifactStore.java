package com.archive.accessions.storage;

import com.archive.accessions.model.StorageKey;

import java.time.Duration;

/**
 * Durable object storage for crawl artifacts. Failures surface as
 * {@link com.archive.accessions.exception.ArtifactStoreException}.
 */
public interface ArtifactStore {

    /**
     * Stores the bytes under {@code key}.
     *
     * @return the store's confirmation for the write (the object ETag)
     */
    String upload(StorageKey key, byte[] content, String contentType);

    /**
     * Signed, time-limited URL to read an existing object without credentials.
     */
    String presignedUrl(StorageKey key, Duration ttl);
}
