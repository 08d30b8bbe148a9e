package com.archive.accessions.model;

import java.time.LocalDateTime;
import java.util.Set;
import java.util.UUID;

/**
 * The catalog entry written once per successful saga, after its artifact is stored.
 */
public record ArchivedRecord(
    String seedUrl,
    MetadataLanguage language,
    String title,
    String description,
    Set<Long> subjects,
    boolean isPrivate,
    LocalDateTime recordTime,
    UUID orgId,
    UUID crawlId,
    String jobRunId,
    StorageKey storageKey,
    CrawlStatus crawlStatus,
    LocalDateTime crawlTimestamp
) {

    public static ArchivedRecord completed(
        ArchiveRequest request,
        UUID orgId,
        CrawlHandle handle,
        StorageKey storageKey,
        LocalDateTime crawlTimestamp
    ) {
        String description = request.description() == null || request.description().isBlank()
            ? null
            : request.description().trim();
        return new ArchivedRecord(
            request.url(),
            request.language(),
            request.title().trim(),
            description,
            request.subjects(),
            request.isPrivate(),
            request.recordTime(),
            orgId,
            handle.crawlId(),
            handle.jobRunId(),
            storageKey,
            CrawlStatus.COMPLETE,
            crawlTimestamp
        );
    }
}
