package com.archive.accessions.model;

import java.time.LocalDateTime;
import java.util.Set;

/**
 * A fully validated request to archive one web page. Subjects are known to exist
 * by the time a request reaches the orchestrator.
 */
public record ArchiveRequest(
    String url,
    MetadataLanguage language,
    String title,
    String description,
    Set<Long> subjects,
    boolean isPrivate,
    BrowserProfile browserProfile,
    String contactAddress,
    LocalDateTime recordTime
) {
    public ArchiveRequest {
        subjects = Set.copyOf(subjects);
    }
}
