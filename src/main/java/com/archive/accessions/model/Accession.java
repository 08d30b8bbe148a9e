package com.archive.accessions.model;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

public record Accession(
    Long id,
    String seedUrl,
    MetadataLanguage language,
    String title,
    String description,
    List<String> subjects,
    boolean isPrivate,
    LocalDateTime recordTime,
    CrawlStatus crawlStatus,
    LocalDateTime crawlTimestamp,
    UUID orgId,
    UUID crawlId,
    String jobRunId,
    String fileType,
    String s3Filename
) {}
