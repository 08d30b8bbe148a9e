package com.archive.accessions.controller;

import com.archive.accessions.model.Accession;
import com.archive.accessions.model.CrawlStatus;
import com.archive.accessions.model.MetadataLanguage;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

public record AccessionResponse(
    Long id,

    @JsonProperty("seed_url")
    String seedUrl,

    @JsonProperty("metadata_language")
    MetadataLanguage language,

    String title,

    String description,

    List<String> subjects,

    @JsonProperty("record_time")
    LocalDateTime recordTime,

    @JsonProperty("crawl_status")
    CrawlStatus crawlStatus,

    @JsonProperty("crawl_timestamp")
    LocalDateTime crawlTimestamp,

    @JsonProperty("crawl_id")
    UUID crawlId,

    @JsonProperty("job_run_id")
    String jobRunId,

    @JsonProperty("wacz_url")
    String waczUrl
) {
    public static AccessionResponse from(Accession accession, String waczUrl) {
        return new AccessionResponse(
            accession.id(),
            accession.seedUrl(),
            accession.language(),
            accession.title(),
            accession.description(),
            accession.subjects(),
            accession.recordTime(),
            accession.crawlStatus(),
            accession.crawlTimestamp(),
            accession.crawlId(),
            accession.jobRunId(),
            waczUrl
        );
    }
}
