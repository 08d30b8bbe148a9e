package com.archive.accessions.model;

import java.util.UUID;

/**
 * Identifies an accepted crawl: the crawl configuration id and the id of the job run it started.
 */
public record CrawlHandle(UUID crawlId, String jobRunId) {
}
