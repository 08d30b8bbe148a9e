package com.archive.accessions.model;

public enum CrawlStatus {
    PENDING,
    COMPLETE,
    ERROR,
    BAD_CRAWL
}
