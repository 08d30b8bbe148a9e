package com.archive.accessions.client;

import com.archive.accessions.model.BrowserProfile;
import com.archive.accessions.model.CrawlHandle;
import com.archive.accessions.model.CrawlOutcome;

import java.util.UUID;

/**
 * Authenticated access to the remote crawl service. Implementations re-authenticate
 * transparently: a call rejected for an expired credential is retried once after refreshing it.
 * Any other failure surfaces as {@link com.archive.accessions.exception.CrawlClientException}.
 */
public interface CrawlClient {

    /** Organisation the crawls run under; recorded with every accession. */
    UUID orgId();

    CrawlHandle create(String url, BrowserProfile profile);

    CrawlOutcome status(CrawlHandle handle);

    byte[] fetch(CrawlHandle handle);
}
