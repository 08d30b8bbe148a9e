package com.archive.accessions.service;

import com.archive.accessions.client.CrawlClient;
import com.archive.accessions.config.SagaProperties;
import com.archive.accessions.model.ArchiveRequest;
import com.archive.accessions.model.ArchivedRecord;
import com.archive.accessions.model.Artifact;
import com.archive.accessions.model.CrawlHandle;
import com.archive.accessions.model.CrawlOutcome;
import com.archive.accessions.model.FailureKind;
import com.archive.accessions.model.SagaResult;
import com.archive.accessions.model.SagaStep;
import com.archive.accessions.model.StorageKey;
import com.archive.accessions.notification.AccessionEmails;
import com.archive.accessions.notification.Notifier;
import com.archive.accessions.repository.CatalogWriter;
import com.archive.accessions.storage.ArtifactStore;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;

/**
 * Drives one accession from crawl launch to catalog entry:
 * create crawl, poll until complete, fetch the archive, store it, record it, notify the requester.
 *
 * <p>Steps run strictly in order and every failure ends the run; nothing is retried except
 * the status poll, and nothing is compensated. The catalog entry is written only after the
 * store confirmed the upload, so a catalog entry never points at a missing artifact. The reverse
 * (a stored artifact with no entry) is logged under {@link #ORPHANED_ARTIFACT} for manual
 * reconciliation.
 */
@Service
@Slf4j
public class CrawlOrchestrator {

    public static final Marker ORPHANED_ARTIFACT = MarkerFactory.getMarker("ORPHANED_ARTIFACT");

    private final CrawlClient crawlClient;
    private final ArtifactStore artifactStore;
    private final CatalogWriter catalogWriter;
    private final Notifier notifier;
    private final PollSleeper pollSleeper;
    private final Duration pollInterval;
    private final int maxPollAttempts;

    public CrawlOrchestrator(
        CrawlClient crawlClient,
        ArtifactStore artifactStore,
        CatalogWriter catalogWriter,
        Notifier notifier,
        PollSleeper pollSleeper,
        SagaProperties sagaProperties
    ) {
        this.crawlClient = crawlClient;
        this.artifactStore = artifactStore;
        this.catalogWriter = catalogWriter;
        this.notifier = notifier;
        this.pollSleeper = pollSleeper;
        this.pollInterval = sagaProperties.pollInterval();
        this.maxPollAttempts = sagaProperties.maxPollAttempts();
    }

    private record PollOutcome(boolean complete, int attempts) {}

    @Async("crawlTaskExecutor")
    public CompletableFuture<SagaResult> runDetached(ArchiveRequest request) {
        return CompletableFuture.completedFuture(run(request));
    }

    public SagaResult run(ArchiveRequest request) {
        CrawlHandle handle;
        try {
            handle = crawlClient.create(request.url(), request.browserProfile());
        } catch (RuntimeException e) {
            log.warn("Accession of {} failed at {}: could not launch crawl: {}",
                request.url(), SagaStep.INITIATING, e.getMessage());
            return SagaResult.failure(SagaStep.INITIATING, FailureKind.BEFORE_ARTIFACT, 0, null, null);
        }
        log.info("Launched crawl {} (job {}) for url {}", handle.crawlId(), handle.jobRunId(), request.url());

        PollOutcome polled;
        try {
            polled = pollUntilComplete(request, handle);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Accession of {} failed at {}: interrupted while waiting for crawl {}",
                request.url(), SagaStep.POLLING, handle.crawlId());
            return SagaResult.failure(SagaStep.POLLING, FailureKind.BEFORE_ARTIFACT, 0, handle, null);
        }
        if (!polled.complete()) {
            log.warn("Accession of {} failed at {}: crawl {} not complete after {} polls",
                request.url(), SagaStep.POLLING, handle.crawlId(), polled.attempts());
            return SagaResult.failure(SagaStep.POLLING, FailureKind.BEFORE_ARTIFACT, polled.attempts(), handle, null);
        }
        log.info("Crawl {} complete after {} poll(s)", handle.crawlId(), polled.attempts());

        Artifact artifact;
        try {
            artifact = Artifact.wacz(crawlClient.fetch(handle));
        } catch (RuntimeException e) {
            log.warn("Accession of {} failed at {}: could not download archive of job {}: {}",
                request.url(), SagaStep.FETCHING, handle.jobRunId(), e.getMessage());
            return SagaResult.failure(SagaStep.FETCHING, FailureKind.BEFORE_ARTIFACT, polled.attempts(), handle, null);
        }

        StorageKey key = StorageKey.generate();
        try {
            String etag = artifactStore.upload(key, artifact.content(), artifact.contentType());
            log.info("Stored {} bytes of job {} under {} (etag {})", artifact.size(), handle.jobRunId(), key, etag);
        } catch (RuntimeException e) {
            log.warn("Accession of {} failed at {}: upload of job {} under {} failed, crawl result abandoned: {}",
                request.url(), SagaStep.PERSISTING, handle.jobRunId(), key, e.getMessage());
            return SagaResult.failure(SagaStep.PERSISTING, FailureKind.AFTER_ARTIFACT, polled.attempts(), handle, key);
        }

        ArchivedRecord record = ArchivedRecord.completed(
            request, crawlClient.orgId(), handle, key, LocalDateTime.now(ZoneOffset.UTC));
        Long recordId;
        try {
            recordId = catalogWriter.writeRecord(record);
        } catch (RuntimeException e) {
            log.error(ORPHANED_ARTIFACT,
                "Accession of {} failed at {}: artifact {} is stored but has no catalog entry "
                    + "(crawl {}, job {}, org {}); reconcile manually",
                request.url(), SagaStep.RECORDING, key, handle.crawlId(), handle.jobRunId(), record.orgId(), e);
            return SagaResult.failure(SagaStep.RECORDING, FailureKind.ORPHANED_ARTIFACT, polled.attempts(), handle, key);
        }
        log.info("Accession {} recorded for url {}", recordId, request.url());

        boolean notified = notifyRequester(request, record, recordId);
        return SagaResult.success(polled.attempts(), handle, key, recordId, notified);
    }

    private PollOutcome pollUntilComplete(ArchiveRequest request, CrawlHandle handle) throws InterruptedException {
        for (int attempt = 1; attempt <= maxPollAttempts; attempt++) {
            log.info("Polled {} time(s) for url {}", attempt, request.url());

            CrawlOutcome outcome;
            try {
                outcome = crawlClient.status(handle);
            } catch (RuntimeException e) {
                log.warn("Invalid status response for crawl {}, trying again in {}s: {}",
                    handle.crawlId(), pollInterval.toSeconds(), e.getMessage());
                outcome = CrawlOutcome.PENDING;
            }

            if (outcome == CrawlOutcome.COMPLETE) {
                return new PollOutcome(true, attempt);
            }
            if (outcome == CrawlOutcome.FAILED_OR_UNKNOWN) {
                log.warn("Crawl {} reports a failed or unknown state, still waiting", handle.crawlId());
            }
            if (attempt < maxPollAttempts) {
                pollSleeper.sleep(pollInterval);
            }
        }
        return new PollOutcome(false, maxPollAttempts);
    }

    private boolean notifyRequester(ArchiveRequest request, ArchivedRecord record, Long recordId) {
        try {
            notifier.send(
                request.contactAddress(),
                AccessionEmails.subject(record),
                AccessionEmails.body(record, recordId)
            );
            log.info("Notified {} about accession {}", request.contactAddress(), recordId);
            return true;
        } catch (RuntimeException e) {
            log.warn("Accession {} recorded but notifying {} failed: {}",
                recordId, request.contactAddress(), e.getMessage());
            return false;
        }
    }
}
