package com.archive.accessions.service;

import com.archive.accessions.model.ArchiveRequest;
import com.archive.accessions.model.SagaResult;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Starts sagas detached from the request that asked for them and supervises them:
 * every run is tracked until it ends, and anything escaping a run is logged instead of lost.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CrawlSagaLauncher {

    private final CrawlOrchestrator orchestrator;

    private final Map<UUID, ArchiveRequest> inFlight = new ConcurrentHashMap<>();

    public CompletableFuture<SagaResult> launch(ArchiveRequest request) {
        UUID sagaId = UUID.randomUUID();
        inFlight.put(sagaId, request);
        log.info("Starting accession saga {} for url {}", sagaId, request.url());

        CompletableFuture<SagaResult> run;
        try {
            run = orchestrator.runDetached(request);
        } catch (RuntimeException e) {
            inFlight.remove(sagaId);
            log.error("Could not start accession saga {} for url {}", sagaId, request.url(), e);
            return CompletableFuture.failedFuture(e);
        }

        return run.whenComplete((result, error) -> {
            inFlight.remove(sagaId);
            if (error != null) {
                log.error("Accession saga {} for url {} died unexpectedly", sagaId, request.url(), error);
            } else if (result.succeeded()) {
                log.info("Accession saga {} succeeded with record {}", sagaId, result.recordId());
            } else {
                log.info("Accession saga {} ended in failure at {} ({})", sagaId, result.failedStep(), result.failureKind());
            }
        });
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    @PreDestroy
    public void reportAbandoned() {
        inFlight.forEach((sagaId, request) ->
            log.warn("Shutting down with accession saga {} for url {} in flight; its progress is lost",
                sagaId, request.url()));
    }
}
