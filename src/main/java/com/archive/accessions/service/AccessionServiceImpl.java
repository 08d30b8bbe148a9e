package com.archive.accessions.service;

import com.archive.accessions.config.SagaProperties;
import com.archive.accessions.controller.AccessionResponse;
import com.archive.accessions.exception.EntityNotFoundException;
import com.archive.accessions.exception.SubjectsNotFoundException;
import com.archive.accessions.model.Accession;
import com.archive.accessions.model.ArchiveRequest;
import com.archive.accessions.model.SagaResult;
import com.archive.accessions.model.StorageKey;
import com.archive.accessions.repository.AccessionRepository;
import com.archive.accessions.repository.SubjectRepository;
import com.archive.accessions.storage.ArtifactStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.concurrent.CompletableFuture;

@Service
@Slf4j
@RequiredArgsConstructor
public class AccessionServiceImpl implements AccessionService {

    private final AccessionRepository accessionRepository;
    private final SubjectRepository subjectRepository;
    private final ArtifactStore artifactStore;
    private final CrawlSagaLauncher sagaLauncher;
    private final SagaProperties sagaProperties;

    @Override
    public CompletableFuture<SagaResult> requestAccession(ArchiveRequest request) {
        int found = subjectRepository.countExisting(request.subjects(), request.language());
        if (found != request.subjects().size()) {
            log.debug("Rejecting accession of {}: {} of {} subjects exist", request.url(), found, request.subjects().size());
            throw new SubjectsNotFoundException(request.subjects());
        }
        return sagaLauncher.launch(request);
    }

    @Override
    @Transactional(readOnly = true)
    public AccessionResponse getById(Long id) {
        log.debug("Fetching accession by ID: {}", id);

        Accession accession = accessionRepository.findById(id)
            .filter(found -> !found.isPrivate())
            .orElseThrow(() -> {
                log.warn("Accession not found with ID: {}", id);
                return new EntityNotFoundException(id);
            });

        String waczUrl = accession.s3Filename() == null
            ? null
            : artifactStore.presignedUrl(new StorageKey(accession.s3Filename()), sagaProperties.presignedUrlTtl());

        return AccessionResponse.from(accession, waczUrl);
    }
}
