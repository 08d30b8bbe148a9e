package com.archive.accessions.service;

import com.archive.accessions.controller.AccessionResponse;
import com.archive.accessions.model.ArchiveRequest;
import com.archive.accessions.model.SagaResult;

import java.util.concurrent.CompletableFuture;

public interface AccessionService {
    CompletableFuture<SagaResult> requestAccession(ArchiveRequest request);
    AccessionResponse getById(Long id);
}
