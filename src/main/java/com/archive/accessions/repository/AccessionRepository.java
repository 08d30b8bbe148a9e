package com.archive.accessions.repository;

import com.archive.accessions.model.Accession;

import java.util.Optional;

public interface AccessionRepository extends CatalogWriter {
    Optional<Accession> findById(Long id);
}
