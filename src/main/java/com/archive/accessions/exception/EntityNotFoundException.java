package com.archive.accessions.exception;

import lombok.Getter;

@Getter
public class EntityNotFoundException extends RuntimeException {
    private final Long entityId;

    public EntityNotFoundException(Long entityId) {
        super("Accession not found: " + entityId);
        this.entityId = entityId;
    }
}
