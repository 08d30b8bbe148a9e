package com.archive.accessions.exception;

import lombok.Getter;

@Getter
public class ArtifactStoreException extends RuntimeException {
    private final String key;

    public ArtifactStoreException(String key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    public ArtifactStoreException(String key, String message) {
        this(key, message, null);
    }
}
