package com.archive.accessions.exception;

public class CatalogWriteException extends RuntimeException {

    public CatalogWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
