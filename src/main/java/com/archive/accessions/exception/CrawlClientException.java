package com.archive.accessions.exception;

public class CrawlClientException extends RuntimeException {

    public CrawlClientException(String message) {
        super(message);
    }

    public CrawlClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
