package com.archive.accessions.model;

/**
 * The single web-archive file produced by a completed crawl.
 */
public record Artifact(byte[] content, String contentType) {

    public static final String WACZ_CONTENT_TYPE = "application/wacz";

    public static Artifact wacz(byte[] content) {
        return new Artifact(content, WACZ_CONTENT_TYPE);
    }

    public int size() {
        return content.length;
    }
}
