package com.archive.accessions.model;

import java.util.UUID;

/**
 * Object name an artifact is stored under. Always generated, never derived from user input.
 */
public record StorageKey(String value) {

    private static final String WACZ_SUFFIX = ".wacz";

    public static StorageKey generate() {
        return new StorageKey(UUID.randomUUID() + WACZ_SUFFIX);
    }

    @Override
    public String toString() {
        return value;
    }
}
