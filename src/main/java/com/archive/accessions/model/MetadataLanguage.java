package com.archive.accessions.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MetadataLanguage {
    ENGLISH("en"),
    ARABIC("ar");

    private final String tableSuffix;

    MetadataLanguage(String tableSuffix) {
        this.tableSuffix = tableSuffix;
    }

    public String tableSuffix() {
        return tableSuffix;
    }

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MetadataLanguage fromJson(String value) {
        return MetadataLanguage.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
