package com.archive.accessions.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Named browser profiles a crawl can run under (logged-in sessions kept by the crawl service).
 * The crawl-service profile id for each name comes from {@code app.crawler.browser-profiles}.
 */
public enum BrowserProfile {
    FACEBOOK;

    @JsonValue
    public String configKey() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static BrowserProfile fromJson(String value) {
        return BrowserProfile.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
