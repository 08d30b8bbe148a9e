package com.archive.accessions.model;

import java.util.Locale;
import java.util.Set;

public enum CrawlOutcome {
    PENDING,
    COMPLETE,
    FAILED_OR_UNKNOWN;

    private static final Set<String> RUNNING_STATES = Set.of(
        "starting", "running", "waiting_capacity", "waiting_org_limit",
        "pending-wait", "generate-wacz", "uploading-wacz", "stopping", "paused"
    );

    /**
     * Maps the crawl service's {@code lastCrawlState} onto the three outcomes the saga cares about.
     * A missing state means the run has not been picked up yet.
     */
    public static CrawlOutcome fromCrawlState(String state) {
        if (state == null || state.isBlank()) {
            return PENDING;
        }
        String normalized = state.trim().toLowerCase(Locale.ROOT);
        if ("complete".equals(normalized)) {
            return COMPLETE;
        }
        if (RUNNING_STATES.contains(normalized)) {
            return PENDING;
        }
        return FAILED_OR_UNKNOWN;
    }
}
