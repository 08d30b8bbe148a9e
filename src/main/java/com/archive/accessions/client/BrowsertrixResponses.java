package com.archive.accessions.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

final class BrowsertrixResponses {

    private BrowsertrixResponses() {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record AuthResponse(@JsonProperty("access_token") String accessToken) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CreateCrawlResponse(UUID id, @JsonProperty("run_now_job") String runNowJob) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CrawlConfigResponse(@JsonProperty("lastCrawlState") String lastCrawlState) {}
}
