package com.archive.accessions.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;

@Validated
@ConfigurationProperties(prefix = "app.crawler")
public record CrawlerProperties(
    @NotBlank String baseUrl,
    @NotBlank String username,
    @NotBlank String password,
    @NotNull UUID orgId,
    Map<String, String> browserProfiles,
    @NotNull Duration connectTimeout,
    @NotNull Duration readTimeout,
    @NotNull @Min(1) Integer requestsPerMinute
) {

    public CrawlerProperties {
        browserProfiles = browserProfiles == null ? Map.of() : Map.copyOf(browserProfiles);
    }

    public String loginUrl() {
        return baseUrl + "/auth/jwt/login";
    }

    public String crawlConfigsUrl() {
        return baseUrl + "/orgs/" + orgId + "/crawlconfigs/";
    }
}
