package com.archive.accessions.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "app.saga")
public record SagaProperties(
    @NotNull Duration pollInterval,
    @NotNull @Min(1) @Max(1000) Integer maxPollAttempts,
    @NotNull Duration presignedUrlTtl
) {}
