package com.archive.accessions.config;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "app.notification")
public record NotificationProperties(
    @NotBlank String apiBase,
    @NotBlank String apiKey,
    @NotBlank @Email String senderAddress,
    @NotNull Duration timeout
) {}
