package com.archive.accessions.controller;

import com.archive.accessions.model.ArchiveRequest;
import com.archive.accessions.model.BrowserProfile;
import com.archive.accessions.model.MetadataLanguage;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.hibernate.validator.constraints.URL;

import java.time.LocalDateTime;
import java.util.Set;

public record AccessionRequest(
    @NotBlank
    @URL
    String url,

    @NotNull
    @JsonProperty("metadata_language")
    MetadataLanguage metadataLanguage,

    @NotBlank
    @Size(max = 200)
    @JsonProperty("metadata_title")
    String metadataTitle,

    @Size(min = 1, max = 2000)
    @JsonProperty("metadata_description")
    String metadataDescription,

    @NotNull
    @JsonProperty("metadata_time")
    LocalDateTime metadataTime,

    @NotEmpty
    @Size(max = 200)
    @JsonProperty("metadata_subjects")
    Set<Long> metadataSubjects,

    @JsonProperty("is_private")
    boolean isPrivate,

    @JsonProperty("browser_profile")
    BrowserProfile browserProfile,

    @NotBlank
    @Email
    @JsonProperty("requester_email")
    String requesterEmail
) {
    public ArchiveRequest toArchiveRequest() {
        return new ArchiveRequest(
            url,
            metadataLanguage,
            metadataTitle,
            metadataDescription,
            metadataSubjects,
            isPrivate,
            browserProfile,
            requesterEmail,
            metadataTime
        );
    }
}
