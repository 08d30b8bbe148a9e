package com.archive.accessions.storage;

import com.archive.accessions.config.StorageProperties;
import com.archive.accessions.exception.ArtifactStoreException;
import com.archive.accessions.model.StorageKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

import java.time.Duration;

/**
 * {@link ArtifactStore} on an S3-compatible bucket. Single-request puts only, so objects
 * of 5 GB or more are rejected by the store.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class S3ArtifactStore implements ArtifactStore {

    private final S3Client s3Client;
    private final S3Presigner s3Presigner;
    private final StorageProperties properties;

    @Override
    public String upload(StorageKey key, byte[] content, String contentType) {
        PutObjectRequest request = PutObjectRequest.builder()
            .bucket(properties.bucket())
            .key(key.value())
            .contentType(contentType)
            .build();

        PutObjectResponse response;
        try {
            response = s3Client.putObject(request, RequestBody.fromBytes(content));
        } catch (SdkException e) {
            throw new ArtifactStoreException(key.value(), "Upload failed for " + key + ": " + e.getMessage(), e);
        }

        if (response.eTag() == null) {
            throw new ArtifactStoreException(key.value(), "Missing ETag in upload response for " + key);
        }
        log.debug("Stored {} bytes under {}", content.length, key);
        return response.eTag().replace("\"", "");
    }

    @Override
    public String presignedUrl(StorageKey key, Duration ttl) {
        try {
            s3Client.headObject(HeadObjectRequest.builder()
                .bucket(properties.bucket())
                .key(key.value())
                .build());
        } catch (NoSuchKeyException e) {
            throw new ArtifactStoreException(key.value(), "Object not found: " + key, e);
        } catch (SdkException e) {
            throw new ArtifactStoreException(key.value(), "Could not inspect " + key + ": " + e.getMessage(), e);
        }

        GetObjectPresignRequest presignRequest = GetObjectPresignRequest.builder()
            .signatureDuration(ttl)
            .getObjectRequest(GetObjectRequest.builder()
                .bucket(properties.bucket())
                .key(key.value())
                .build())
            .build();

        try {
            return s3Presigner.presignGetObject(presignRequest).url().toString();
        } catch (SdkException e) {
            throw new ArtifactStoreException(key.value(), "Failed to generate presigned URL for " + key, e);
        }
    }
}
