package com.archive.accessions.infra;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Blocking requests-per-minute limiter, one bucket per key, shared by every saga in the process.
 */
public class InMemoryRpmRateLimiter implements RateLimiter {

    private final ConcurrentHashMap<String, Bucket> buckets = new ConcurrentHashMap<>();

    private final int rpmLimit;

    public InMemoryRpmRateLimiter(int rpmLimit) {
        this.rpmLimit = rpmLimit;
    }

    private Bucket createBucket() {
        return Bucket.builder()
            .addLimit(Bandwidth.classic(rpmLimit, Refill.greedy(rpmLimit, Duration.ofMinutes(1))))
            .build();
    }

    @Override
    public void acquire(String key) {
        Bucket bucket = buckets.computeIfAbsent(key, k -> createBucket());
        try {
            bucket.asBlocking().consume(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for rate limit on " + key, e);
        }
    }
}
