package com.archive.accessions.client;

import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Cached bearer token for the crawl service. Many sagas read it concurrently; a refresh
 * takes the write lock so only one login runs at a time.
 */
@Slf4j
public class BrowsertrixCredentials {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Supplier<String> login;
    private String accessToken;

    public BrowsertrixCredentials(Supplier<String> login) {
        this.login = login;
    }

    /**
     * Returns the cached token, logging in first if there is none yet.
     */
    public String currentToken() {
        lock.readLock().lock();
        try {
            if (accessToken != null) {
                return accessToken;
            }
        } finally {
            lock.readLock().unlock();
        }
        return refresh(null);
    }

    /**
     * Replaces {@code staleToken} with a fresh one. If another caller already replaced it,
     * the newer token is returned without logging in again.
     */
    public String refresh(String staleToken) {
        lock.writeLock().lock();
        try {
            if (accessToken != null && !Objects.equals(accessToken, staleToken)) {
                return accessToken;
            }
            log.info("Logging into crawl service");
            accessToken = login.get();
            return accessToken;
        } finally {
            lock.writeLock().unlock();
        }
    }
}
