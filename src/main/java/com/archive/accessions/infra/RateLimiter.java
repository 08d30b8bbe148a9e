package com.archive.accessions.infra;

import java.util.function.Supplier;

public interface RateLimiter {

    void acquire(String key);

    default <T> T execute(String key, Supplier<T> call) {
        acquire(key);
        return call.get();
    }
}
