package com.archive.accessions.service;

import java.time.Duration;

/**
 * Waits between crawl status polls.
 */
@FunctionalInterface
public interface PollSleeper {

    void sleep(Duration interval) throws InterruptedException;
}
