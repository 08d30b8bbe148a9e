package com.archive.accessions.config;

import com.archive.accessions.service.PollSleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
public class AsyncConfig {

    /**
     * One thread per saga, started on submission and never queued behind another saga.
     */
    @Bean(name = "crawlTaskExecutor")
    public Executor crawlTaskExecutor() {
        SimpleAsyncTaskExecutor executor = new SimpleAsyncTaskExecutor("crawl-saga-");
        executor.setDaemon(true);
        return executor;
    }

    @Bean
    public PollSleeper pollSleeper() {
        return interval -> Thread.sleep(interval.toMillis());
    }
}
