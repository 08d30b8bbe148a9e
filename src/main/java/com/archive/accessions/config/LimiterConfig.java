package com.archive.accessions.config;

import com.archive.accessions.infra.InMemoryRpmRateLimiter;
import com.archive.accessions.infra.RateLimiter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LimiterConfig {

    @Bean("crawlApiLimiter")
    public RateLimiter crawlApiLimiter(CrawlerProperties crawlerProperties) {
        return new InMemoryRpmRateLimiter(crawlerProperties.requestsPerMinute());
    }
}
