package com.archive.accessions.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class HttpClientConfig {

    @Bean("crawlRestTemplate")
    public RestTemplate crawlRestTemplate(RestTemplateBuilder builder, CrawlerProperties properties) {
        return builder
            .connectTimeout(properties.connectTimeout())
            .readTimeout(properties.readTimeout())
            .build();
    }

    @Bean("notificationRestTemplate")
    public RestTemplate notificationRestTemplate(RestTemplateBuilder builder, NotificationProperties properties) {
        return builder
            .connectTimeout(properties.timeout())
            .readTimeout(properties.timeout())
            .build();
    }
}
