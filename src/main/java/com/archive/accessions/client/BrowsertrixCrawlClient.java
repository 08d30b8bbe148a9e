package com.archive.accessions.client;

import com.archive.accessions.config.CrawlerProperties;
import com.archive.accessions.exception.CrawlClientException;
import com.archive.accessions.infra.RateLimiter;
import com.archive.accessions.model.BrowserProfile;
import com.archive.accessions.model.CrawlHandle;
import com.archive.accessions.model.CrawlOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.UUID;
import java.util.function.Function;

/**
 * {@link CrawlClient} over the Browsertrix REST API.
 */
@Component
@Slf4j
public class BrowsertrixCrawlClient implements CrawlClient {

    static final String CRAWL_API_LIMIT = "crawl_api_limit";

    private final RestTemplate restTemplate;
    private final CrawlerProperties properties;
    private final RateLimiter crawlApiLimiter;
    private final BrowsertrixCredentials credentials;

    public BrowsertrixCrawlClient(
        @Qualifier("crawlRestTemplate") RestTemplate restTemplate,
        CrawlerProperties properties,
        @Qualifier("crawlApiLimiter") RateLimiter crawlApiLimiter
    ) {
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.crawlApiLimiter = crawlApiLimiter;
        this.credentials = new BrowsertrixCredentials(this::login);
    }

    @Override
    public UUID orgId() {
        return properties.orgId();
    }

    @Override
    public CrawlHandle create(String url, BrowserProfile profile) {
        BrowsertrixCrawlConfig config = BrowsertrixCrawlConfig.singlePage(url, resolveProfileId(profile));

        BrowsertrixResponses.CreateCrawlResponse response = authenticated("create crawl", token ->
            restTemplate.exchange(
                properties.crawlConfigsUrl(),
                HttpMethod.POST,
                new HttpEntity<>(config, jsonHeaders(token)),
                BrowsertrixResponses.CreateCrawlResponse.class
            ).getBody()
        );

        if (response == null || response.id() == null || response.runNowJob() == null) {
            throw new CrawlClientException("Crawl service accepted " + url + " but returned no crawl handle");
        }
        return new CrawlHandle(response.id(), response.runNowJob());
    }

    @Override
    public CrawlOutcome status(CrawlHandle handle) {
        String statusUrl = properties.crawlConfigsUrl() + handle.crawlId();

        BrowsertrixResponses.CrawlConfigResponse response = authenticated("crawl status", token ->
            restTemplate.exchange(
                statusUrl,
                HttpMethod.GET,
                new HttpEntity<>(jsonHeaders(token)),
                BrowsertrixResponses.CrawlConfigResponse.class
            ).getBody()
        );

        if (response == null) {
            throw new CrawlClientException("Empty status response for crawl " + handle.crawlId());
        }
        log.debug("Crawl {} reports state '{}'", handle.crawlId(), response.lastCrawlState());
        return CrawlOutcome.fromCrawlState(response.lastCrawlState());
    }

    @Override
    public byte[] fetch(CrawlHandle handle) {
        String downloadUrl = properties.baseUrl() + "/orgs/" + properties.orgId()
            + "/crawls/" + handle.jobRunId() + "/download?prefer_single_wacz=true";

        byte[] body = authenticated("download archive", token -> {
            HttpHeaders headers = new HttpHeaders();
            headers.setBearerAuth(token);
            return restTemplate.exchange(downloadUrl, HttpMethod.GET, new HttpEntity<>(headers), byte[].class)
                .getBody();
        });

        if (body == null || body.length == 0) {
            throw new CrawlClientException("Crawl job " + handle.jobRunId() + " produced an empty archive");
        }
        return body;
    }

    private String resolveProfileId(BrowserProfile profile) {
        if (profile == null) {
            return "";
        }
        String profileId = properties.browserProfiles().get(profile.configKey());
        if (profileId == null) {
            throw new CrawlClientException("No crawl service profile configured for " + profile.configKey());
        }
        return profileId;
    }

    private <T> T authenticated(String operation, Function<String, T> call) {
        String token = credentials.currentToken();
        try {
            return crawlApiLimiter.execute(CRAWL_API_LIMIT, () -> call.apply(token));
        } catch (HttpClientErrorException.Unauthorized e) {
            log.info("Crawl service rejected token during {}, re-authenticating", operation);
            String refreshed = credentials.refresh(token);
            try {
                return crawlApiLimiter.execute(CRAWL_API_LIMIT, () -> call.apply(refreshed));
            } catch (RestClientException retryFailure) {
                throw new CrawlClientException(operation + " failed after re-authentication", retryFailure);
            }
        } catch (RestClientException e) {
            throw new CrawlClientException(operation + " failed: " + e.getMessage(), e);
        }
    }

    private String login() {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("username", properties.username());
        form.add("password", properties.password());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        try {
            BrowsertrixResponses.AuthResponse response = crawlApiLimiter.execute(CRAWL_API_LIMIT, () ->
                restTemplate.postForObject(
                    properties.loginUrl(),
                    new HttpEntity<>(form, headers),
                    BrowsertrixResponses.AuthResponse.class
                )
            );
            if (response == null || response.accessToken() == null) {
                throw new CrawlClientException("Crawl service login returned no access token");
            }
            return response.accessToken();
        } catch (RestClientException e) {
            throw new CrawlClientException("Crawl service login failed: " + e.getMessage(), e);
        }
    }

    private static HttpHeaders jsonHeaders(String token) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(token);
        headers.setContentType(MediaType.APPLICATION_JSON);
        return headers;
    }
}
