package com.archive.accessions.client;

import com.archive.accessions.config.CrawlerProperties;
import com.archive.accessions.exception.CrawlClientException;
import com.archive.accessions.infra.InMemoryRpmRateLimiter;
import com.archive.accessions.model.BrowserProfile;
import com.archive.accessions.model.CrawlHandle;
import com.archive.accessions.model.CrawlOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class BrowsertrixCrawlClientTest {

    private static final String BASE_URL = "http://crawler.test/api";
    private static final UUID ORG_ID = UUID.fromString("aaaaaaaa-bbbb-cccc-dddd-eeeeeeeeeeee");
    private static final UUID CRAWL_ID = UUID.fromString("12345678-1234-1234-1234-123456789abc");
    private static final String LOGIN_URL = BASE_URL + "/auth/jwt/login";
    private static final String CONFIGS_URL = BASE_URL + "/orgs/" + ORG_ID + "/crawlconfigs/";

    private MockRestServiceServer server;
    private BrowsertrixCrawlClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        CrawlerProperties properties = new CrawlerProperties(
            BASE_URL, "archivist@example.org", "secret", ORG_ID,
            Map.of("facebook", "profile-fb"),
            Duration.ofSeconds(5), Duration.ofSeconds(5), 1000
        );
        client = new BrowsertrixCrawlClient(restTemplate, properties, new InMemoryRpmRateLimiter(1000));
    }

    private void expectLogin(String token) {
        server.expect(requestTo(LOGIN_URL))
            .andExpect(method(HttpMethod.POST))
            .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_FORM_URLENCODED))
            .andExpect(content().formDataContains(Map.of("username", "archivist@example.org", "password", "secret")))
            .andRespond(withSuccess("{\"access_token\":\"" + token + "\",\"token_type\":\"bearer\"}",
                MediaType.APPLICATION_JSON));
    }

    private String createdBody() {
        return "{\"added\":true,\"id\":\"" + CRAWL_ID + "\",\"run_now_job\":\"manual-job-1\"}";
    }

    @Nested
    @DisplayName("Creating crawls")
    class CreateTest {

        @Test
        @DisplayName("Should log in lazily and post a single-page crawl that runs now")
        void shouldCreateSinglePageCrawl() {
            expectLogin("t1");
            server.expect(requestTo(CONFIGS_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer t1"))
                .andExpect(jsonPath("$.runNow").value(true))
                .andExpect(jsonPath("$.profileid").value(""))
                .andExpect(jsonPath("$.config.scopeType").value("page"))
                .andExpect(jsonPath("$.config.seeds[0].url").value("https://example.org/page"))
                .andExpect(jsonPath("$.config.behaviors").value(BrowsertrixCrawlConfig.BEHAVIORS))
                .andExpect(jsonPath("$.config.postLoadDelay").value(BrowsertrixCrawlConfig.POST_LOAD_DELAY_SECONDS))
                .andRespond(withSuccess(createdBody(), MediaType.APPLICATION_JSON));

            CrawlHandle handle = client.create("https://example.org/page", null);

            assertThat(handle.crawlId()).isEqualTo(CRAWL_ID);
            assertThat(handle.jobRunId()).isEqualTo("manual-job-1");
            server.verify();
        }

        @Test
        @DisplayName("Should send the configured profile id for a named browser profile")
        void shouldResolveBrowserProfile() {
            expectLogin("t1");
            server.expect(requestTo(CONFIGS_URL))
                .andExpect(jsonPath("$.profileid").value("profile-fb"))
                .andRespond(withSuccess(createdBody(), MediaType.APPLICATION_JSON));

            client.create("https://facebook.com/somepage", BrowserProfile.FACEBOOK);

            server.verify();
        }

        @Test
        @DisplayName("Should fail when the response carries no job id")
        void shouldFailWithoutJobId() {
            expectLogin("t1");
            server.expect(requestTo(CONFIGS_URL))
                .andRespond(withSuccess("{\"id\":\"" + CRAWL_ID + "\"}", MediaType.APPLICATION_JSON));

            assertThatThrownBy(() -> client.create("https://example.org", null))
                .isInstanceOf(CrawlClientException.class)
                .hasMessageContaining("no crawl handle");
        }
    }

    @Nested
    @DisplayName("Re-authentication")
    class ReauthenticationTest {

        @Test
        @DisplayName("Should refresh the token once and retry after a 401")
        void shouldRetryOnceWithFreshToken() {
            expectLogin("t1");
            server.expect(requestTo(CONFIGS_URL))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer t1"))
                .andRespond(withUnauthorizedRequest());
            expectLogin("t2");
            server.expect(requestTo(CONFIGS_URL))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer t2"))
                .andRespond(withSuccess(createdBody(), MediaType.APPLICATION_JSON));

            CrawlHandle handle = client.create("https://example.org", null);

            assertThat(handle.jobRunId()).isEqualTo("manual-job-1");
            server.verify();
        }

        @Test
        @DisplayName("Should give up when the retried call is rejected again")
        void shouldFailWhenRetryIsRejected() {
            expectLogin("t1");
            server.expect(requestTo(CONFIGS_URL)).andRespond(withUnauthorizedRequest());
            expectLogin("t2");
            server.expect(requestTo(CONFIGS_URL)).andRespond(withUnauthorizedRequest());

            assertThatThrownBy(() -> client.create("https://example.org", null))
                .isInstanceOf(CrawlClientException.class)
                .hasMessageContaining("after re-authentication");
            server.verify();
        }

        @Test
        @DisplayName("Should reuse the cached token across calls")
        void shouldReuseToken() {
            expectLogin("t1");
            server.expect(requestTo(CONFIGS_URL + CRAWL_ID))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer t1"))
                .andRespond(withSuccess("{\"lastCrawlState\":\"running\"}", MediaType.APPLICATION_JSON));
            server.expect(requestTo(CONFIGS_URL + CRAWL_ID))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer t1"))
                .andRespond(withSuccess("{\"lastCrawlState\":\"running\"}", MediaType.APPLICATION_JSON));

            CrawlHandle handle = new CrawlHandle(CRAWL_ID, "manual-job-1");
            client.status(handle);
            client.status(handle);

            server.verify();
        }
    }

    @Nested
    @DisplayName("Status and download")
    class StatusAndFetchTest {

        private final CrawlHandle handle = new CrawlHandle(CRAWL_ID, "manual-job-1");

        @Test
        void shouldMapCompleteState() {
            expectLogin("t1");
            server.expect(requestTo(CONFIGS_URL + CRAWL_ID))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("{\"lastCrawlState\":\"complete\",\"name\":\"x\"}", MediaType.APPLICATION_JSON));

            assertThat(client.status(handle)).isEqualTo(CrawlOutcome.COMPLETE);
        }

        @Test
        void shouldTreatMissingStateAsPending() {
            expectLogin("t1");
            server.expect(requestTo(CONFIGS_URL + CRAWL_ID))
                .andRespond(withSuccess("{\"lastCrawlState\":null}", MediaType.APPLICATION_JSON));

            assertThat(client.status(handle)).isEqualTo(CrawlOutcome.PENDING);
        }

        @Test
        void shouldWrapServerErrors() {
            expectLogin("t1");
            server.expect(requestTo(CONFIGS_URL + CRAWL_ID)).andRespond(withServerError());

            assertThatThrownBy(() -> client.status(handle)).isInstanceOf(CrawlClientException.class);
        }

        @Test
        void shouldDownloadSingleWacz() {
            byte[] archive = {1, 2, 3, 4};
            expectLogin("t1");
            server.expect(requestTo(BASE_URL + "/orgs/" + ORG_ID + "/crawls/manual-job-1/download?prefer_single_wacz=true"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer t1"))
                .andRespond(withSuccess(archive, MediaType.APPLICATION_OCTET_STREAM));

            assertThat(client.fetch(handle)).containsExactly(1, 2, 3, 4);
        }

        @Test
        void shouldRejectEmptyDownload() {
            expectLogin("t1");
            server.expect(requestTo(BASE_URL + "/orgs/" + ORG_ID + "/crawls/manual-job-1/download?prefer_single_wacz=true"))
                .andRespond(withSuccess(new byte[0], MediaType.APPLICATION_OCTET_STREAM));

            assertThatThrownBy(() -> client.fetch(handle))
                .isInstanceOf(CrawlClientException.class)
                .hasMessageContaining("empty archive");
        }
    }

    @Test
    @DisplayName("Should reject an unconfigured browser profile before calling the service")
    void shouldRejectUnknownProfile() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer noCallsServer = MockRestServiceServer.bindTo(restTemplate).build();
        BrowsertrixCrawlClient unconfigured = new BrowsertrixCrawlClient(
            restTemplate,
            new CrawlerProperties(BASE_URL, "u", "p", ORG_ID, null, Duration.ofSeconds(1), Duration.ofSeconds(1), 10),
            new InMemoryRpmRateLimiter(10)
        );

        assertThatThrownBy(() -> unconfigured.create("https://facebook.com", BrowserProfile.FACEBOOK))
            .isInstanceOf(CrawlClientException.class)
            .hasMessageContaining("facebook");
        noCallsServer.verify();
    }
}
