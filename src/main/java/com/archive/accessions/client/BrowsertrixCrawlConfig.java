package com.archive.accessions.client;

import java.util.List;

/**
 * Crawl configuration posted to the crawl service: a single page of the seed URL, run immediately.
 */
public record BrowsertrixCrawlConfig(
    String jobType,
    String name,
    String description,
    int scale,
    String profileid,
    boolean runNow,
    String schedule,
    int crawlTimeout,
    long maxCrawlSize,
    List<String> tags,
    List<String> autoAddCollections,
    SeedsConfig config,
    String crawlerChannel,
    String proxyId
) {

    static final String BEHAVIORS = "autoscroll,autoplay,autofetch,siteSpecific";
    static final int POST_LOAD_DELAY_SECONDS = 120;
    static final long MAX_CRAWL_SIZE = 1_000_000_000L;

    public record Seed(String url, String scopeType) {}

    public record SeedsConfig(
        List<Seed> seeds,
        String scopeType,
        int extraHops,
        boolean useSitemap,
        boolean failOnFailedSeed,
        Integer behaviorTimeout,
        Integer pageLoadTimeout,
        Integer pageExtraDelay,
        int postLoadDelay,
        String userAgent,
        Integer limit,
        String lang,
        List<String> exclude,
        String behaviors
    ) {}

    /**
     * @param profileId crawl-service browser profile id, empty for none
     */
    public static BrowsertrixCrawlConfig singlePage(String url, String profileId) {
        SeedsConfig seeds = new SeedsConfig(
            List.of(new Seed(url, "page")),
            "page",
            0,
            false,
            false,
            null,
            null,
            null,
            POST_LOAD_DELAY_SECONDS,
            null,
            null,
            "en",
            List.of(),
            BEHAVIORS
        );
        return new BrowsertrixCrawlConfig(
            "custom",
            "",
            null,
            1,
            profileId == null ? "" : profileId,
            true,
            "",
            0,
            MAX_CRAWL_SIZE,
            List.of(),
            List.of(),
            seeds,
            "default",
            null
        );
    }
}
