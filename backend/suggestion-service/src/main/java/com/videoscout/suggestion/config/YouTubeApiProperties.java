package com.videoscout.suggestion.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Connection, quota and cache settings for the YouTube Data API client.
 *
 * Quota costs follow the provider's published unit costs:
 * - search.list: 100 units per call
 * - videos.list: 1 unit per call (up to 50 ids)
 */
@Configuration
@ConfigurationProperties(prefix = "suggestion.youtube")
@Data
public class YouTubeApiProperties {

    /** API key; blank means the client refuses every call with an auth failure */
    private String apiKey = "";

    private String baseUrl = "https://www.googleapis.com/youtube/v3";

    /** Daily quota budget in provider units */
    private long dailyQuotaLimit = 10_000;

    /** Concurrent outbound requests allowed */
    private int maxConcurrentRequests = 3;

    private int timeoutSeconds = 30;

    private Duration cacheTtl = Duration.ofMinutes(15);

    private int searchCacheMaxEntries = 100;

    private int videoCacheMaxEntries = 500;

    /** Provider limit for ids per videos.list call */
    private int detailBatchSize = 50;

    private int searchCost = 100;

    private int detailCost = 1;

    /**
     * videoDuration filters applied to every search, one call each.
     * medium (4-20 min) and long (20+ min) keep shorts out of the results.
     */
    private List<String> durationFilters = new ArrayList<>(List.of("medium", "long"));
}
