package com.videoscout.suggestion.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Tunables for scoring, curation and quota alerting.
 *
 * Score range: each component is 0-10, weighted by rating/topic/recency weights,
 * plus the dual-source bonus for videos found by both discovery strategies.
 */
@Configuration
@ConfigurationProperties(prefix = "suggestion")
@Data
public class SuggestionProperties {

    private Scoring scoring = new Scoring();

    private Curation curation = new Curation();

    private Quota quota = new Quota();

    @Data
    public static class Scoring {
        private double ratingWeight = 0.6;

        private double topicWeight = 0.25;

        private double recencyWeight = 0.15;

        /** Flat bonus for videos found by channel tracking and topic search */
        private double dualSourceBonus = 1.0;

        /** Rating component for channels the user has not rated */
        private double neutralRating = 6.0;

        /** Topic component when the user has no topics or the video came from a tracked channel only */
        private double neutralTopic = 5.0;

        /** Ordered by maxDays ascending; first bucket that fits wins */
        private List<RecencyBucket> recencyBuckets = new ArrayList<>(List.of(
                new RecencyBucket(1, 10),
                new RecencyBucket(3, 8),
                new RecencyBucket(7, 6),
                new RecencyBucket(14, 4),
                new RecencyBucket(30, 2)
        ));

        /** Score for anything older than the last bucket */
        private double olderRecencyScore = 1.0;

        public double maxTotal() {
            return 10 * ratingWeight + 10 * topicWeight + 10 * recencyWeight + dualSourceBonus;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RecencyBucket {
        private double maxDays;
        private double score;
    }

    @Data
    public static class Curation {
        /** Generation is refused once a user has this many active pending suggestions */
        private int maxPending = 1000;

        private int maxPerRequest = 50;

        private int expiryDays = 30;

        /** Topic searches and first-time channel checks look back this far */
        private int lookbackDays = 30;

        private int maxResultsPerChannel = 50;

        private int maxResultsPerTopic = 25;

        private double defaultThreshold = 5.0;

        private String cleanupCron = "0 30 3 * * *";

        /**
         * Channel re-poll interval in days by star rating.
         * Ratings missing from the map (1 star, unrated) are only polled when never checked before,
         * except 1 star which is never polled.
         */
        private Map<Integer, Integer> refreshDays = new HashMap<>(Map.of(
                5, 5,
                4, 7,
                3, 10,
                2, 14
        ));
    }

    @Data
    public static class Quota {
        private double nearLimitFraction = 0.80;

        private double criticalFraction = 0.95;

        /** In-memory call history kept for usage statistics */
        private int historySize = 500;

        /** How often the watchdog checks the day boundary and thresholds when healthy */
        private Duration checkInterval = Duration.ofMinutes(5);

        /** Backoff ceiling for the reset watchdog after repeated failures */
        private Duration maxBackoff = Duration.ofHours(1);

        private Duration initialBackoff = Duration.ofMinutes(5);
    }
}
