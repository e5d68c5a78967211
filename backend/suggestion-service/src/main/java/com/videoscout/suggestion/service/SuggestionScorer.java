package com.videoscout.suggestion.service;

import com.videoscout.suggestion.config.SuggestionProperties;
import com.videoscout.suggestion.dto.SourcedCandidate;
import com.videoscout.suggestion.dto.VideoScore;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Deterministic weighted scoring of consolidated candidates.
 *
 * Components (each 0-10):
 * - rating: channel stars x 2, neutral when unrated
 * - topic relevance: share of user topic words found in the title
 * - recency: bucketed by days since publication
 *
 * Tracked-channel-only candidates use the neutral topic score, topic-search-only candidates use
 * the channel rating when one exists and the neutral rating otherwise. Candidates found by both
 * strategies use real components plus the dual-source bonus.
 */
@Component
public class SuggestionScorer {

    private final SuggestionProperties.Scoring scoring;
    private final Clock clock;

    public SuggestionScorer(SuggestionProperties properties, Clock clock) {
        this.scoring = properties.getScoring();
        this.clock = clock;
    }

    public VideoScore score(SourcedCandidate candidate, List<String> userTopics, Map<String, Integer> ratings) {
        Integer stars = lookupStars(candidate, ratings);
        double ratingScore = stars != null ? Math.max(1, Math.min(5, stars)) * 2.0 : scoring.getNeutralRating();
        TopicRelevance relevance = topicRelevance(candidate.getVideo().getTitle(), userTopics);
        double recencyScore = recencyScore(candidate.getVideo().getPublishedAt());
        String channelName = channelName(candidate);

        List<String> reasonTopics = relevance.matchedTopics().isEmpty()
                ? new ArrayList<>(candidate.getMatchedTopics())
                : relevance.matchedTopics();

        Composition composition = switch (candidate.getOrigin()) {
            case TRACKED_CHANNEL -> new Composition(ratingScore, scoring.getNeutralTopic(), 0.0,
                    "New from " + channelName, List.of());
            case TOPIC_SEARCH -> new Composition(ratingScore, relevance.score(), 0.0,
                    "Topics: " + joinTopics(reasonTopics), reasonTopics);
            case BOTH -> new Composition(ratingScore, relevance.score(), scoring.getDualSourceBonus(),
                    channelName + " + Topics: " + joinTopics(reasonTopics), reasonTopics);
        };

        double base = composition.rating() * scoring.getRatingWeight()
                + composition.topic() * scoring.getTopicWeight()
                + recencyScore * scoring.getRecencyWeight();

        return VideoScore.builder()
                .candidate(candidate)
                .ratingScore(composition.rating())
                .topicScore(composition.topic())
                .recencyScore(recencyScore)
                .dualSourceBonus(composition.bonus())
                .baseScore(base)
                .total(base + composition.bonus())
                .reason(composition.reason())
                .reasonTopics(List.copyOf(composition.topics()))
                .build();
    }

    /**
     * 토픽 단어 매칭. 단어의 절반 이상이 제목에 포함되면 해당 토픽이 매칭된 것으로 봅니다.
     */
    public TopicRelevance topicRelevance(String title, Collection<String> userTopics) {
        if (userTopics == null || userTopics.isEmpty()) {
            return new TopicRelevance(scoring.getNeutralTopic(), List.of());
        }
        String haystack = title == null ? "" : title.toLowerCase(Locale.ROOT);
        int matchedWords = 0;
        int totalWords = 0;
        List<String> matchedTopics = new ArrayList<>();

        for (String topic : userTopics) {
            if (topic == null || topic.isBlank()) {
                continue;
            }
            String[] words = topic.trim().split("\\s+");
            totalWords += words.length;
            int topicMatches = 0;
            for (String word : words) {
                if (haystack.contains(word.toLowerCase(Locale.ROOT))) {
                    topicMatches++;
                }
            }
            matchedWords += topicMatches;
            if (topicMatches > 0 && topicMatches >= Math.ceil(words.length / 2.0)) {
                matchedTopics.add(topic);
            }
        }

        if (totalWords == 0) {
            return new TopicRelevance(scoring.getNeutralTopic(), List.of());
        }
        return new TopicRelevance(Math.min(10.0, 10.0 * matchedWords / totalWords), matchedTopics);
    }

    public double recencyScore(LocalDateTime publishedAt) {
        if (publishedAt == null) {
            return scoring.getOlderRecencyScore();
        }
        double days = Duration.between(publishedAt, LocalDateTime.now(clock)).toMillis() / 86_400_000.0;
        for (SuggestionProperties.RecencyBucket bucket : scoring.getRecencyBuckets()) {
            if (days <= bucket.getMaxDays()) {
                return bucket.getScore();
            }
        }
        return scoring.getOlderRecencyScore();
    }

    private Integer lookupStars(SourcedCandidate candidate, Map<String, Integer> ratings) {
        String channelId = candidate.getVideo().getChannelId();
        if (ratings != null && channelId != null && ratings.containsKey(channelId)) {
            return ratings.get(channelId);
        }
        return candidate.getRatingSnapshot();
    }

    private static String channelName(SourcedCandidate candidate) {
        String name = candidate.getVideo().getChannelName();
        return name != null && !name.isBlank() ? name : "a tracked channel";
    }

    private static String joinTopics(List<String> topics) {
        return topics.isEmpty() ? "related search" : String.join(", ", topics);
    }

    public record TopicRelevance(double score, List<String> matchedTopics) {
    }

    private record Composition(double rating, double topic, double bonus, String reason, List<String> topics) {
    }
}
