package com.videoscout.suggestion.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class VideoScore {

    SourcedCandidate candidate;

    double ratingScore;
    double topicScore;
    double recencyScore;
    double dualSourceBonus;

    /** Weighted sum before the bonus */
    double baseScore;
    double total;

    /** Persisted on the suggestion as-is */
    String reason;

    /** Topic names recorded as suggestion-topic links */
    List<String> reasonTopics;
}
