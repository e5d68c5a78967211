package com.videoscout.suggestion.dto;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

@Value
@Builder
public class SourcedCandidate {

    CandidateVideo video;
    CandidateOrigin origin;

    /** Topic queries that found the video; empty for tracked-channel-only candidates */
    @Builder.Default
    Set<String> matchedTopics = Set.of();

    /** User's star rating for the channel at consolidation time, null when unrated */
    Integer ratingSnapshot;

    public String getVideoId() {
        return video.getVideoId();
    }
}
