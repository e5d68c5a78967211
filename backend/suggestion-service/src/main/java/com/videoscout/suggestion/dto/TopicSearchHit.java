package com.videoscout.suggestion.dto;

import java.util.Set;

/**
 * A topic-search result with the topic queries that returned it.
 */
public record TopicSearchHit(CandidateVideo video, Set<String> topics) {

    public TopicSearchHit {
        topics = Set.copyOf(topics);
    }
}
