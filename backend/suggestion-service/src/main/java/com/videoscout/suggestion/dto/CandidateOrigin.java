package com.videoscout.suggestion.dto;

/**
 * Which discovery strategy found a candidate.
 */
public enum CandidateOrigin {
    TRACKED_CHANNEL,
    TOPIC_SEARCH,
    BOTH;

    public CandidateOrigin merge(CandidateOrigin other) {
        return this == other ? this : BOTH;
    }
}
