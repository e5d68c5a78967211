package com.videoscout.suggestion.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class DiscoveryResult {

    @Builder.Default
    List<CandidateVideo> channelVideos = List.of();

    @Builder.Default
    List<TopicSearchHit> topicHits = List.of();

    int channelsChecked;
    int topicsSearched;
    int failedItems;
    boolean quotaExhausted;

    @Builder.Default
    List<String> warnings = List.of();
}
